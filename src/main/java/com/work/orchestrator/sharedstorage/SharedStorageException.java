package com.work.orchestrator.sharedstorage;

public class SharedStorageException extends RuntimeException {

    public SharedStorageException(String message) {
        super(message);
    }
}
