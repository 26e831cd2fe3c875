package com.work.orchestrator.eventstream;

public enum StreamState {
    NEW,
    RUNNING,
    /**
     * 检测到序列缺口，拒绝投递，等待显式 resynchronize。
     */
    FAILED,
    STOPPED
}
