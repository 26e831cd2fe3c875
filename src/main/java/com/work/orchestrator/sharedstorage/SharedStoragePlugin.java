package com.work.orchestrator.sharedstorage;

import com.work.orchestrator.blockchain.HexUUID;

/**
 * 链下 payload 存储。链上只 pin payloadRef，任何参与方都能凭它取回 payload。
 */
public interface SharedStoragePlugin {

    String name();

    /**
     * @return 内容寻址的 payloadRef（同样的内容得到同样的引用）
     */
    HexUUID uploadData(byte[] data);

    /**
     * @throws SharedStorageException payloadRef 不存在
     */
    byte[] downloadData(HexUUID payloadRef);
}
