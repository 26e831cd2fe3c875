package com.work.orchestrator.engine.tracker;

/**
 * 一次 transactionUpdate 的处理结果。
 */
public enum UpdateOutcome {
    /**
     * 状态已应用（含 SUBMITTED 上的附加信息合并）。
     */
    APPLIED,
    /**
     * trackingId 尚未登记，暂存等待 track。
     */
    BUFFERED,
    /**
     * 已是终态，重复/冲突的更新被丢弃（协议违规）。
     */
    IGNORED_AFTER_TERMINAL
}
