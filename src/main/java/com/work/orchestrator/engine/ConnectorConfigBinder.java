package com.work.orchestrator.engine;

/**
 * 把宿主配置绑定到 connector 的配置结构上。
 */
public interface ConnectorConfigBinder {

    /**
     * @param target configInterface() 返回的空值实例
     * @return 绑定后的实例（通常就是 target）
     */
    <C> C bind(C target);
}
