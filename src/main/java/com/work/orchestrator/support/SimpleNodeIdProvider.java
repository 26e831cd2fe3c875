package com.work.orchestrator.support;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * 默认 nodeId：配置值优先，否则 hostname + JVM 随机后缀。
 */
public class SimpleNodeIdProvider implements NodeIdProvider {

    private final String nodeId;

    public SimpleNodeIdProvider() {
        this(null);
    }

    public SimpleNodeIdProvider(String configured) {
        this.nodeId = configured == null || configured.trim().isEmpty() ? buildNodeId() : configured.trim();
    }

    @Override
    public String getNodeId() {
        return nodeId;
    }

    private String buildNodeId() {
        try {
            String hostname = InetAddress.getLocalHost().getHostName();
            return hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
        } catch (UnknownHostException e) {
            return "unknown-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }
}
