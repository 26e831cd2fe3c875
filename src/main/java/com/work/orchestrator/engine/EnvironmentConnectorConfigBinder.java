package com.work.orchestrator.engine;

import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * 基于 Spring Environment 的绑定：orchestrator.blockchain.connector.* -> connector 配置对象。
 * 没有任何匹配的配置项时保持 target 的空值。
 */
public class EnvironmentConnectorConfigBinder implements ConnectorConfigBinder {

    public static final String DEFAULT_PREFIX = "orchestrator.blockchain.connector";

    private final Binder binder;
    private final String prefix;

    public EnvironmentConnectorConfigBinder(Environment environment) {
        this(environment, DEFAULT_PREFIX);
    }

    public EnvironmentConnectorConfigBinder(Environment environment, String prefix) {
        this.binder = Binder.get(requireNonNull(environment, "environment"));
        this.prefix = requireNonEmpty(prefix, "prefix");
    }

    @Override
    public <C> C bind(C target) {
        requireNonNull(target, "target");
        return binder.bind(prefix, Bindable.ofInstance(target)).orElse(target);
    }
}
