package com.work.orchestrator.support.metrics;

/**
 * 默认 no-op 实现：不引入任何 metrics 依赖时工程仍可运行。
 *
 * 业务侧提供自定义 OrchestratorMetrics Bean 即可覆盖（@ConditionalOnMissingBean）。
 */
public class NoopOrchestratorMetrics implements OrchestratorMetrics {
}
