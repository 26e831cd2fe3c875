package com.work.orchestrator.blockchain;

/**
 * connector 在 init 时声明的能力集合（每个 connector 实例只产生一次，之后只读）。
 */
public final class Capabilities {

    /**
     * 是否能为所有参与方提供同一个全局顺序（需要一条所有参与方可见的链）。
     */
    private final boolean globalSequencer;

    public Capabilities(boolean globalSequencer) {
        this.globalSequencer = globalSequencer;
    }

    public boolean isGlobalSequencer() {
        return globalSequencer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Capabilities)) return false;
        return globalSequencer == ((Capabilities) o).globalSequencer;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(globalSequencer);
    }

    @Override
    public String toString() {
        return "Capabilities{globalSequencer=" + globalSequencer + "}";
    }
}
