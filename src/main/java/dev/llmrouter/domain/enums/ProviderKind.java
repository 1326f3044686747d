package dev.llmrouter.domain.enums;

/**
 * Closed set of upstream integrations. Each provider entry in configuration names one.
 *
 * AGGREGATOR = hosted, paid, retried | LOCAL = self-hosted, free, single attempt | PLACEHOLDER = synthetic reply
 */
public enum ProviderKind {
    AGGREGATOR("remote"), LOCAL("local"), PLACEHOLDER("stub");

    private final String executionMode;
    ProviderKind(String executionMode) { this.executionMode = executionMode; }

    public String executionMode() {
        return executionMode;
    }

    public boolean isFree() {
        return this == LOCAL;
    }
}
