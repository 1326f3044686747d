package dev.llmrouter.domain.enums;

/**
 * Lifecycle: ROUTE → BUILD_CONTEXT → ADMIT → DISPATCH → RECORD → TELEMETRY → DONE
 * (ADMIT may loop back to ROUTE once, excluding the rejected provider)
 */
public enum PipelineStage {
    ROUTE, BUILD_CONTEXT, ADMIT, DISPATCH, RECORD, TELEMETRY, DONE
}
