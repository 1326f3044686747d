package dev.llmrouter.infrastructure.provider;

import dev.llmrouter.domain.valueobject.ExecutionRecord;
import dev.llmrouter.domain.valueobject.UpstreamResponse;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * A completed upstream call with the token counts and cost that were committed to the budget.
 */
public record DispatchOutcome(UpstreamResponse response, int promptTokens, int completionTokens,
                              BigDecimal recordedCostUsd, ExecutionRecord execution, Duration latency) {}
