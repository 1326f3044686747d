package dev.llmrouter.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One completed call as reported to the telemetry sink. Field names follow the sink's wire format.
 */
public record CallRecord(
        String provider,
        @JsonProperty("model_name") String modelName,
        @JsonProperty("actual_model") String actualModel,
        @JsonProperty("agent_name") String agentName,
        @JsonProperty("tokens_in") int tokensIn,
        @JsonProperty("tokens_out") int tokensOut,
        @JsonProperty("cost_usd") BigDecimal costUsd,
        @JsonProperty("latency_ms") long latencyMs
) {}
