package dev.llmrouter.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.llmrouter.domain.valueobject.ExecutionRecord;
import dev.llmrouter.domain.valueobject.ProviderSpend;

import java.util.Map;

public record HealthResponse(
        String status,
        @JsonProperty("uptime_seconds") long uptimeSeconds,
        Map<String, ProviderSpend> providers,
        @JsonProperty("local_backends") Map<String, BackendProbe> localBackends,
        @JsonProperty("last_execution") ExecutionRecord lastExecution
) {}
