package dev.llmrouter.domain.valueobject;

import dev.llmrouter.domain.enums.Intent;
import dev.llmrouter.domain.enums.Priority;

/**
 * Where one request goes. A re-route produces a new instance; {@code model} is never blank.
 */
public record RouteDecision(
        String provider,
        String model,
        String tier,
        Intent intent,
        Priority priority,
        boolean forced,
        String forcedProvider,
        String forcedModel,
        String reason
) {}
