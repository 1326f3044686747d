package dev.llmrouter.domain.valueobject;

import java.math.BigDecimal;

/**
 * Normalised upstream reply. Token counts are null when the backend omitted usage;
 * {@code reportedCost} is only set by aggregators that bill per call.
 */
public record UpstreamResponse(
        String id,
        String model,
        String content,
        String finishReason,
        Integer promptTokens,
        Integer completionTokens,
        BigDecimal reportedCost
) {
    public boolean hasUsage() {
        return promptTokens != null && completionTokens != null;
    }
}
