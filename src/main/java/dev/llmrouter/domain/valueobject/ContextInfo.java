package dev.llmrouter.domain.valueobject;

/**
 * What the context builder decided for one request.
 */
public record ContextInfo(
        int tokensBefore,
        int tokensAfter,
        int targetInputTokens,
        int hardMaxInputTokens,
        boolean pinnedIncluded,
        boolean summarizationInvoked,
        String summarizationMethod,
        int droppedMessages
) {
    public static ContextInfo untouched(int tokens, int target, int hardMax) {
        return new ContextInfo(tokens, tokens, target, hardMax, false, false, "none", 0);
    }
}
