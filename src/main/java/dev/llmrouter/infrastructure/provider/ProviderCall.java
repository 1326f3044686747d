package dev.llmrouter.infrastructure.provider;

import dev.llmrouter.domain.valueobject.ChatMessage;
import dev.llmrouter.domain.valueobject.RouteDecision;

import java.util.List;

/**
 * Everything a provider client needs for one upstream call.
 *
 * @param estimatedPromptTokens context estimate, used when the upstream reports no usage
 */
public record ProviderCall(RouteDecision decision, List<ChatMessage> messages, Integer maxTokens,
                           Double temperature, int estimatedPromptTokens) {
    public ProviderCall {
        messages = List.copyOf(messages);
    }
}
