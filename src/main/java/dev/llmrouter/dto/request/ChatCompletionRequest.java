package dev.llmrouter.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.llmrouter.domain.valueobject.ChatMessage;

import java.util.List;
import java.util.Optional;

/**
 * Inbound OpenAI-style chat request. {@code model} may be symbolic ("auto"); the router
 * decides the real one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionRequest(
        String model,
        List<ChatMessage> messages,
        @JsonProperty("max_tokens") Integer maxTokens,
        Double temperature,
        RequestMetadata metadata
) {
    public ChatCompletionRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public RequestMetadata metadataOrEmpty() {
        return metadata != null ? metadata : RequestMetadata.empty();
    }

    public Optional<ChatMessage> lastUserMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).isFromUser()) return Optional.of(messages.get(i));
        }
        return Optional.empty();
    }
}
