package dev.llmrouter.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.llmrouter.domain.valueobject.UpstreamResponse;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * OpenAI-shaped completion returned to the caller. Usage reflects the token counts the
 * router committed to the budget.
 */
public record ChatCompletionResponse(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices,
        Usage usage
) {
    public static ChatCompletionResponse from(UpstreamResponse upstream, int promptTokens, int completionTokens,
                                              Instant now) {
        String id = upstream.id() != null && !upstream.id().isBlank()
                ? upstream.id() : "chatcmpl-" + UUID.randomUUID();
        return new ChatCompletionResponse(id, "chat.completion", now.getEpochSecond(), upstream.model(),
                List.of(new Choice(0, new Message("assistant", upstream.content()), upstream.finishReason())),
                new Usage(promptTokens, completionTokens, promptTokens + completionTokens));
    }

    public record Choice(int index, Message message, @JsonProperty("finish_reason") String finishReason) {}

    public record Message(String role, String content) {}

    public record Usage(@JsonProperty("prompt_tokens") int promptTokens,
                        @JsonProperty("completion_tokens") int completionTokens,
                        @JsonProperty("total_tokens") int totalTokens) {}
}
