package dev.llmrouter.infrastructure.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.llmrouter.domain.valueobject.ChatMessage;
import dev.llmrouter.domain.valueobject.UpstreamResponse;

import java.math.BigDecimal;
import java.util.List;

/**
 * JSON shapes of the OpenAI-compatible chat API spoken by aggregators and local backends.
 */
final class OpenAiWire {

    private OpenAiWire() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ChatPayload(String model, List<ChatMessage> messages,
                       @JsonProperty("max_tokens") Integer maxTokens, Double temperature) {

        static ChatPayload of(ProviderCall call, String model) {
            return new ChatPayload(model, call.messages(), call.maxTokens(), call.temperature());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(String id, String model, List<Choice> choices, Usage usage) {

        UpstreamResponse toUpstream(String fallbackModel) {
            Choice first = choices == null || choices.isEmpty() ? null : choices.get(0);
            String content = first != null && first.message() != null ? first.message().content() : "";
            String finish = first != null && first.finishReason() != null ? first.finishReason() : "stop";
            return new UpstreamResponse(
                    id,
                    model != null && !model.isBlank() ? model : fallbackModel,
                    content != null ? content : "",
                    finish,
                    usage != null ? usage.promptTokens() : null,
                    usage != null ? usage.completionTokens() : null,
                    usage != null ? usage.cost() : null);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Integer index, Message message, @JsonProperty("finish_reason") String finishReason) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Usage(@JsonProperty("prompt_tokens") Integer promptTokens,
                 @JsonProperty("completion_tokens") Integer completionTokens,
                 BigDecimal cost) {}

    /** Model listings: OpenAI style {@code data[]} or Ollama style {@code models[]}. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ModelList(List<ModelEntry> data, List<ModelEntry> models) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ModelEntry(String id, String name, String state) {}
}
