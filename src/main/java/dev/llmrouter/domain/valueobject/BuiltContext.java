package dev.llmrouter.domain.valueobject;

import java.util.List;

public record BuiltContext(List<ChatMessage> messages, ContextInfo info) {
    public BuiltContext {
        messages = List.copyOf(messages);
    }
}
