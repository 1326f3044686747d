package dev.llmrouter.context;

import dev.llmrouter.domain.valueobject.ChatMessage;

import java.util.List;

/**
 * Approximate prompt size of a message list. Swap the bean for a real tokenizer.
 */
public interface TokenEstimator {
    int estimate(List<ChatMessage> messages);
}
