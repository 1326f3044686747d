package dev.llmrouter.context;

import dev.llmrouter.config.RouterProperties.TokenBudget;
import dev.llmrouter.domain.valueobject.ChatMessage;

import java.util.List;

/**
 * Compacts a trimmed history that is still above the target budget.
 */
public interface ContextSummarizer {

    Summary summarize(List<ChatMessage> messages, TokenBudget budget);

    /**
     * @param method label recorded in the context log, e.g. {@code keep}
     */
    record Summary(List<ChatMessage> messages, String method) {}
}
