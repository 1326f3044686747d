package dev.llmrouter.context;

import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.config.RouterProperties.TokenBudget;
import dev.llmrouter.domain.enums.Priority;
import dev.llmrouter.domain.valueobject.BuiltContext;
import dev.llmrouter.domain.valueobject.ChatMessage;
import dev.llmrouter.domain.valueobject.ContextInfo;
import dev.llmrouter.dto.request.ChatCompletionRequest;
import dev.llmrouter.infrastructure.logging.RouterEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits a conversation into the token budget of its priority.
 *
 * <ol>
 *   <li>Prepend pinned facts as one system message.</li>
 *   <li>Drop the oldest non-system messages while the estimate exceeds the hard max.</li>
 *   <li>Hand the result to the {@link ContextSummarizer} if it is still above the target.</li>
 * </ol>
 *
 * <p>System messages are never dropped, so the result can stay above the hard max when
 * nothing else is left. A failing summarizer leaves the trimmed history in place. Building
 * never fails the request: on any other error the original messages go through unchanged.
 */
@Component
public class ContextBuilder {

    static final String PINNED_HEADER = "Pinned context:\n";

    private static final Logger log = LoggerFactory.getLogger(ContextBuilder.class);

    private final RouterProperties properties;
    private final TokenEstimator tokenEstimator;
    private final PinnedContextStore pinnedContextStore;
    private final ContextSummarizer summarizer;
    private final RouterEventLog eventLog;

    public ContextBuilder(RouterProperties properties, TokenEstimator tokenEstimator,
                          PinnedContextStore pinnedContextStore, ContextSummarizer summarizer,
                          RouterEventLog eventLog) {
        this.properties = properties;
        this.tokenEstimator = tokenEstimator;
        this.pinnedContextStore = pinnedContextStore;
        this.summarizer = summarizer;
        this.eventLog = eventLog;
    }

    public BuiltContext build(ChatCompletionRequest request) {
        Priority priority = Priority.fromWire(request.metadataOrEmpty().priority())
                .orElse(properties.routing().defaultPriority());
        return build(request, priority);
    }

    public BuiltContext build(ChatCompletionRequest request, Priority priority) {
        TokenBudget budget = properties.tokens().budgetFor(priority);
        BuiltContext built;
        try {
            built = trim(request.messages(), budget);
        } catch (RuntimeException e) {
            log.warn("Context build failed, passing messages through: {}", e.getMessage());
            int tokens = safeEstimate(request.messages());
            built = new BuiltContext(request.messages(),
                    ContextInfo.untouched(tokens, budget.targetInputTokens(), budget.hardMaxInputTokens()));
        }
        eventLog.logContext(built.info());
        return built;
    }

    private BuiltContext trim(List<ChatMessage> original, TokenBudget budget) {
        List<ChatMessage> messages = new ArrayList<>(original);

        List<String> pins = pinnedContextStore.loadPins();
        boolean pinned = !pins.isEmpty();
        if (pinned) {
            ChatMessage pinMessage = ChatMessage.system(PINNED_HEADER + String.join("\n", pins));
            if (messages.isEmpty() || !messages.get(0).equals(pinMessage)) {
                messages.add(0, pinMessage);
            }
        }

        int before = tokenEstimator.estimate(messages);
        int tokens = before;
        int dropped = 0;
        while (tokens > budget.hardMaxInputTokens()) {
            int oldest = firstUnprotected(messages);
            if (oldest < 0) break;
            messages.remove(oldest);
            dropped++;
            tokens = tokenEstimator.estimate(messages);
        }
        if (dropped > 0) {
            log.debug("Dropped {} message(s): {} -> {} tokens (hard max {})",
                    dropped, before, tokens, budget.hardMaxInputTokens());
        }

        boolean summarized = false;
        String method = "none";
        if (tokens > budget.targetInputTokens()) {
            try {
                ContextSummarizer.Summary summary = summarizer.summarize(messages, budget);
                messages = new ArrayList<>(summary.messages());
                summarized = true;
                method = summary.method();
                tokens = tokenEstimator.estimate(messages);
            } catch (RuntimeException e) {
                log.warn("Summarization failed, keeping the trimmed history: {}", e.getMessage());
            }
        }

        return new BuiltContext(messages, new ContextInfo(before, tokens, budget.targetInputTokens(),
                budget.hardMaxInputTokens(), pinned, summarized, method, dropped));
    }

    private static int firstUnprotected(List<ChatMessage> messages) {
        for (int i = 0; i < messages.size(); i++) {
            if (!messages.get(i).isProtected()) return i;
        }
        return -1;
    }

    private int safeEstimate(List<ChatMessage> messages) {
        try {
            return tokenEstimator.estimate(messages);
        } catch (RuntimeException e) {
            return 0;
        }
    }
}
