package dev.llmrouter.infrastructure.provider;

import dev.llmrouter.budget.BudgetManager;
import dev.llmrouter.budget.BudgetReservation;
import dev.llmrouter.domain.valueobject.ChatMessage;
import dev.llmrouter.domain.valueobject.ContextInfo;
import dev.llmrouter.domain.valueobject.ExecutionRecord;
import dev.llmrouter.domain.valueobject.RouteDecision;
import dev.llmrouter.domain.valueobject.UpstreamResponse;
import dev.llmrouter.dto.request.ChatCompletionRequest;
import dev.llmrouter.exception.ProviderCallException;
import dev.llmrouter.infrastructure.logging.RouterEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends an admitted request to its provider and settles the budget reservation.
 *
 * <p>Success commits the reservation once, using upstream usage when reported and the
 * context estimate otherwise. Failure releases it, so a failed call never counts as spend.
 */
@Component
public class ProviderDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ProviderDispatcher.class);

    private final ProviderRegistry registry;
    private final BudgetManager budgetManager;
    private final RouterEventLog eventLog;

    public ProviderDispatcher(ProviderRegistry registry, BudgetManager budgetManager, RouterEventLog eventLog) {
        this.registry = registry;
        this.budgetManager = budgetManager;
        this.eventLog = eventLog;
    }

    public DispatchOutcome dispatch(ChatCompletionRequest request, List<ChatMessage> messages, RouteDecision decision,
                                    BudgetReservation reservation, ContextInfo context) {
        ProviderClient client = registry.find(decision.provider()).orElse(null);
        if (client == null) {
            budgetManager.release(reservation);
            ProviderCallException failure = new ProviderCallException(decision.provider(),
                    "No client registered for " + decision.provider(), null);
            eventLog.logError(failure, Map.of("provider", decision.provider()));
            throw failure;
        }

        ProviderCall call = new ProviderCall(decision, messages, request.maxTokens(), request.temperature(),
                context.tokensAfter());
        log.info("Calling {} ({}) model={}", client.name(), client.kind().executionMode(), decision.model());
        Instant start = Instant.now();
        UpstreamResponse response;
        try {
            response = client.complete(call);
        } catch (RuntimeException e) {
            budgetManager.release(reservation);
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("provider", decision.provider());
            extra.put("model", decision.model());
            if (e instanceof UpstreamCallException upstream) extra.put("status", upstream.getStatus());
            eventLog.logError(e, extra);
            throw new ProviderCallException(decision.provider(), e.getMessage(), e);
        }
        Duration latency = Duration.between(start, Instant.now());

        int promptTokens = response.promptTokens() != null ? response.promptTokens() : context.tokensAfter();
        int completionTokens = response.completionTokens() != null ? response.completionTokens() : 0;
        BigDecimal cost = budgetManager.commit(reservation, promptTokens, completionTokens);

        ExecutionRecord execution = new ExecutionRecord(client.name(), client.host(), client.kind().executionMode(),
                response.model(), Instant.now());
        return new DispatchOutcome(response, promptTokens, completionTokens, cost, execution, latency);
    }
}
