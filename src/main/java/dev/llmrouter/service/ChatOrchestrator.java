package dev.llmrouter.service;

import dev.llmrouter.budget.BudgetManager;
import dev.llmrouter.budget.BudgetReservation;
import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.context.ContextBuilder;
import dev.llmrouter.domain.enums.PipelineStage;
import dev.llmrouter.domain.enums.ProviderKind;
import dev.llmrouter.domain.valueobject.BuiltContext;
import dev.llmrouter.domain.valueobject.CallRecord;
import dev.llmrouter.domain.valueobject.RouteDecision;
import dev.llmrouter.domain.valueobject.UpstreamResponse;
import dev.llmrouter.dto.request.ChatCompletionRequest;
import dev.llmrouter.dto.request.RequestMetadata;
import dev.llmrouter.dto.response.ChatCompletionResponse;
import dev.llmrouter.exception.BudgetExceededException;
import dev.llmrouter.exception.NoViableRouteException;
import dev.llmrouter.exception.ProviderCallException;
import dev.llmrouter.exception.RouterInternalException;
import dev.llmrouter.infrastructure.logging.RouterEventLog;
import dev.llmrouter.infrastructure.provider.DispatchOutcome;
import dev.llmrouter.infrastructure.provider.ProviderDispatcher;
import dev.llmrouter.infrastructure.telemetry.TelemetryPublisher;
import dev.llmrouter.routing.RoutingEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one chat request through the router pipeline.
 *
 * <pre>
 *  1. ROUTE          pick provider and model from the intent's fallback chain
 *  2. BUILD_CONTEXT  pins, trimming to the priority's token budget
 *  3. ADMIT          reserve the estimated cost; on refusal re-route once, excluding
 *                    the refused provider, and try again
 *  4. DISPATCH       upstream call; the reservation is committed or released
 *  5. RECORD         request log, last execution, metrics
 *  6. TELEMETRY      async, never fails the request
 * </pre>
 *
 * <p>Failures map to exactly three client-visible outcomes besides success: no viable
 * route (503), budget exhausted (429) and internal error (500, generic message).
 */
@Service
public class ChatOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChatOrchestrator.class);

    static final String MDC_REQUEST_ID = "requestId";
    static final String MDC_STAGE = "stage";

    private final RoutingEngine routingEngine;
    private final ContextBuilder contextBuilder;
    private final BudgetManager budgetManager;
    private final ProviderDispatcher dispatcher;
    private final RouterEventLog eventLog;
    private final ExecutionTracker executionTracker;
    private final TelemetryPublisher telemetryPublisher;
    private final MeterRegistry meterRegistry;
    private final RouterProperties properties;

    public ChatOrchestrator(RoutingEngine routingEngine, ContextBuilder contextBuilder, BudgetManager budgetManager,
                            ProviderDispatcher dispatcher, RouterEventLog eventLog, ExecutionTracker executionTracker,
                            TelemetryPublisher telemetryPublisher, MeterRegistry meterRegistry,
                            RouterProperties properties) {
        this.routingEngine = routingEngine;
        this.contextBuilder = contextBuilder;
        this.budgetManager = budgetManager;
        this.dispatcher = dispatcher;
        this.eventLog = eventLog;
        this.executionTracker = executionTracker;
        this.telemetryPublisher = telemetryPublisher;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    public ChatCompletionResponse complete(ChatCompletionRequest request) {
        if (request.messages().isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        String requestId = UUID.randomUUID().toString();
        MDC.put(MDC_REQUEST_ID, requestId);
        String provider = "none";
        try {
            stage(PipelineStage.ROUTE);
            RouteDecision decision = routingEngine.decideRoute(request);
            provider = decision.provider();

            stage(PipelineStage.BUILD_CONTEXT);
            BuiltContext context = contextBuilder.build(request, decision.priority());

            stage(PipelineStage.ADMIT);
            Admission admission = admit(request, decision, context);
            decision = admission.decision();
            provider = decision.provider();

            stage(PipelineStage.DISPATCH);
            DispatchOutcome outcome = dispatcher.dispatch(request, context.messages(), decision,
                    admission.reservation(), context.info());

            stage(PipelineStage.RECORD);
            eventLog.logRequest(decision, context.info(), outcome.execution());
            executionTracker.record(outcome.execution());
            meterRegistry.timer("router.dispatch.duration", "provider", provider).record(outcome.latency());
            count("success", provider);

            stage(PipelineStage.TELEMETRY);
            publishTelemetry(request, decision, outcome);

            stage(PipelineStage.DONE);
            log.info("Completed via {} model={} in {} ms", provider, outcome.response().model(),
                    outcome.latency().toMillis());
            return ChatCompletionResponse.from(outcome.response(), outcome.promptTokens(),
                    outcome.completionTokens(), Instant.now());
        } catch (NoViableRouteException e) {
            count("no_route", provider);
            throw e;
        } catch (BudgetExceededException e) {
            count("budget_exhausted", provider);
            throw e;
        } catch (ProviderCallException e) {
            log.error("Upstream call to {} failed: {}", e.getProvider(), e.getMessage());
            count("upstream_error", provider);
            throw new RouterInternalException(requestId, e);
        } catch (RuntimeException e) {
            log.error("Router error at stage {}", MDC.get(MDC_STAGE), e);
            eventLog.logError(e, Map.of("provider", provider));
            count("error", provider);
            throw new RouterInternalException(requestId, e);
        } finally {
            MDC.remove(MDC_STAGE);
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private Admission admit(ChatCompletionRequest request, RouteDecision decision, BuiltContext context) {
        int promptTokens = context.info().tokensAfter();
        int completionTokens = request.maxTokens() != null && request.maxTokens() > 0
                ? request.maxTokens() : properties.budget().defaultCompletionTokens();

        Optional<BudgetReservation> reservation = budgetManager.tryReserve(
                decision.provider(), decision.model(), promptTokens, completionTokens);
        if (reservation.isPresent()) {
            return new Admission(decision, reservation.get());
        }

        RouteDecision alternate;
        try {
            alternate = routingEngine.decideRoute(request, decision.provider());
        } catch (NoViableRouteException e) {
            log.warn("{} over budget and no alternate provider: {}", decision.provider(), e.getMessage());
            throw new BudgetExceededException(List.of(decision.provider()));
        }
        reservation = budgetManager.tryReserve(alternate.provider(), alternate.model(), promptTokens, completionTokens);
        if (reservation.isEmpty()) {
            throw new BudgetExceededException(List.of(decision.provider(), alternate.provider()));
        }
        log.info("Re-routed from {} to {}: budget", decision.provider(), alternate.provider());
        return new Admission(alternate, reservation.get());
    }

    private void publishTelemetry(ChatCompletionRequest request, RouteDecision decision, DispatchOutcome outcome) {
        UpstreamResponse response = outcome.response();
        boolean local = ProviderKind.LOCAL.executionMode().equals(outcome.execution().mode());
        RequestMetadata metadata = request.metadataOrEmpty();
        BigDecimal cost = response.reportedCost() != null ? response.reportedCost() : outcome.recordedCostUsd();
        CallRecord call = new CallRecord(
                local ? "local" : decision.provider(),
                decision.model(),
                response.model(),
                metadata.hasRoute() ? metadata.route() : properties.telemetry().defaultAgentName(),
                outcome.promptTokens(),
                outcome.completionTokens(),
                cost,
                outcome.latency().toMillis());
        try {
            telemetryPublisher.publish(call);
        } catch (RuntimeException e) {
            log.warn("Telemetry hand-off failed: {}", e.getMessage());
        }
    }

    private void count(String outcome, String provider) {
        meterRegistry.counter("router.requests", "outcome", outcome, "provider", provider).increment();
    }

    private static void stage(PipelineStage stage) {
        MDC.put(MDC_STAGE, stage.name());
    }

    private record Admission(RouteDecision decision, BudgetReservation reservation) {}
}
