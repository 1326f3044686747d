package dev.llmrouter.infrastructure.logging;

import dev.llmrouter.domain.valueobject.ContextInfo;
import dev.llmrouter.domain.valueobject.ExecutionRecord;
import dev.llmrouter.domain.valueobject.RouteDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the three append-only router logs as one JSON object per line.
 *
 * <p>Each log is a dedicated SLF4J logger ({@code router.requests}, {@code router.errors},
 * {@code router.context}) routed to its own file by {@code logback-spring.xml}.
 * A failure to serialise or write a record is reported on the application log only.
 */
@Component
public class RouterEventLog {

    public static final String REQUESTS_LOGGER = "router.requests";
    public static final String ERRORS_LOGGER = "router.errors";
    public static final String CONTEXT_LOGGER = "router.context";

    private static final Logger log = LoggerFactory.getLogger(RouterEventLog.class);
    private static final Logger requestLog = LoggerFactory.getLogger(REQUESTS_LOGGER);
    private static final Logger errorLog = LoggerFactory.getLogger(ERRORS_LOGGER);
    private static final Logger contextLog = LoggerFactory.getLogger(CONTEXT_LOGGER);

    private final ObjectMapper objectMapper;

    public RouterEventLog(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void logRequest(RouteDecision decision, ContextInfo context, ExecutionRecord execution) {
        Map<String, Object> record = header();
        record.put("provider", decision.provider());
        record.put("model", decision.model());
        record.put("tier", decision.tier());
        record.put("intent", decision.intent().wireName());
        record.put("priority", decision.priority().wireName());
        record.put("forced_route", decision.forced());
        record.put("forced_provider", decision.forcedProvider());
        record.put("forced_model", decision.forcedModel());
        record.put("estimated_tokens_in", context.tokensAfter());
        record.put("reason", decision.reason());
        record.put("execution_target", execution.target());
        record.put("execution_host", execution.host());
        record.put("execution_mode", execution.mode());
        write(requestLog, record);
    }

    public void logContext(ContextInfo context) {
        Map<String, Object> record = header();
        record.put("method", context.summarizationMethod());
        record.put("summarization_invoked", context.summarizationInvoked());
        record.put("pinned_included", context.pinnedIncluded());
        record.put("estimated_prompt_tokens_before", context.tokensBefore());
        record.put("estimated_prompt_tokens", context.tokensAfter());
        record.put("dropped_messages", context.droppedMessages());
        record.put("target_input_tokens", context.targetInputTokens());
        record.put("hard_max_input_tokens", context.hardMaxInputTokens());
        write(contextLog, record);
    }

    public void logError(Throwable error, Map<String, ?> extra) {
        Map<String, Object> record = header();
        record.put("stage", MDC.get("stage"));
        record.put("error", error.getClass().getSimpleName());
        record.put("message", error.getMessage());
        if (error.getCause() != null) {
            record.put("cause", error.getCause().getClass().getSimpleName() + ": " + error.getCause().getMessage());
        }
        if (extra != null && !extra.isEmpty()) {
            record.put("extra", extra);
        }
        write(errorLog, record);
    }

    private static Map<String, Object> header() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("ts", Instant.now().toString());
        record.put("request_id", MDC.get("requestId"));
        return record;
    }

    private void write(Logger target, Map<String, Object> record) {
        try {
            target.info(objectMapper.writeValueAsString(record));
        } catch (RuntimeException e) {
            log.warn("Could not write {} record: {}", target.getName(), e.getMessage());
        }
    }
}
