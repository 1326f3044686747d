package dev.llmrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * llm-router — budget-aware routing of chat completions across LLM backends.
 *
 * <p>Request pipeline:
 * <pre>
 * POST /v1/chat/completions → ChatOrchestrator
 *   → RoutingEngine (intent, priority, fallback chain, overrides)
 *   → ContextBuilder (pinned context, trimming to the priority's token budget)
 *   → BudgetManager (reserve against daily/monthly caps, one re-route on rejection)
 *   → ProviderDispatcher → [aggregator | local backend | placeholder]
 *   → request log + telemetry (async, best-effort)
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Config-driven: chains, tiers, rates and budgets live in application.yml</li>
 *   <li>Admission is reserve-then-commit per provider, so concurrent requests cannot overrun a cap</li>
 *   <li>Telemetry never affects the response: HTTP first, database fallback, failures swallowed</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class LlmRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmRouterApplication.class, args);
    }
}
