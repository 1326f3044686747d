package dev.llmrouter.config;

import dev.llmrouter.domain.enums.Intent;
import dev.llmrouter.domain.enums.Priority;
import dev.llmrouter.domain.enums.ProviderKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Router rule set: fallback chains, provider tiers, rates, caps and token budgets.
 * Loaded once at startup and treated as read-only; restart to apply changes.
 */
@ConfigurationProperties(prefix = "router")
public record RouterProperties(Routing routing, Map<String, Provider> providers, Budget budget,
                               Tokens tokens, Memory memory, Logging logging, Telemetry telemetry) {
    public RouterProperties {
        if (routing == null) routing = new Routing(null, null, null, null, null);
        if (providers == null) providers = Map.of();
        if (budget == null) budget = new Budget(null, null, null, 0, null);
        if (tokens == null) tokens = new Tokens(null, null);
        if (memory == null) memory = new Memory(null, null);
        if (logging == null) logging = new Logging(null, null, null);
        if (telemetry == null) telemetry = new Telemetry(null, null, null, null);
    }

    public Optional<Provider> provider(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(providers.get(name));
    }

    public record Routing(Priority defaultPriority, Map<Intent, List<String>> intentKeywords,
                          List<String> visionHints, Map<Intent, List<ChainEntry>> fallbackChains,
                          Overrides overrides) {
        public Routing {
            if (defaultPriority == null) defaultPriority = Priority.NORMAL;
            if (intentKeywords == null) intentKeywords = new LinkedHashMap<>();
            if (visionHints == null) visionHints = List.of("image", "screenshot", "vision");
            if (fallbackChains == null) fallbackChains = new LinkedHashMap<>();
            if (overrides == null) overrides = new Overrides(null, null);
        }

        public List<ChainEntry> chainFor(Intent intent) {
            return fallbackChains.getOrDefault(intent, List.of());
        }
    }

    public record ChainEntry(String provider, String tier) {}

    public record Overrides(Boolean allowRouteOverride, Boolean allowModelOverride) {
        public Overrides {
            if (allowRouteOverride == null) allowRouteOverride = true;
            if (allowModelOverride == null) allowModelOverride = true;
        }
    }

    /**
     * One upstream backend. Timeouts and paths default by {@link ProviderKind}.
     */
    public record Provider(ProviderKind kind, Boolean enabled, String baseUrl, String apiKey,
                           String discoveryPath, String probePath, Duration timeout, Duration connectTimeout,
                           Duration discoveryTimeout, int maxAttempts, Duration backoffBase, Duration backoffCap,
                           String referer, String title, BigDecimal dailyCapUsd, BigDecimal monthlyCapUsd,
                           Map<String, Tier> tiers) {
        public Provider {
            if (kind == null) kind = ProviderKind.PLACEHOLDER;
            if (enabled == null) enabled = true;
            if (baseUrl == null) baseUrl = "";
            if (discoveryPath == null) discoveryPath = "/api/v0/models";
            if (probePath == null) probePath = "/v1/models";
            if (timeout == null) timeout = kind == ProviderKind.LOCAL ? Duration.ofSeconds(120) : Duration.ofSeconds(60);
            if (connectTimeout == null) connectTimeout = kind == ProviderKind.LOCAL ? Duration.ofSeconds(5) : Duration.ofSeconds(10);
            if (discoveryTimeout == null) discoveryTimeout = Duration.ofSeconds(4);
            if (maxAttempts <= 0) maxAttempts = 3;
            if (backoffBase == null) backoffBase = Duration.ofSeconds(1);
            if (backoffCap == null) backoffCap = Duration.ofSeconds(5);
            if (tiers == null) tiers = Map.of();
        }

        /** Default model of a tier, or empty when the tier is missing or has none. */
        public Optional<String> defaultModel(String tier) {
            Tier t = tier == null ? null : tiers.get(tier);
            if (t == null || t.defaultModel() == null || t.defaultModel().isBlank()) return Optional.empty();
            return Optional.of(t.defaultModel());
        }
    }

    public record Tier(String defaultModel) {}

    public record Budget(BigDecimal dailyCapUsd, BigDecimal monthlyCapUsd, BigDecimal fallbackRatePer1kUsd,
                         int defaultCompletionTokens, List<Rate> rates) {
        public Budget {
            if (dailyCapUsd == null) dailyCapUsd = new BigDecimal("2.00");
            if (monthlyCapUsd == null) monthlyCapUsd = new BigDecimal("60.00");
            if (fallbackRatePer1kUsd == null) fallbackRatePer1kUsd = new BigDecimal("0.5");
            if (defaultCompletionTokens <= 0) defaultCompletionTokens = 512;
            if (rates == null) rates = List.of();
        }
    }

    public record Rate(String provider, String model, BigDecimal usdPer1k) {}

    public record Tokens(TokenBudget defaults, Map<Priority, TokenBudget> priorities) {
        public Tokens {
            if (defaults == null) defaults = new TokenBudget(0, 0);
            if (priorities == null) priorities = Map.of();
        }

        public TokenBudget budgetFor(Priority priority) {
            return priorities.getOrDefault(priority, defaults);
        }
    }

    public record TokenBudget(int targetInputTokens, int hardMaxInputTokens) {
        public TokenBudget {
            if (targetInputTokens <= 0) targetInputTokens = 6000;
            if (hardMaxInputTokens <= 0) hardMaxInputTokens = 10000;
        }
    }

    public record Memory(String pinsFile, String summariesDir) {
        public Memory {
            if (pinsFile == null) pinsFile = "memory/pins.md";
            if (summariesDir == null) summariesDir = "memory/router-summaries";
        }
    }

    public record Logging(String requestLog, String errorLog, String contextLog) {
        public Logging {
            if (requestLog == null) requestLog = "logs/router-requests.log";
            if (errorLog == null) errorLog = "logs/router-errors.log";
            if (contextLog == null) contextLog = "logs/router-context.log";
        }
    }

    public record Telemetry(Boolean enabled, String url, Duration timeout, String defaultAgentName) {
        public Telemetry {
            if (enabled == null) enabled = true;
            if (url == null) url = "http://127.0.0.1:3000/api/routing";
            if (timeout == null) timeout = Duration.ofSeconds(2);
            if (defaultAgentName == null) defaultAgentName = "router";
        }
    }
}
