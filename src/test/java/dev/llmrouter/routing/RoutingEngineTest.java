package dev.llmrouter.routing;

import dev.llmrouter.budget.BudgetManager;
import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.config.RouterProperties.ChainEntry;
import dev.llmrouter.domain.enums.Intent;
import dev.llmrouter.domain.enums.Priority;
import dev.llmrouter.domain.valueobject.ChatMessage;
import dev.llmrouter.domain.valueobject.RouteDecision;
import dev.llmrouter.dto.request.ChatCompletionRequest;
import dev.llmrouter.exception.NoViableRouteException;
import dev.llmrouter.support.RouterFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.llmrouter.support.RouterFixtures.metadata;
import static dev.llmrouter.support.RouterFixtures.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutingEngineTest {

    private RoutingEngine engine = engineFor(RouterFixtures.properties());

    private static RoutingEngine engineFor(RouterProperties properties) {
        return new RoutingEngine(properties, new IntentClassifier(properties), new BudgetManager(properties));
    }

    @Nested
    @DisplayName("intent detection")
    class IntentDetection {

        @Test
        @DisplayName("declared code intent without priority takes the first enabled code candidate")
        void declaredCodeIntentUsesDefaultPriority() {
            RouteDecision decision = engine.decideRoute(request(metadata("code", null, null, null),
                    new ChatMessage("user", "hello there")));

            assertThat(decision.intent()).isEqualTo(Intent.CODE);
            assertThat(decision.priority()).isEqualTo(Priority.NORMAL);
            assertThat(decision.provider()).isEqualTo("openrouter");
            assertThat(decision.model()).isEqualTo("anthropic/claude-sonnet-4");
            assertThat(decision.tier()).isEqualTo("deep");
            assertThat(decision.forced()).isFalse();
            assertThat(decision.reason()).isEqualTo("intent=code, priority=normal, tier=deep");
        }

        @Test
        @DisplayName("keywords in the last user message select the intent, case-insensitively")
        void keywordsSelectIntent() {
            RouteDecision decision = engine.decideRoute(request("Please REFACTOR this function"));

            assertThat(decision.intent()).isEqualTo(Intent.CODE);
        }

        @Test
        @DisplayName("only the most recent user message is scanned")
        void scansLastUserMessageOnly() {
            ChatCompletionRequest req = request(null,
                    new ChatMessage("user", "here is a stack trace"),
                    new ChatMessage("assistant", "looks like a null pointer"),
                    new ChatMessage("user", "thanks, tell me a joke"));

            assertThat(engine.decideRoute(req).intent()).isEqualTo(Intent.CHAT);
        }

        @Test
        @DisplayName("vision hints apply after configured keywords")
        void visionHints() {
            assertThat(engine.decideRoute(request("what is in this screenshot?")).intent()).isEqualTo(Intent.VISION);
        }

        @Test
        @DisplayName("unknown metadata intent falls back to inference and priority to the default")
        void invalidMetadataIsIgnored() {
            RouteDecision decision = engine.decideRoute(request(metadata("poetry", "urgent", null, null),
                    new ChatMessage("user", "analyze this step by step")));

            assertThat(decision.intent()).isEqualTo(Intent.REASONING);
            assertThat(decision.priority()).isEqualTo(Priority.NORMAL);
        }
    }

    @Nested
    @DisplayName("overrides")
    class Overrides {

        @Test
        @DisplayName("route and model overrides round-trip regardless of intent")
        void routeAndModelOverride() {
            RouteDecision decision = engine.decideRoute(request(metadata(null, "high", "backup", "vendor/custom"),
                    new ChatMessage("user", "what is in this image")));

            assertThat(decision.provider()).isEqualTo("backup");
            assertThat(decision.model()).isEqualTo("vendor/custom");
            assertThat(decision.forced()).isTrue();
            assertThat(decision.forcedProvider()).isEqualTo("backup");
            assertThat(decision.forcedModel()).isEqualTo("vendor/custom");
            assertThat(decision.reason()).endsWith(", forced override");
        }

        @Test
        @DisplayName("route override keeps chain tiers and skips tiers the provider lacks")
        void routeOverrideKeepsTiers() {
            RouteDecision decision = engine.decideRoute(request(metadata("code", null, "backup", null),
                    new ChatMessage("user", "x")));

            assertThat(decision.provider()).isEqualTo("backup");
            assertThat(decision.tier()).isEqualTo("deep");
            assertThat(decision.model()).isEqualTo("deepseek/deepseek-r1");
        }

        @Test
        @DisplayName("overrides are ignored when configuration disallows them")
        void overridesDisabled() {
            RouterProperties base = RouterFixtures.properties();
            RouterProperties.Routing routing = new RouterProperties.Routing(Priority.NORMAL,
                    RouterFixtures.defaultKeywords(), null, RouterFixtures.defaultChains(),
                    new RouterProperties.Overrides(false, false));
            RoutingEngine locked = engineFor(new RouterProperties(routing, base.providers(), base.budget(),
                    null, null, null, null));

            RouteDecision decision = locked.decideRoute(request(metadata("code", null, "backup", "vendor/custom"),
                    new ChatMessage("user", "x")));

            assertThat(decision.provider()).isEqualTo("openrouter");
            assertThat(decision.forced()).isFalse();
        }
    }

    @Nested
    @DisplayName("failure and re-routing")
    class Failures {

        @Test
        @DisplayName("a chain whose providers are all disabled has no viable route")
        void allDisabled() {
            assertThatThrownBy(() -> engine.decideRoute(request(metadata("verify", null, null, null),
                    new ChatMessage("user", "x"))))
                    .isInstanceOf(NoViableRouteException.class);
        }

        @Test
        @DisplayName("an intent with no chain has no viable route")
        void missingChain() {
            Map<Intent, List<ChainEntry>> chains = new LinkedHashMap<>(RouterFixtures.defaultChains());
            chains.remove(Intent.CHAT);
            RoutingEngine sparse = engineFor(RouterFixtures.properties(RouterFixtures.defaultProviders(), chains,
                    RouterFixtures.properties().budget()));

            assertThatThrownBy(() -> sparse.decideRoute(request("hi")))
                    .isInstanceOf(NoViableRouteException.class)
                    .hasMessageContaining("chat");
        }

        @Test
        @DisplayName("re-routing skips every candidate of the rejected provider")
        void excludesRejectedProvider() {
            ChatCompletionRequest req = request(metadata("code", null, null, null), new ChatMessage("user", "x"));

            RouteDecision alternate = engine.decideRoute(req, "openrouter");

            assertThat(alternate.provider()).isEqualTo("backup");
            assertThat(alternate.model()).isEqualTo("mistral/mistral-small");
        }

        @Test
        @DisplayName("re-routing with no other provider fails")
        void noAlternate() {
            ChatCompletionRequest req = request(metadata("vision", null, null, null), new ChatMessage("user", "x"));

            assertThatThrownBy(() -> engine.decideRoute(req, "openrouter"))
                    .isInstanceOf(NoViableRouteException.class);
        }
    }

    @Test
    @DisplayName("identical requests and configuration yield identical decisions")
    void deterministic() {
        ChatCompletionRequest req = request("can you verify this compile error");

        RouteDecision first = engine.decideRoute(req);
        RouteDecision second = engineFor(RouterFixtures.properties()).decideRoute(req);

        assertThat(second).isEqualTo(first);
    }
}
