package dev.llmrouter.infrastructure.provider;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import dev.llmrouter.budget.BudgetManager;
import dev.llmrouter.budget.BudgetReservation;
import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.domain.enums.Intent;
import dev.llmrouter.domain.enums.Priority;
import dev.llmrouter.domain.valueobject.ChatMessage;
import dev.llmrouter.domain.valueobject.ContextInfo;
import dev.llmrouter.domain.valueobject.RouteDecision;
import dev.llmrouter.domain.valueobject.UpstreamResponse;
import dev.llmrouter.exception.ProviderCallException;
import dev.llmrouter.infrastructure.logging.RouterEventLog;
import dev.llmrouter.support.RouterFixtures;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@WireMockTest
class AggregatorProviderClientTest {

    private static final String MODEL = "anthropic/claude-sonnet-4";
    private static final String OK_BODY = """
            {
              "id": "gen-123",
              "model": "anthropic/claude-sonnet-4",
              "choices": [
                { "index": 0, "message": { "role": "assistant", "content": "Use a HashMap." }, "finish_reason": "stop" }
              ],
              "usage": { "prompt_tokens": 1200, "completion_tokens": 300, "total_tokens": 1500, "cost": 0.0042 }
            }
            """;

    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private final List<Duration> backoffs = new CopyOnWriteArrayList<>();
    private AggregatorProviderClient client;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmInfo) {
        client = clientFor(RouterFixtures.aggregator(wmInfo.getHttpBaseUrl(), "sk-test", true, Map.of()));
    }

    private AggregatorProviderClient clientFor(RouterProperties.Provider config) {
        Retry retry = AggregatorProviderClient.retryFor("openrouter", config);
        retry.getEventPublisher().onRetry(event -> backoffs.add(event.getWaitInterval()));
        return new AggregatorProviderClient("openrouter", config, WebClient.builder(), objectMapper, retry);
    }

    private static ProviderCall call() {
        RouteDecision decision = new RouteDecision("openrouter", MODEL, "deep", Intent.CODE, Priority.NORMAL,
                false, null, null, "intent=code, priority=normal, tier=deep");
        return new ProviderCall(decision, List.of(new ChatMessage("user", "fix my loop")), 256, 0.2, 40);
    }

    @Test
    @DisplayName("sends an OpenAI-style payload with auth and attribution headers")
    void sendsPayload() {
        stubFor(post(urlEqualTo("/chat/completions")).willReturn(okJson(OK_BODY)));

        UpstreamResponse response = client.complete(call());

        assertThat(response.content()).isEqualTo("Use a HashMap.");
        assertThat(response.model()).isEqualTo(MODEL);
        assertThat(response.promptTokens()).isEqualTo(1200);
        assertThat(response.completionTokens()).isEqualTo(300);
        assertThat(response.reportedCost()).isEqualByComparingTo("0.0042");
        verify(postRequestedFor(urlEqualTo("/chat/completions"))
                .withHeader("Authorization", equalTo("Bearer sk-test"))
                .withHeader("HTTP-Referer", equalTo("https://router.test"))
                .withHeader("X-Title", equalTo("router-test"))
                .withRequestBody(matchingJsonPath("$.model", equalTo(MODEL)))
                .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("256")))
                .withRequestBody(matchingJsonPath("$.messages[0].content", equalTo("fix my loop"))));
        assertThat(backoffs).isEmpty();
    }

    @Test
    @DisplayName("two 503s then success: returns the reply after exactly two backoffs and records spend once")
    void retriesTransientFailures() {
        stubFor(post(urlEqualTo("/chat/completions")).inScenario("flaky")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(503).withBody("overloaded"))
                .willSetStateTo("second"));
        stubFor(post(urlEqualTo("/chat/completions")).inScenario("flaky")
                .whenScenarioStateIs("second")
                .willReturn(aResponse().withStatus(503).withBody("overloaded"))
                .willSetStateTo("third"));
        stubFor(post(urlEqualTo("/chat/completions")).inScenario("flaky")
                .whenScenarioStateIs("third")
                .willReturn(okJson(OK_BODY)));

        RouterProperties properties = RouterFixtures.properties();
        BudgetManager budget = new BudgetManager(properties);
        ProviderDispatcher dispatcher = new ProviderDispatcher(new ProviderRegistry(properties, List.of(client)),
                budget, mock(RouterEventLog.class));
        BudgetReservation reservation = budget.tryReserve("openrouter", MODEL, 40, 256).orElseThrow();

        DispatchOutcome outcome = dispatcher.dispatch(RouterFixtures.request("fix my loop"),
                call().messages(), call().decision(), reservation, new ContextInfo(40, 40, 6000, 10000,
                        false, false, "none", 0));

        assertThat(outcome.response().content()).isEqualTo("Use a HashMap.");
        assertThat(backoffs).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
        verify(3, postRequestedFor(urlEqualTo("/chat/completions")));
        assertThat(reservation.isSettled()).isTrue();
        assertThat(budget.snapshot().get("openrouter").dailySpentUsd()).isEqualByComparingTo("0.75");
        assertThat(budget.snapshot().get("openrouter").reservedUsd()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("429 is retried like a server error")
    void retriesRateLimit() {
        stubFor(post(urlEqualTo("/chat/completions")).inScenario("limited")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(429))
                .willSetStateTo("ok"));
        stubFor(post(urlEqualTo("/chat/completions")).inScenario("limited")
                .whenScenarioStateIs("ok")
                .willReturn(okJson(OK_BODY)));

        assertThat(client.complete(call()).content()).isEqualTo("Use a HashMap.");
        assertThat(backoffs).hasSize(1);
    }

    @Test
    @DisplayName("a 400 fails immediately without retrying")
    void clientErrorIsTerminal() {
        stubFor(post(urlEqualTo("/chat/completions")).willReturn(aResponse().withStatus(400).withBody("bad model")));

        assertThatThrownBy(() -> client.complete(call()))
                .isInstanceOfSatisfying(UpstreamCallException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(400);
                    assertThat(e.isTransient()).isFalse();
                });
        verify(1, postRequestedFor(urlEqualTo("/chat/completions")));
        assertThat(backoffs).isEmpty();
    }

    @Test
    @DisplayName("gives up after three failed attempts with the last error")
    void exhaustsAttempts() {
        stubFor(post(urlEqualTo("/chat/completions")).willReturn(aResponse().withStatus(502)));

        assertThatThrownBy(() -> client.complete(call()))
                .isInstanceOfSatisfying(UpstreamCallException.class, e -> assertThat(e.getStatus()).isEqualTo(502));
        verify(3, postRequestedFor(urlEqualTo("/chat/completions")));
        assertThat(backoffs).hasSize(2);
    }

    @Test
    @DisplayName("a missing API key fails before any request is sent")
    void missingApiKey(WireMockRuntimeInfo wmInfo) {
        AggregatorProviderClient keyless = clientFor(
                RouterFixtures.aggregator(wmInfo.getHttpBaseUrl(), "", true, Map.of()));

        assertThatThrownBy(() -> keyless.complete(call()))
                .isInstanceOf(UpstreamCallException.class)
                .hasMessageContaining("API key");
        verify(0, postRequestedFor(anyUrl()));
    }

    @Test
    @DisplayName("the dispatcher releases the reservation when the call fails")
    void dispatcherReleasesOnFailure() {
        stubFor(post(urlEqualTo("/chat/completions")).willReturn(aResponse().withStatus(401)));
        RouterProperties properties = RouterFixtures.properties();
        BudgetManager budget = new BudgetManager(properties);
        ProviderDispatcher dispatcher = new ProviderDispatcher(new ProviderRegistry(properties, List.of(client)),
                budget, mock(RouterEventLog.class));
        BudgetReservation reservation = budget.tryReserve("openrouter", MODEL, 40, 256).orElseThrow();

        assertThatThrownBy(() -> dispatcher.dispatch(RouterFixtures.request("fix my loop"), call().messages(),
                call().decision(), reservation, new ContextInfo(40, 40, 6000, 10000, false, false, "none", 0)))
                .isInstanceOf(ProviderCallException.class);
        assertThat(reservation.isSettled()).isTrue();
        assertThat(budget.snapshot().get("openrouter").dailySpentUsd()).isEqualByComparingTo("0");
        assertThat(budget.snapshot().get("openrouter").reservedUsd()).isEqualByComparingTo("0");
    }
}
