package dev.llmrouter.infrastructure.provider;

import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.domain.enums.ProviderKind;
import dev.llmrouter.domain.valueobject.UpstreamResponse;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Hosted, paid aggregator speaking the OpenAI chat API (OpenRouter and the like).
 *
 * <p>5xx, 429 and connection failures are retried with capped exponential backoff;
 * any other 4xx and a missing API key fail immediately.
 */
public class AggregatorProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(AggregatorProviderClient.class);

    private final String name;
    private final RouterProperties.Provider config;
    private final ObjectMapper objectMapper;
    private final Retry retry;
    private final WebClient webClient;

    public AggregatorProviderClient(String name, RouterProperties.Provider config, WebClient.Builder webClientBuilder,
                                    ObjectMapper objectMapper, Retry retry) {
        this.name = name;
        this.config = config;
        this.objectMapper = objectMapper;
        this.retry = retry;
        this.webClient = WebClients.withTimeouts(webClientBuilder, config.timeout(), config.connectTimeout());
    }

    /** Retry policy from the provider's attempts and backoff settings. */
    public static Retry retryFor(String name, RouterProperties.Provider config) {
        long base = config.backoffBase().toMillis();
        long cap = config.backoffCap().toMillis();
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(config.maxAttempts())
                .intervalFunction(attempt -> Math.min(base * (1L << Math.min(attempt - 1, 30)), cap))
                .retryOnException(e -> e instanceof UpstreamCallException u && u.isTransient())
                .build();
        return Retry.of(name, retryConfig);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.AGGREGATOR;
    }

    @Override
    public String host() {
        return config.baseUrl();
    }

    @Override
    public UpstreamResponse complete(ProviderCall call) {
        if (config.apiKey() == null || config.apiKey().isBlank()) {
            throw UpstreamCallException.terminal("API key for " + name + " is not configured");
        }
        String model = call.decision().model();
        String payload = objectMapper.writeValueAsString(OpenAiWire.ChatPayload.of(call, model));
        String body = Retry.decorateSupplier(retry, () -> post(payload)).get();
        try {
            return objectMapper.readValue(body, OpenAiWire.ChatResponse.class).toUpstream(model);
        } catch (JacksonException e) {
            throw new UpstreamCallException(name + " returned an unreadable body", 200, false, e);
        }
    }

    private String post(String payload) {
        try {
            String body = webClient.post()
                    .uri(config.baseUrl() + "/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.apiKey())
                    .header("HTTP-Referer", config.referer() != null ? config.referer() : "")
                    .header("X-Title", config.title() != null ? config.title() : "")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (body == null || body.isBlank()) {
                throw new UpstreamCallException(name + " returned an empty body", 200, false, null);
            }
            return body;
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            String snippet = e.getResponseBodyAsString();
            log.warn("{} HTTP {}: {}", name, status, snippet.length() > 500 ? snippet.substring(0, 500) : snippet);
            throw new UpstreamCallException(name + " HTTP " + status, status,
                    UpstreamCallException.isRetryableStatus(status), e);
        } catch (WebClientRequestException e) {
            log.warn("{} unreachable: {}", name, e.getMessage());
            throw new UpstreamCallException(name + " unreachable", 0, true, e);
        }
    }
}
