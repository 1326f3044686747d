package dev.llmrouter.infrastructure.telemetry;

import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.domain.valueobject.CallRecord;
import dev.llmrouter.infrastructure.provider.WebClients;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;

/**
 * Posts each call to the dashboard endpoint ({@code router.telemetry.url}), which stores it,
 * updates its budget view and broadcasts it live.
 */
@Component
public class HttpTelemetrySink implements TelemetrySink {

    private final String url;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;

    public HttpTelemetrySink(RouterProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        RouterProperties.Telemetry telemetry = properties.telemetry();
        this.url = telemetry.url();
        this.timeout = telemetry.timeout();
        this.objectMapper = objectMapper;
        this.webClient = WebClients.withTimeouts(webClientBuilder, timeout, timeout);
    }

    @Override
    public void record(CallRecord call) {
        webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(objectMapper.writeValueAsString(call))
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .block();
    }
}
