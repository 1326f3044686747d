package dev.llmrouter.infrastructure.provider;

import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.domain.enums.ProviderKind;
import dev.llmrouter.domain.valueobject.UpstreamResponse;
import dev.llmrouter.dto.response.BackendProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Self-hosted OpenAI-compatible backend (LM Studio, Ollama). Single attempt, long timeout.
 *
 * <p>A symbolic model name ({@code auto}, {@code local}, blank or the provider's own name)
 * is resolved to the first model the backend reports as loaded.
 */
public class LocalInferenceProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(LocalInferenceProviderClient.class);
    private static final Set<String> SYMBOLIC_MODELS = Set.of("auto", "local");
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(3);

    private final String name;
    private final RouterProperties.Provider config;
    private final ObjectMapper objectMapper;
    private final Duration discoveryTimeout;
    private final WebClient chatClient;
    private final WebClient discoveryClient;
    private final WebClient probeClient;

    public LocalInferenceProviderClient(String name, RouterProperties.Provider config, WebClient.Builder webClientBuilder,
                                        ObjectMapper objectMapper) {
        this.name = name;
        this.config = config;
        this.objectMapper = objectMapper;
        this.discoveryTimeout = config.discoveryTimeout();
        this.chatClient = WebClients.withTimeouts(webClientBuilder, config.timeout(), config.connectTimeout());
        this.discoveryClient = WebClients.withTimeouts(webClientBuilder, discoveryTimeout, config.connectTimeout());
        this.probeClient = WebClients.withTimeouts(webClientBuilder, PROBE_TIMEOUT, PROBE_TIMEOUT);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.LOCAL;
    }

    @Override
    public String host() {
        return config.baseUrl();
    }

    @Override
    public UpstreamResponse complete(ProviderCall call) {
        String model = call.decision().model();
        if (isSymbolic(model)) {
            model = discoverLoadedModel().orElseThrow(
                    () -> UpstreamCallException.terminal(name + ": no model loaded"));
            log.debug("{} resolved symbolic model to {}", name, model);
        }
        String payload = objectMapper.writeValueAsString(OpenAiWire.ChatPayload.of(call, model));
        try {
            String body = chatClient.post()
                    .uri(config.baseUrl() + "/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (body == null || body.isBlank()) {
                throw new UpstreamCallException(name + " returned an empty body", 200, false, null);
            }
            return objectMapper.readValue(body, OpenAiWire.ChatResponse.class).toUpstream(model);
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new UpstreamCallException(name + " HTTP " + status, status,
                    UpstreamCallException.isRetryableStatus(status), e);
        } catch (WebClientRequestException e) {
            throw new UpstreamCallException(name + " unreachable", 0, true, e);
        } catch (JacksonException e) {
            throw new UpstreamCallException(name + " returned an unreadable body", 200, false, e);
        }
    }

    /** First model reported with {@code state=loaded}; empty when none is or the backend does not answer. */
    public Optional<String> discoverLoadedModel() {
        try {
            String body = discoveryClient.get()
                    .uri(config.baseUrl() + config.discoveryPath())
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(discoveryTimeout)
                    .block();
            if (body == null) return Optional.empty();
            OpenAiWire.ModelList list = objectMapper.readValue(body, OpenAiWire.ModelList.class);
            if (list.data() == null) return Optional.empty();
            return list.data().stream()
                    .filter(m -> "loaded".equals(m.state()) && m.id() != null && !m.id().isBlank())
                    .map(OpenAiWire.ModelEntry::id)
                    .findFirst();
        } catch (RuntimeException e) {
            log.warn("{} model discovery failed: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    /** Read-only listing of the backend's models for the health endpoint. */
    public BackendProbe probe() {
        try {
            String body = probeClient.get()
                    .uri(config.baseUrl() + config.probePath())
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(PROBE_TIMEOUT)
                    .block();
            OpenAiWire.ModelList list = objectMapper.readValue(body == null ? "{}" : body, OpenAiWire.ModelList.class);
            List<String> models = new ArrayList<>();
            if (list.data() != null) list.data().forEach(m -> models.add(m.id() != null ? m.id() : "?"));
            if (list.models() != null) list.models().forEach(m -> models.add(m.name() != null ? m.name() : "?"));
            return BackendProbe.up(models);
        } catch (WebClientResponseException e) {
            return BackendProbe.error(e.getStatusCode().value());
        } catch (RuntimeException e) {
            return BackendProbe.down(e.getMessage());
        }
    }

    private boolean isSymbolic(String model) {
        return model == null || model.isBlank() || SYMBOLIC_MODELS.contains(model) || model.equals(name);
    }
}
