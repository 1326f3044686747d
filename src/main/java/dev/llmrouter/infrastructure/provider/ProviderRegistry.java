package dev.llmrouter.infrastructure.provider;

import dev.llmrouter.config.RouterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Provider name to client, built once from configuration at startup.
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderClient> clients = new LinkedHashMap<>();
    private final RouterProperties properties;

    @Autowired
    public ProviderRegistry(RouterProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this(properties, createClients(properties, webClientBuilder, objectMapper));
    }

    ProviderRegistry(RouterProperties properties, Collection<? extends ProviderClient> clients) {
        this.properties = properties;
        clients.forEach(c -> this.clients.put(c.name(), c));
        log.info("Provider registry: {}", this.clients.values().stream()
                .map(c -> c.name() + "=" + c.kind().executionMode())
                .collect(Collectors.joining(", ")));
    }

    private static List<ProviderClient> createClients(RouterProperties properties, WebClient.Builder webClientBuilder,
                                                      ObjectMapper objectMapper) {
        return properties.providers().entrySet().stream()
                .map(e -> create(e.getKey(), e.getValue(), webClientBuilder, objectMapper))
                .collect(Collectors.toList());
    }

    private static ProviderClient create(String name, RouterProperties.Provider config,
                                         WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        return switch (config.kind()) {
            case AGGREGATOR -> new AggregatorProviderClient(name, config, webClientBuilder, objectMapper,
                    AggregatorProviderClient.retryFor(name, config));
            case LOCAL -> new LocalInferenceProviderClient(name, config, webClientBuilder, objectMapper);
            case PLACEHOLDER -> new PlaceholderProviderClient(name, Clock.systemUTC());
        };
    }

    public Optional<ProviderClient> find(String provider) {
        return Optional.ofNullable(clients.get(provider));
    }

    /** Enabled local backends, probed by the health endpoint. */
    public List<LocalInferenceProviderClient> enabledLocalClients() {
        return clients.values().stream()
                .filter(LocalInferenceProviderClient.class::isInstance)
                .filter(c -> properties.provider(c.name()).map(RouterProperties.Provider::enabled).orElse(false))
                .map(LocalInferenceProviderClient.class::cast)
                .collect(Collectors.toList());
    }
}
