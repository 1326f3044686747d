package dev.llmrouter.service;

import dev.llmrouter.budget.BudgetManager;
import dev.llmrouter.dto.response.BackendProbe;
import dev.llmrouter.dto.response.HealthResponse;
import dev.llmrouter.infrastructure.provider.LocalInferenceProviderClient;
import dev.llmrouter.infrastructure.provider.ProviderRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness plus budget snapshot, live local backend probes and the last execution.
 * Never includes secrets or request bodies.
 */
@Service
public class HealthService {

    private final BudgetManager budgetManager;
    private final ProviderRegistry providerRegistry;
    private final ExecutionTracker executionTracker;
    private final Clock clock;
    private final Instant startedAt;

    public HealthService(BudgetManager budgetManager, ProviderRegistry providerRegistry,
                         ExecutionTracker executionTracker) {
        this.budgetManager = budgetManager;
        this.providerRegistry = providerRegistry;
        this.executionTracker = executionTracker;
        this.clock = Clock.systemUTC();
        this.startedAt = clock.instant();
    }

    public HealthResponse health() {
        Map<String, BackendProbe> backends = new LinkedHashMap<>();
        for (LocalInferenceProviderClient client : providerRegistry.enabledLocalClients()) {
            backends.put(client.name(), client.probe());
        }
        long uptime = Duration.between(startedAt, clock.instant()).getSeconds();
        return new HealthResponse("ok", uptime, budgetManager.snapshot(), backends,
                executionTracker.last().orElse(null));
    }
}
