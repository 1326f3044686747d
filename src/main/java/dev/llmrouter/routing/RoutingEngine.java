package dev.llmrouter.routing;

import dev.llmrouter.budget.BudgetManager;
import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.config.RouterProperties.ChainEntry;
import dev.llmrouter.domain.enums.Intent;
import dev.llmrouter.domain.enums.Priority;
import dev.llmrouter.domain.valueobject.RouteDecision;
import dev.llmrouter.dto.request.ChatCompletionRequest;
import dev.llmrouter.dto.request.RequestMetadata;
import dev.llmrouter.exception.NoViableRouteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Picks a (provider, model) for a request from the intent's fallback chain.
 *
 * <p>The chain is walked in order and the first candidate whose provider is enabled and
 * whose tier resolves to a model wins. Metadata may force a provider (applied to every
 * chain entry, tiers kept) and/or a model (used verbatim). The result depends only on
 * the request and configuration.
 */
@Component
public class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private final RouterProperties properties;
    private final IntentClassifier intentClassifier;
    private final BudgetManager budgetManager;

    public RoutingEngine(RouterProperties properties, IntentClassifier intentClassifier, BudgetManager budgetManager) {
        this.properties = properties;
        this.intentClassifier = intentClassifier;
        this.budgetManager = budgetManager;
    }

    public RouteDecision decideRoute(ChatCompletionRequest request) {
        return decideRoute(request, null);
    }

    /**
     * @param excludedProvider provider rejected by a previous admission check; every
     *                         candidate naming it is skipped. {@code null} for a first decision.
     */
    public RouteDecision decideRoute(ChatCompletionRequest request, String excludedProvider) {
        RequestMetadata metadata = request.metadataOrEmpty();
        RouterProperties.Routing routing = properties.routing();

        Intent intent = intentClassifier.classify(request);
        Priority priority = Priority.fromWire(metadata.priority()).orElse(routing.defaultPriority());

        String forcedProvider = metadata.hasRoute() && routing.overrides().allowRouteOverride() ? metadata.route() : null;
        String forcedModel = metadata.hasModel() && routing.overrides().allowModelOverride() ? metadata.model() : null;
        boolean forced = forcedProvider != null || forcedModel != null;

        List<ChainEntry> chain = routing.chainFor(intent);
        if (forcedProvider != null) {
            chain = chain.stream().map(e -> new ChainEntry(forcedProvider, e.tier())).collect(Collectors.toList());
        }
        if (excludedProvider != null) {
            chain = chain.stream().filter(e -> !excludedProvider.equals(e.provider())).collect(Collectors.toList());
        }
        if (chain.isEmpty()) {
            throw new NoViableRouteException("No routing chain candidates for intent " + intent.wireName()
                    + (excludedProvider != null ? " excluding " + excludedProvider : ""));
        }

        for (ChainEntry candidate : chain) {
            Optional<String> model = forcedModel != null
                    ? Optional.of(forcedModel)
                    : properties.provider(candidate.provider()).flatMap(p -> p.defaultModel(candidate.tier()));
            if (model.isEmpty()) {
                log.debug("Skipping {}/{}: no model for tier", candidate.provider(), candidate.tier());
                continue;
            }
            if (!budgetManager.providerEnabled(candidate.provider())) {
                log.debug("Skipping {}: disabled or unknown", candidate.provider());
                continue;
            }

            String reason = "intent=" + intent.wireName() + ", priority=" + priority.wireName()
                    + ", tier=" + candidate.tier() + (forced ? ", forced override" : "");
            RouteDecision decision = new RouteDecision(candidate.provider(), model.get(), candidate.tier(),
                    intent, priority, forced, forcedProvider, forcedModel, reason);
            log.debug("Route decision: provider={} model={} ({})", decision.provider(), decision.model(), reason);
            return decision;
        }
        throw new NoViableRouteException("No viable provider/model in the " + intent.wireName() + " chain");
    }
}
