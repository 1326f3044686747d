package dev.llmrouter.budget;

import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.domain.valueobject.ProviderSpend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-provider daily and monthly spend caps.
 *
 * <p>Cost of a call is {@code (prompt + completion) / 1000 * rate}, where the rate comes
 * from {@code router.budget.rates} for the (provider, model) pair, falling back to
 * {@code router.budget.fallback-rate-per-1k-usd}. Local providers cost nothing.
 *
 * <p>The orchestrator admits a call with {@link #tryReserve}, which holds the estimated
 * cost against the caps while the call is in flight, and later settles it with
 * {@link #commit} or {@link #release}. {@link #canSpend} and {@link #recordSpend} are the
 * plain check and add operations, usable on their own.
 *
 * <p>Accumulators live in memory and start at zero; they are not reset by the router.
 */
@Component
public class BudgetManager {

    private static final Logger log = LoggerFactory.getLogger(BudgetManager.class);
    private static final int MONEY_SCALE = 8;
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final RouterProperties properties;
    private final Map<String, ProviderBudgetState> states = new HashMap<>();
    private final Map<String, BigDecimal> rates = new HashMap<>();

    public BudgetManager(RouterProperties properties) {
        this.properties = properties;
        RouterProperties.Budget budget = properties.budget();
        properties.providers().forEach((name, provider) -> states.put(name, new ProviderBudgetState(
                provider.enabled(),
                provider.dailyCapUsd() != null ? provider.dailyCapUsd() : budget.dailyCapUsd(),
                provider.monthlyCapUsd() != null ? provider.monthlyCapUsd() : budget.monthlyCapUsd())));
        for (RouterProperties.Rate rate : budget.rates()) {
            rates.put(rateKey(rate.provider(), rate.model()), rate.usdPer1k());
        }
    }

    public boolean providerEnabled(String provider) {
        ProviderBudgetState state = provider == null ? null : states.get(provider);
        return state != null && state.isEnabled();
    }

    public BigDecimal estimateCost(String provider, String model, int promptTokens, int completionTokens) {
        long total = (long) Math.max(0, promptTokens) + Math.max(0, completionTokens);
        return BigDecimal.valueOf(total)
                .multiply(ratePer1k(provider, model))
                .divide(THOUSAND, MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /** True when the call's estimated cost keeps the provider within both caps. Never mutates state. */
    public boolean canSpend(String provider, String model, int promptTokens, int completionTokens) {
        ProviderBudgetState state = provider == null ? null : states.get(provider);
        return state != null && state.fits(estimateCost(provider, model, promptTokens, completionTokens));
    }

    /** Adds the call's cost to both accumulators regardless of the caps. Unknown providers are ignored. */
    public void recordSpend(String provider, String model, int promptTokens, int completionTokens) {
        ProviderBudgetState state = provider == null ? null : states.get(provider);
        if (state == null) return;
        state.record(estimateCost(provider, model, promptTokens, completionTokens));
    }

    public Optional<BudgetReservation> tryReserve(String provider, String model, int promptTokens, int completionTokens) {
        ProviderBudgetState state = provider == null ? null : states.get(provider);
        if (state == null) return Optional.empty();
        BigDecimal estimate = estimateCost(provider, model, promptTokens, completionTokens);
        if (!state.tryReserve(estimate)) {
            log.info("Admission refused for {}/{}: estimate {} USD over cap", provider, model, estimate.toPlainString());
            return Optional.empty();
        }
        return Optional.of(new BudgetReservation(provider, model, estimate));
    }

    /**
     * Records the final cost of a reserved call and frees the reservation.
     *
     * @return the cost recorded, or zero when the reservation was already settled
     */
    public BigDecimal commit(BudgetReservation reservation, int promptTokens, int completionTokens) {
        if (!reservation.markSettled()) {
            log.warn("Ignoring second settlement of {}", reservation);
            return BigDecimal.ZERO;
        }
        BigDecimal actual = estimateCost(reservation.provider(), reservation.model(), promptTokens, completionTokens);
        states.get(reservation.provider()).settle(reservation.amount(), actual);
        return actual;
    }

    public void release(BudgetReservation reservation) {
        if (!reservation.markSettled()) {
            log.warn("Ignoring second settlement of {}", reservation);
            return;
        }
        states.get(reservation.provider()).release(reservation.amount());
    }

    public Map<String, ProviderSpend> snapshot() {
        Map<String, ProviderSpend> view = new TreeMap<>();
        states.forEach((name, state) -> view.put(name, state.snapshot()));
        return Collections.unmodifiableMap(view);
    }

    private BigDecimal ratePer1k(String provider, String model) {
        boolean free = properties.provider(provider).map(p -> p.kind().isFree()).orElse(false);
        if (free) return BigDecimal.ZERO;
        return rates.getOrDefault(rateKey(provider, model), properties.budget().fallbackRatePer1kUsd());
    }

    private static String rateKey(String provider, String model) {
        return provider + "::" + model;
    }
}
