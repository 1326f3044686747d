package dev.llmrouter.domain.valueobject;

import java.math.BigDecimal;

/**
 * Point-in-time view of one provider's budget state.
 */
public record ProviderSpend(
        boolean enabled,
        BigDecimal dailySpentUsd,
        BigDecimal monthlySpentUsd,
        BigDecimal reservedUsd,
        BigDecimal dailyCapUsd,
        BigDecimal monthlyCapUsd
) {}
