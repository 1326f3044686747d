package dev.llmrouter.budget;

import dev.llmrouter.domain.valueobject.ProviderSpend;

import java.math.BigDecimal;

/**
 * Spend accumulators for one provider. All access goes through this object's monitor,
 * so check-and-reserve is atomic per provider. Accumulators only grow.
 */
final class ProviderBudgetState {

    private final boolean enabled;
    private final BigDecimal dailyCap;
    private final BigDecimal monthlyCap;
    private BigDecimal dailySpent = BigDecimal.ZERO;
    private BigDecimal monthlySpent = BigDecimal.ZERO;
    private BigDecimal reserved = BigDecimal.ZERO;

    ProviderBudgetState(boolean enabled, BigDecimal dailyCap, BigDecimal monthlyCap) {
        this.enabled = enabled;
        this.dailyCap = dailyCap;
        this.monthlyCap = monthlyCap;
    }

    boolean isEnabled() {
        return enabled;
    }

    synchronized boolean fits(BigDecimal amount) {
        if (!enabled) return false;
        BigDecimal committed = reserved.add(amount);
        return dailySpent.add(committed).compareTo(dailyCap) <= 0
                && monthlySpent.add(committed).compareTo(monthlyCap) <= 0;
    }

    synchronized boolean tryReserve(BigDecimal amount) {
        if (!fits(amount)) return false;
        reserved = reserved.add(amount);
        return true;
    }

    /** Moves a reservation into recorded spend at its final cost. */
    synchronized void settle(BigDecimal reservedAmount, BigDecimal actual) {
        reserved = reserved.subtract(reservedAmount).max(BigDecimal.ZERO);
        record(actual);
    }

    synchronized void release(BigDecimal reservedAmount) {
        reserved = reserved.subtract(reservedAmount).max(BigDecimal.ZERO);
    }

    synchronized void record(BigDecimal amount) {
        dailySpent = dailySpent.add(amount);
        monthlySpent = monthlySpent.add(amount);
    }

    synchronized ProviderSpend snapshot() {
        return new ProviderSpend(enabled, dailySpent, monthlySpent, reserved, dailyCap, monthlyCap);
    }
}
