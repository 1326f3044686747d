package dev.llmrouter.budget;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Amount held against a provider's caps while its call is in flight. Settled exactly once,
 * by {@link BudgetManager#commit} or {@link BudgetManager#release}.
 */
public final class BudgetReservation {

    private final String provider;
    private final String model;
    private final BigDecimal amount;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    BudgetReservation(String provider, String model, BigDecimal amount) {
        this.provider = provider;
        this.model = model;
        this.amount = amount;
    }

    public String provider() {
        return provider;
    }

    public String model() {
        return model;
    }

    public BigDecimal amount() {
        return amount;
    }

    public boolean isSettled() {
        return settled.get();
    }

    boolean markSettled() {
        return settled.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "BudgetReservation[" + provider + "/" + model + ", " + amount.toPlainString() + "]";
    }
}
