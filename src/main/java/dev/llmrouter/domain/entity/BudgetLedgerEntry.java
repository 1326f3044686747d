package dev.llmrouter.domain.entity;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Spend per provider per calendar month, keyed by the month's first day.
 * Rows are only ever incremented, through {@code BudgetLedgerRepository#addSpend}.
 */
@Entity
@Table(name = "budget_ledger", uniqueConstraints = {
        @UniqueConstraint(name = "uq_budget_ledger_period_provider", columnNames = {"period_start", "provider"})
})
public class BudgetLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "period_start", nullable = false)
    private LocalDate periodStart;
    @Column(name = "provider", nullable = false, length = 100)
    private String provider;
    @Column(name = "total_spent", nullable = false, precision = 18, scale = 8)
    private BigDecimal totalSpent;

    protected BudgetLedgerEntry() {
    }

    public Long getId() {
        return id;
    }

    public LocalDate getPeriodStart() {
        return periodStart;
    }

    public String getProvider() {
        return provider;
    }

    public BigDecimal getTotalSpent() {
        return totalSpent;
    }
}
