package dev.llmrouter.repository;

import dev.llmrouter.domain.entity.BudgetLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;

@Repository
public interface BudgetLedgerRepository extends JpaRepository<BudgetLedgerEntry, Long> {

    /** Creates the (period, provider) row or adds to its total. */
    @Modifying
    @Query(value = """
            INSERT INTO budget_ledger (period_start, provider, total_spent)
            VALUES (:periodStart, :provider, :amount)
            ON CONFLICT (period_start, provider)
            DO UPDATE SET total_spent = budget_ledger.total_spent + EXCLUDED.total_spent
            """, nativeQuery = true)
    int addSpend(@Param("periodStart") LocalDate periodStart, @Param("provider") String provider,
                 @Param("amount") BigDecimal amount);
}
