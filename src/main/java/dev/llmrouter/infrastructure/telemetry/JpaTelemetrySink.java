package dev.llmrouter.infrastructure.telemetry;

import dev.llmrouter.domain.entity.RoutingCall;
import dev.llmrouter.domain.valueobject.CallRecord;
import dev.llmrouter.repository.BudgetLedgerRepository;
import dev.llmrouter.repository.RoutingCallRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Local durable fallback: the call row plus the month's ledger total, in one transaction.
 */
@Component
public class JpaTelemetrySink implements TelemetrySink {

    private final RoutingCallRepository routingCallRepository;
    private final BudgetLedgerRepository budgetLedgerRepository;
    private final Clock clock;

    @Autowired
    public JpaTelemetrySink(RoutingCallRepository routingCallRepository, BudgetLedgerRepository budgetLedgerRepository) {
        this(routingCallRepository, budgetLedgerRepository, Clock.systemUTC());
    }

    JpaTelemetrySink(RoutingCallRepository routingCallRepository, BudgetLedgerRepository budgetLedgerRepository,
                     Clock clock) {
        this.routingCallRepository = routingCallRepository;
        this.budgetLedgerRepository = budgetLedgerRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void record(CallRecord call) {
        routingCallRepository.save(RoutingCall.from(call));
        LocalDate periodStart = LocalDate.now(clock).withDayOfMonth(1);
        budgetLedgerRepository.addSpend(periodStart, call.provider(), call.costUsd());
    }
}
