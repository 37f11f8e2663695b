package com.tradingcore.journal;

import com.tradingcore.event.OrderEvent;
import com.tradingcore.event.RiskDecisionEvent;
import com.tradingcore.exception.JournalException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Appends every order event and risk decision to the {@link EventJournal}.
 *
 * <p>A failed append is logged at ERROR and does not affect trading: the in-memory order book
 * stays authoritative and the next event of the same order carries its full state again.
 */
@Component
public class OrderEventJournalWriter {

    private static final Logger log = LoggerFactory.getLogger(OrderEventJournalWriter.class);

    private final EventJournal eventJournal;
    private final Clock clock;

    public OrderEventJournalWriter(EventJournal eventJournal, Clock clock) {
        this.eventJournal = eventJournal;
        this.clock = clock;
    }

    @EventListener
    @Order(10)
    public void onOrderEvent(OrderEvent event) {
        append(JournalEntry.builder()
                .recordedAt(clock.instant())
                .type(JournalEntryType.ORDER)
                .eventType(event.getEventType().name())
                .detail(event.getDetail())
                .order(event.getOrder())
                .build());
    }

    @EventListener
    public void onRiskDecision(RiskDecisionEvent event) {
        append(JournalEntry.builder()
                .recordedAt(clock.instant())
                .type(JournalEntryType.RISK_DECISION)
                .eventType(event.getDecision().isAllowed() ? "ALLOWED" : "REJECTED")
                .detail(event.getDecision().getReason())
                .decision(RiskDecisionRecord.of(event.getIntent(), event.getDecision()))
                .build());
    }

    private void append(JournalEntry entry) {
        try {
            eventJournal.append(entry);
        } catch (JournalException e) {
            log.error("Journal append failed for {} {}: {}", entry.getType(), entry.getEventType(), e.getMessage(), e);
        }
    }
}
