package com.tradingcore.unit.journal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

import com.tradingcore.domain.enums.OrderKind;
import com.tradingcore.domain.enums.OrderSide;
import com.tradingcore.domain.enums.OrderStatus;
import com.tradingcore.domain.enums.RiskRuleType;
import com.tradingcore.domain.model.Order;
import com.tradingcore.domain.model.OrderIntent;
import com.tradingcore.event.OrderEvent;
import com.tradingcore.event.OrderEventType;
import com.tradingcore.event.RiskDecisionEvent;
import com.tradingcore.exception.JournalException;
import com.tradingcore.journal.EventJournal;
import com.tradingcore.journal.InMemoryEventJournal;
import com.tradingcore.journal.JournalEntry;
import com.tradingcore.journal.JournalEntryType;
import com.tradingcore.journal.OrderEventJournalWriter;
import com.tradingcore.risk.RiskDecision;
import com.tradingcore.support.MutableClock;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrderEventJournalWriterTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");

    @Mock
    private EventJournal failingJournal;

    private static Order order() {
        return Order.builder()
                .id("o-1")
                .symbol("AAPL")
                .side(OrderSide.BUY)
                .kind(OrderKind.MARKET)
                .quantity(10)
                .status(OrderStatus.FILLED)
                .version(3)
                .build();
    }

    @Test
    @DisplayName("Order events and risk decisions become journal entries")
    void recordsEvents() {
        InMemoryEventJournal journal = new InMemoryEventJournal();
        OrderEventJournalWriter writer = new OrderEventJournalWriter(journal, clock);
        OrderIntent intent = OrderIntent.builder()
                .signalId("sig-1")
                .symbol("AAPL")
                .side(OrderSide.BUY)
                .kind(OrderKind.MARKET)
                .quantity(50)
                .referencePrice(new BigDecimal("300"))
                .build();

        writer.onOrderEvent(new OrderEvent(this, order(), OrderEventType.FILLED, OrderStatus.PENDING));
        writer.onRiskDecision(new RiskDecisionEvent(
                this, intent, RiskDecision.rejected(RiskRuleType.ORDER_VALUE, "too large")));

        List<JournalEntry> entries = journal.readAll();
        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).getType()).isEqualTo(JournalEntryType.ORDER);
        assertThat(entries.get(0).getEventType()).isEqualTo("FILLED");
        assertThat(entries.get(0).getOrder().getVersion()).isEqualTo(3);
        assertThat(entries.get(0).getRecordedAt()).isEqualTo(clock.instant());
        assertThat(entries.get(1).getEventType()).isEqualTo("REJECTED");
        assertThat(entries.get(1).getDecision().getNotional()).isEqualByComparingTo("15000");
        assertThat(entries.get(1).getDecision().getReason()).isEqualTo("too large");
    }

    @Test
    @DisplayName("A failing journal does not propagate to the publisher")
    void appendFailureContained() {
        doThrow(new JournalException("disk full", new IOException("ENOSPC")))
                .when(failingJournal)
                .append(any());
        OrderEventJournalWriter writer = new OrderEventJournalWriter(failingJournal, clock);

        assertThatCode(() -> writer.onOrderEvent(new OrderEvent(this, order(), OrderEventType.FILLED)))
                .doesNotThrowAnyException();
    }
}
