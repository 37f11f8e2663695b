package com.tradingcore.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradingcore.domain.enums.CompositeStatus;
import com.tradingcore.domain.enums.OrderRole;
import com.tradingcore.domain.enums.OrderStatus;
import com.tradingcore.domain.enums.SignalAction;
import com.tradingcore.domain.model.Order;
import com.tradingcore.domain.model.Position;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.event.EventPublisherHelper;
import com.tradingcore.integration.TradingHarness.ScriptedStrategy;
import com.tradingcore.journal.JournalEntry;
import com.tradingcore.journal.JournalEntryType;
import com.tradingcore.oms.OrderLifecycleManager;
import com.tradingcore.pnl.PositionLedger;
import com.tradingcore.recovery.StartupRecoveryService;
import com.tradingcore.risk.RiskLimits;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tick to fill flow through the real dispatcher, router, risk gate, lifecycle manager,
 * simulated broker and journal.
 */
class TradingFlowIntegrationTest {

    private TradingHarness harness;

    @BeforeEach
    void setUp() {
        harness = new TradingHarness(RiskLimits.builder()
                .maxOrderValue(new BigDecimal("10000"))
                .maxPositionValue(new BigDecimal("50000"))
                .maxDrawdownPercent(new BigDecimal("10"))
                .maxDailyLoss(new BigDecimal("5000"))
                .stopLossPercent(new BigDecimal("5"))
                .emergencyStopEnabled(true)
                .build());
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private Map<OrderRole, Order> ordersByRole() {
        return harness.orderLifecycleManager.getAllOrders().stream()
                .collect(Collectors.toMap(Order::getRole, Function.identity()));
    }

    @Test
    @DisplayName("Bracket signal is filled, protected, and resolved by its take-profit")
    void bracketSignal_fillsProtectsAndResolves() {
        ScriptedStrategy strategy = new ScriptedStrategy("bracket-aapl", "AAPL").then(Signal.builder()
                .action(SignalAction.BUY)
                .quantity(10)
                .price(new BigDecimal("100"))
                .stopLoss(new BigDecimal("95"))
                .takeProfit(new BigDecimal("110")));
        harness.tickDispatcher.subscribe(strategy);

        // Entry rests as a BUY limit at 100 and fills on the same tick
        harness.tick("AAPL", "100");

        Map<OrderRole, Order> orders = ordersByRole();
        assertThat(orders.get(OrderRole.ENTRY).getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(orders.get(OrderRole.ENTRY).getCompositeStatus()).isEqualTo(CompositeStatus.PROTECTED);
        assertThat(orders.get(OrderRole.TAKE_PROFIT).getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(orders.get(OrderRole.STOP_LOSS).getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(harness.broker.getRestingOrderCount()).isEqualTo(2);
        assertThat(harness.positionLedger.getPosition("AAPL").orElseThrow().getQuantity()).isEqualTo(10);

        harness.tick("AAPL", "105");
        assertThat(harness.broker.getRestingOrderCount()).isEqualTo(2);

        harness.tick("AAPL", "111");

        orders = ordersByRole();
        assertThat(orders.get(OrderRole.TAKE_PROFIT).getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(orders.get(OrderRole.STOP_LOSS).getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(orders.get(OrderRole.ENTRY).getCompositeStatus()).isEqualTo(CompositeStatus.RESOLVED);
        assertThat(harness.broker.getRestingOrderCount()).isZero();

        Position position = harness.positionLedger.getPosition("AAPL").orElseThrow();
        assertThat(position.getQuantity()).isZero();
        assertThat(position.getRealizedPnl()).isEqualByComparingTo("110");

        assertThat(strategy.orderUpdates)
                .extracting(Order::getId)
                .contains(orders.get(OrderRole.ENTRY).getId(), orders.get(OrderRole.TAKE_PROFIT).getId());
        assertThat(harness.orderLifecycleManager.getOrdersAwaitingReconciliation()).isEmpty();
    }

    @Test
    @DisplayName("Market signal without a price is sized by default and filled at the last tick")
    void marketSignal_usesLastPriceAndDefaultQuantity() {
        ScriptedStrategy strategy =
                new ScriptedStrategy("mkt-aapl", "AAPL").then(Signal.builder().action(SignalAction.BUY));
        harness.tickDispatcher.subscribe(strategy);

        harness.tick("AAPL", "150");

        Order order = harness.orderLifecycleManager.getAllOrders().get(0);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(order.getQuantity()).isEqualTo(10);
        assertThat(order.getAverageFillPrice()).isEqualByComparingTo("150");
        assertThat(order.getBrokerOrderId()).startsWith("SIM-");
    }

    @Test
    @DisplayName("Oversized signal is rejected, journaled, and never reaches the broker")
    void oversizedSignal_rejectedAndJournaled() {
        ScriptedStrategy strategy = new ScriptedStrategy("big-aapl", "AAPL").then(Signal.builder()
                .action(SignalAction.BUY)
                .quantity(200)
                .price(new BigDecimal("100")));
        harness.tickDispatcher.subscribe(strategy);

        harness.tick("AAPL", "100");

        assertThat(harness.orderLifecycleManager.getAllOrders()).isEmpty();
        assertThat(harness.broker.getRestingOrderCount()).isZero();
        assertThat(harness.journal.readAll()).singleElement().satisfies(entry -> {
            assertThat(entry.getType()).isEqualTo(JournalEntryType.RISK_DECISION);
            assertThat(entry.getEventType()).isEqualTo("REJECTED");
            assertThat(entry.getDecision().getNotional()).isEqualByComparingTo("20000");
        });
        assertThat(harness.meterRegistry.counter("risk.rejections", "rule", "ORDER_VALUE").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Broker refusal of a cover entry cancels its unsent stop")
    void coverSignal_refusedEntryAbandonsComposite() {
        ScriptedStrategy strategy = new ScriptedStrategy("cover-tsla", "TSLA").then(Signal.builder()
                .action(SignalAction.BUY)
                .quantity(5)
                .price(new BigDecimal("200"))
                .stopLoss(new BigDecimal("190")));
        harness.tickDispatcher.subscribe(strategy);
        harness.broker.rejectSymbol("TSLA", "symbol halted");

        harness.tick("TSLA", "210");

        Map<OrderRole, Order> orders = ordersByRole();
        Order entry = orders.get(OrderRole.ENTRY);
        assertThat(entry.getStatus()).isEqualTo(OrderStatus.REJECTED);
        assertThat(entry.getRejectionReason()).isEqualTo("symbol halted");
        assertThat(entry.getCompositeStatus()).isEqualTo(CompositeStatus.ABANDONED);
        assertThat(orders.get(OrderRole.STOP_LOSS).getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(harness.orderLifecycleManager.getOpenOrders()).isEmpty();
        assertThat(harness.broker.getRestingOrderCount()).isZero();
        assertThat(strategy.orderUpdates)
                .extracting(Order::getStatus)
                .containsExactly(OrderStatus.REJECTED);
    }

    @Test
    @DisplayName("Journal replay restores the final state of every order")
    void journalReplay_restoresOrderBook() {
        ScriptedStrategy strategy = new ScriptedStrategy("bracket-aapl", "AAPL").then(Signal.builder()
                .action(SignalAction.BUY)
                .quantity(10)
                .price(new BigDecimal("100"))
                .stopLoss(new BigDecimal("95"))
                .takeProfit(new BigDecimal("110")));
        harness.tickDispatcher.subscribe(strategy);
        harness.tick("AAPL", "100");
        harness.tick("AAPL", "94");

        OrderLifecycleManager restarted = new OrderLifecycleManager(
                harness.broker,
                harness.brokerCalls,
                new PositionLedger(),
                new EventPublisherHelper(event -> {}),
                harness.clock,
                true);
        int restored = new StartupRecoveryService(harness.journal, restarted, true).recover();

        assertThat(restored).isEqualTo(3);
        List<Order> before = harness.orderLifecycleManager.getAllOrders();
        for (Order original : before) {
            Order replayed = restarted.getOrder(original.getId()).orElseThrow();
            assertThat(replayed.getStatus()).isEqualTo(original.getStatus());
            assertThat(replayed.getVersion()).isEqualTo(original.getVersion());
            assertThat(replayed.getCompositeStatus()).isEqualTo(original.getCompositeStatus());
        }
        assertThat(harness.journal.readAll())
                .filteredOn(entry -> entry.getType() == JournalEntryType.ORDER)
                .extracting(JournalEntry::getSequence)
                .isSorted();
    }
}
