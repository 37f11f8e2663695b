package com.tradingcore.integration;

import com.tradingcore.broker.BrokerCallExecutor;
import com.tradingcore.broker.BrokerEventHandler;
import com.tradingcore.broker.BrokerOrderEvent;
import com.tradingcore.broker.SimulatedBrokerGateway;
import com.tradingcore.core.engine.SymbolSubscriptionRouter;
import com.tradingcore.core.engine.TickDispatcher;
import com.tradingcore.domain.model.Order;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.domain.model.Tick;
import com.tradingcore.event.EventPublisherHelper;
import com.tradingcore.event.OrderEvent;
import com.tradingcore.event.RiskDecisionEvent;
import com.tradingcore.event.RiskEvent;
import com.tradingcore.event.TickEvent;
import com.tradingcore.journal.InMemoryEventJournal;
import com.tradingcore.journal.OrderEventJournalWriter;
import com.tradingcore.marketdata.MarketDataIngress;
import com.tradingcore.notification.NotificationService;
import com.tradingcore.observability.TradingMetrics;
import com.tradingcore.oms.OrderLifecycleManager;
import com.tradingcore.oms.OrderRouter;
import com.tradingcore.oms.SignalThrottle;
import com.tradingcore.oms.SymbolOrderSequencer;
import com.tradingcore.pnl.PortfolioValuationService;
import com.tradingcore.pnl.PositionLedger;
import com.tradingcore.risk.EmergencyHaltService;
import com.tradingcore.risk.PortfolioLimitMonitor;
import com.tradingcore.risk.RiskGate;
import com.tradingcore.risk.RiskLimits;
import com.tradingcore.risk.RiskLimitsStore;
import com.tradingcore.risk.RuleCircuitBreakers;
import com.tradingcore.strategy.base.TradingStrategy;
import com.tradingcore.support.BrokerCalls;
import com.tradingcore.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import org.springframework.context.ApplicationEventPublisher;

/**
 * The trading core wired by hand against the simulated broker, with direct executors so a tick
 * is fully processed when {@link #tick} returns. Events are dispatched synchronously to the same
 * listeners the application context would call.
 */
class TradingHarness implements AutoCloseable {

    final MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
    final List<Object> events = new CopyOnWriteArrayList<>();
    final List<String> alerts = new CopyOnWriteArrayList<>();
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    final ScheduledExecutorService timeoutScheduler = Executors.newSingleThreadScheduledExecutor();
    final BrokerCallExecutor brokerCalls = BrokerCalls.direct(timeoutScheduler);
    final PositionLedger positionLedger = new PositionLedger();
    final SimulatedBrokerGateway broker;
    final OrderLifecycleManager orderLifecycleManager;
    final RiskLimitsStore riskLimitsStore;
    final RiskGate riskGate;
    final OrderRouter orderRouter;
    final TickDispatcher tickDispatcher;
    final EmergencyHaltService emergencyHaltService;
    final PortfolioLimitMonitor portfolioLimitMonitor;
    final InMemoryEventJournal journal = new InMemoryEventJournal();
    final MarketDataIngress marketDataIngress;

    TradingHarness(RiskLimits limits) {
        List<Consumer<Object>> listeners = new ArrayList<>();
        ApplicationEventPublisher bus = event -> {
            events.add(event);
            listeners.forEach(listener -> listener.accept(event));
        };
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(bus);
        TradingMetrics tradingMetrics = new TradingMetrics(meterRegistry);

        broker = new SimulatedBrokerGateway(bus, clock);
        orderLifecycleManager = new OrderLifecycleManager(
                broker, brokerCalls, positionLedger, eventPublisherHelper, clock, true);
        riskLimitsStore = new RiskLimitsStore(limits, eventPublisherHelper);
        RuleCircuitBreakers circuitBreakers = new RuleCircuitBreakers(riskLimitsStore, eventPublisherHelper, clock);
        riskGate = new RiskGate(riskLimitsStore, circuitBreakers, orderLifecycleManager);
        orderRouter = new OrderRouter(
                riskGate,
                orderLifecycleManager,
                new SignalThrottle(0, 60, clock),
                new SymbolOrderSequencer(Runnable::run),
                positionLedger,
                eventPublisherHelper,
                tradingMetrics,
                10);
        tickDispatcher = new TickDispatcher(
                new SymbolSubscriptionRouter(), Runnable::run, orderRouter, tradingMetrics, clock);
        NotificationService notificationService =
                new NotificationService((message, severity) -> alerts.add(severity + " " + message), Runnable::run);
        emergencyHaltService = new EmergencyHaltService(
                tickDispatcher,
                riskGate,
                orderLifecycleManager,
                broker,
                brokerCalls,
                notificationService,
                Runnable::run,
                eventPublisherHelper,
                tradingMetrics,
                clock,
                5);
        portfolioLimitMonitor = new PortfolioLimitMonitor(
                riskLimitsStore,
                circuitBreakers,
                new PortfolioValuationService(positionLedger, new BigDecimal("100000"), "UTC", clock),
                positionLedger,
                emergencyHaltService,
                eventPublisherHelper);
        marketDataIngress = new MarketDataIngress(positionLedger, tickDispatcher, eventPublisherHelper);

        OrderEventJournalWriter journalWriter = new OrderEventJournalWriter(journal, clock);
        BrokerEventHandler brokerEventHandler = new BrokerEventHandler(orderLifecycleManager);
        listeners.add(event -> {
            if (event instanceof TickEvent tickEvent) {
                broker.onTick(tickEvent);
            } else if (event instanceof BrokerOrderEvent brokerOrderEvent) {
                brokerEventHandler.handle(brokerOrderEvent);
            } else if (event instanceof OrderEvent orderEvent) {
                journalWriter.onOrderEvent(orderEvent);
                tradingMetrics.onOrderEvent(orderEvent);
                tickDispatcher.onOrderEvent(orderEvent);
                notificationService.onOrderEvent(orderEvent);
            } else if (event instanceof RiskDecisionEvent riskDecisionEvent) {
                journalWriter.onRiskDecision(riskDecisionEvent);
            } else if (event instanceof RiskEvent riskEvent) {
                notificationService.onRiskEvent(riskEvent);
            }
        });
    }

    void tick(String symbol, String price) {
        marketDataIngress.deliverTick(Tick.of(symbol, new BigDecimal(price), clock.instant()));
        clock.advance(Duration.ofSeconds(1));
    }

    <T> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Override
    public void close() {
        timeoutScheduler.shutdownNow();
    }

    /**
     * Emits queued signals on the next tick and records what it is told about its orders.
     */
    static class ScriptedStrategy implements TradingStrategy {

        private final String id;
        private final String symbol;
        private final Deque<List<Signal>> script = new ArrayDeque<>();
        final List<Tick> ticks = new ArrayList<>();
        final List<Order> orderUpdates = new ArrayList<>();

        ScriptedStrategy(String id, String symbol) {
            this.id = id;
            this.symbol = symbol;
        }

        ScriptedStrategy then(Signal.SignalBuilder... signals) {
            List<Signal> batch = new ArrayList<>();
            for (Signal.SignalBuilder signal : signals) {
                batch.add(signal.strategyId(id).symbol(symbol).strength(60).build());
            }
            script.addLast(batch);
            return this;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getSymbol() {
            return symbol;
        }

        @Override
        public List<Signal> onTick(Tick tick) {
            ticks.add(tick);
            List<Signal> next = script.pollFirst();
            return next != null ? next : List.of();
        }

        @Override
        public List<Signal> generateSignals() {
            return List.of();
        }

        @Override
        public void onFill(Order order) {
            orderUpdates.add(order);
        }
    }
}
