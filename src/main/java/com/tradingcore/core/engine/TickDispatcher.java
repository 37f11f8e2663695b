package com.tradingcore.core.engine;

import com.tradingcore.core.concurrent.KeyedSerialExecutor;
import com.tradingcore.domain.model.Order;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.domain.model.Tick;
import com.tradingcore.event.OrderEvent;
import com.tradingcore.event.OrderEventType;
import com.tradingcore.exception.ResourceNotFoundException;
import com.tradingcore.observability.TradingMetrics;
import com.tradingcore.oms.OrderRouter;
import com.tradingcore.strategy.base.TradingStrategy;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Fans ticks out to the strategies subscribed to their symbol and forwards the resulting signals
 * to the order router.
 *
 * <p><b>Ordering:</b> every strategy has its own serial lane on the shared strategy executor.
 * Ticks, signal polls and fill notifications for one strategy run on that lane in arrival order
 * and never overlap; different strategies run in parallel. {@link #onTick} only schedules work
 * and returns without waiting for any strategy.
 *
 * <p><b>Isolation:</b> an exception from a strategy is caught on its lane, logged and counted.
 * Other strategies and later ticks are unaffected.
 *
 * <p><b>Halt:</b> once {@link #halt()} is called, ticks are dropped (not queued) and polls are
 * skipped. Work already queued on a lane checks the flag again before calling the strategy.
 * The flag is cleared only by the operator through {@link #resetHalt()}.
 *
 * <p><b>Pause:</b> {@link #pauseStrategy} stops ticks and polls for one strategy while keeping its
 * subscription and state; fills of its orders are still delivered. {@link #resumeStrategy} picks up
 * with the next tick.
 *
 * <p><b>Heartbeat:</b> each completed tick or poll callback stamps the strategy's heartbeat, which
 * {@link StrategyStats#getLastHeartbeatAt()} reports for the stale-strategy check.
 */
@Service
public class TickDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TickDispatcher.class);

    private static final Set<OrderEventType> STRATEGY_ORDER_EVENTS =
            EnumSet.of(OrderEventType.FILLED, OrderEventType.PARTIALLY_FILLED, OrderEventType.REJECTED);

    private final Map<String, StrategyRuntime> strategies = new ConcurrentHashMap<>();
    private final SymbolSubscriptionRouter subscriptionRouter;
    private final KeyedSerialExecutor strategyLanes;
    private final OrderRouter orderRouter;
    private final TradingMetrics tradingMetrics;
    private final Clock clock;

    private final AtomicBoolean halted = new AtomicBoolean(false);

    public TickDispatcher(
            SymbolSubscriptionRouter subscriptionRouter,
            @Qualifier("strategyExecutor") Executor strategyExecutor,
            OrderRouter orderRouter,
            TradingMetrics tradingMetrics,
            Clock clock) {
        this.subscriptionRouter = subscriptionRouter;
        this.strategyLanes = new KeyedSerialExecutor("strategy", strategyExecutor);
        this.orderRouter = orderRouter;
        this.tradingMetrics = tradingMetrics;
        this.clock = clock;
        tradingMetrics.registerGauge("strategies.subscribed", strategies::size);
    }

    // ========================
    // SUBSCRIPTIONS
    // ========================

    /**
     * Registers the strategy for ticks on its symbol. Idempotent per strategy id: returns false
     * and leaves the existing registration in place if the id is already known.
     */
    public boolean subscribe(TradingStrategy strategy) {
        StrategyRuntime runtime = new StrategyRuntime(strategy, clock.millis());
        StrategyRuntime existing = strategies.putIfAbsent(strategy.getId(), runtime);
        if (existing != null) {
            if (existing.strategy != strategy) {
                log.warn("Strategy id {} already registered with a different instance, ignored", strategy.getId());
            }
            return false;
        }
        subscriptionRouter.subscribe(strategy.getSymbol(), strategy.getId());
        log.info("Strategy {} subscribed to {}", strategy.getId(), strategy.getSymbol());
        return true;
    }

    public boolean unsubscribe(String strategyId) {
        StrategyRuntime removed = strategies.remove(strategyId);
        if (removed == null) {
            return false;
        }
        subscriptionRouter.unsubscribe(removed.strategy.getSymbol(), strategyId);
        strategyLanes.remove(strategyId);
        log.info("Strategy {} unsubscribed from {}", strategyId, removed.strategy.getSymbol());
        return true;
    }

    // ========================
    // PAUSE / RESUME
    // ========================

    /**
     * Stops tick and poll delivery to one strategy without unsubscribing it. Returns false if it
     * was already paused.
     *
     * @throws ResourceNotFoundException if no strategy with this id is subscribed
     */
    public boolean pauseStrategy(String strategyId) {
        StrategyRuntime runtime = getOrThrow(strategyId);
        if (runtime.paused) {
            return false;
        }
        runtime.paused = true;
        log.info("Strategy {} paused", strategyId);
        return true;
    }

    /**
     * Resumes a paused strategy. The heartbeat restarts from now so the pause itself does not
     * count as silence. Returns false if it was not paused.
     *
     * @throws ResourceNotFoundException if no strategy with this id is subscribed
     */
    public boolean resumeStrategy(String strategyId) {
        StrategyRuntime runtime = getOrThrow(strategyId);
        if (!runtime.paused) {
            return false;
        }
        runtime.lastHeartbeatMillis.set(clock.millis());
        runtime.paused = false;
        log.info("Strategy {} resumed", strategyId);
        return true;
    }

    public boolean isPaused(String strategyId) {
        return getOrThrow(strategyId).paused;
    }

    private StrategyRuntime getOrThrow(String strategyId) {
        StrategyRuntime runtime = strategies.get(strategyId);
        if (runtime == null) {
            throw new ResourceNotFoundException("Strategy", strategyId);
        }
        return runtime;
    }

    // ========================
    // TICK ROUTING
    // ========================

    public void onTick(Tick tick) {
        if (halted.get()) {
            tradingMetrics.recordTickDropped();
            log.debug("Halted, dropping tick {} @ {}", tick.getSymbol(), tick.getPrice());
            return;
        }

        List<String> subscribers = subscriptionRouter.getSubscribedStrategies(tick.getSymbol());
        if (subscribers.isEmpty()) {
            return;
        }
        for (String strategyId : subscribers) {
            StrategyRuntime runtime = strategies.get(strategyId);
            if (runtime != null && !runtime.paused) {
                strategyLanes.execute(strategyId, () -> deliverTick(runtime, tick));
            }
        }
        tradingMetrics.recordTickRouted();
    }

    private void deliverTick(StrategyRuntime runtime, Tick tick) {
        if (halted.get() || runtime.paused) {
            return;
        }
        try {
            List<Signal> signals = runtime.strategy.onTick(tick);
            runtime.ticksProcessed.incrementAndGet();
            forwardSignals(runtime, signals);
        } catch (Exception e) {
            recordStrategyError(runtime, "onTick", e);
        } finally {
            runtime.lastHeartbeatMillis.set(clock.millis());
        }
    }

    // ========================
    // SIGNAL POLLING
    // ========================

    /**
     * Collects signals from strategies that defer them instead of emitting on tick.
     */
    @Scheduled(fixedDelayString = "${tradingcore.dispatcher.signal-poll-interval-ms:1000}")
    public void pollSignals() {
        if (halted.get()) {
            return;
        }
        for (StrategyRuntime runtime : strategies.values()) {
            if (!runtime.paused) {
                strategyLanes.execute(runtime.strategy.getId(), () -> collectSignals(runtime));
            }
        }
    }

    private void collectSignals(StrategyRuntime runtime) {
        if (halted.get() || runtime.paused) {
            return;
        }
        try {
            forwardSignals(runtime, runtime.strategy.generateSignals());
        } catch (Exception e) {
            recordStrategyError(runtime, "generateSignals", e);
        } finally {
            runtime.lastHeartbeatMillis.set(clock.millis());
        }
    }

    private void forwardSignals(StrategyRuntime runtime, List<Signal> signals) {
        if (signals == null || signals.isEmpty()) {
            return;
        }
        for (Signal signal : signals) {
            if (!runtime.strategy.getId().equals(signal.getStrategyId())) {
                log.warn(
                        "Strategy {} emitted a signal attributed to {}, dropped",
                        runtime.strategy.getId(),
                        signal.getStrategyId());
                continue;
            }
            runtime.signalsEmitted.incrementAndGet();
            runtime.lastSignalAtMillis.set(clock.millis());
            log.debug(
                    "Signal {} from {}: {} {} strength {}",
                    signal.getId(),
                    signal.getStrategyId(),
                    signal.getAction(),
                    signal.getSymbol(),
                    signal.getStrength());
            orderRouter.route(signal).whenComplete((result, error) -> {
                if (error != null) {
                    log.error("Routing signal {} failed: {}", signal.getId(), error.getMessage(), error);
                } else if (!result.isAccepted()) {
                    log.debug("Signal {} not placed: {}", signal.getId(), result.getReason());
                }
            });
        }
    }

    // ========================
    // FILL NOTIFICATION
    // ========================

    /**
     * Delivers fills and rejections of a strategy's orders on that strategy's lane.
     */
    @EventListener
    public void onOrderEvent(OrderEvent event) {
        if (!STRATEGY_ORDER_EVENTS.contains(event.getEventType())) {
            return;
        }
        Order order = event.getOrder();
        if (order.getStrategyId() == null) {
            return;
        }
        StrategyRuntime runtime = strategies.get(order.getStrategyId());
        if (runtime == null) {
            return;
        }
        strategyLanes.execute(order.getStrategyId(), () -> {
            try {
                runtime.strategy.onFill(order);
            } catch (Exception e) {
                recordStrategyError(runtime, "onFill", e);
            }
        });
    }

    private void recordStrategyError(StrategyRuntime runtime, String callback, Exception e) {
        runtime.errors.incrementAndGet();
        runtime.lastError = callback + ": " + e.getMessage();
        tradingMetrics.recordStrategyError();
        log.error("Strategy {} failed in {}: {}", runtime.strategy.getId(), callback, e.getMessage(), e);
    }

    // ========================
    // HALT
    // ========================

    /**
     * Stops tick delivery. Returns true only for the call that actually set the flag.
     */
    public boolean halt() {
        boolean set = halted.compareAndSet(false, true);
        if (set) {
            log.error("Tick dispatch HALTED: ticks will be dropped until an operator reset");
        }
        return set;
    }

    /** Operator action. */
    public void resetHalt() {
        if (halted.compareAndSet(true, false)) {
            log.warn("Tick dispatch resumed by operator reset");
        }
    }

    public boolean isHalted() {
        return halted.get();
    }

    // ========================
    // QUERIES
    // ========================

    public List<StrategyStats> getStrategyStats() {
        return strategies.values().stream()
                .map(StrategyRuntime::toStats)
                .sorted(Comparator.comparing(StrategyStats::getStrategyId))
                .toList();
    }

    public List<String> getSubscribedStrategyIds(String symbol) {
        return List.copyOf(subscriptionRouter.getSubscribedStrategies(symbol));
    }

    public int getStrategyCount() {
        return strategies.size();
    }

    private static final class StrategyRuntime {

        private final TradingStrategy strategy;
        private final AtomicLong ticksProcessed = new AtomicLong();
        private final AtomicLong signalsEmitted = new AtomicLong();
        private final AtomicLong errors = new AtomicLong();
        private final AtomicLong lastSignalAtMillis = new AtomicLong(-1);
        private final AtomicLong lastHeartbeatMillis;
        private volatile String lastError;
        private volatile boolean paused;

        private StrategyRuntime(TradingStrategy strategy, long subscribedAtMillis) {
            this.strategy = strategy;
            this.lastHeartbeatMillis = new AtomicLong(subscribedAtMillis);
        }

        private StrategyStats toStats() {
            long lastSignal = lastSignalAtMillis.get();
            return StrategyStats.builder()
                    .strategyId(strategy.getId())
                    .symbol(strategy.getSymbol())
                    .ticksProcessed(ticksProcessed.get())
                    .signalsEmitted(signalsEmitted.get())
                    .errors(errors.get())
                    .lastSignalAt(lastSignal >= 0 ? Instant.ofEpochMilli(lastSignal) : null)
                    .lastHeartbeatAt(Instant.ofEpochMilli(lastHeartbeatMillis.get()))
                    .paused(paused)
                    .lastError(lastError)
                    .build();
        }
    }
}
