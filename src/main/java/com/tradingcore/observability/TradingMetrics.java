package com.tradingcore.observability;

import com.tradingcore.domain.enums.OrderKind;
import com.tradingcore.domain.enums.RiskRuleType;
import com.tradingcore.domain.enums.SignalAction;
import com.tradingcore.event.OrderEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.Supplier;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the trading core.
 *
 * <ul>
 *   <li><b>ticks.routed</b> / <b>ticks.dropped</b> (counters): ticks delivered to strategies,
 *       and ticks discarded while halted</li>
 *   <li><b>signals.received</b> (counter, tag {@code action}) and <b>signals.dropped</b>
 *       (counter, tag {@code reason})</li>
 *   <li><b>risk.rejections</b> (counter, tag {@code rule})</li>
 *   <li><b>orders.placed</b> (counter, tag {@code kind})</li>
 *   <li><b>orders.events</b> (counter, tag {@code type}): every lifecycle event</li>
 *   <li><b>strategy.errors</b> (counter), <b>halt.activations</b> (counter)</li>
 * </ul>
 *
 * <p>Tagged counters are looked up through the registry on each call; Micrometer caches meters
 * by name and tags.
 */
@Service
public class TradingMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter ticksRouted;
    private final Counter ticksDropped;
    private final Counter strategyErrors;
    private final Counter haltActivations;

    public TradingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.ticksRouted = Counter.builder("ticks.routed")
                .description("Ticks delivered to at least one strategy")
                .register(meterRegistry);
        this.ticksDropped = Counter.builder("ticks.dropped")
                .description("Ticks discarded because trading is halted")
                .register(meterRegistry);
        this.strategyErrors = Counter.builder("strategy.errors")
                .description("Exceptions thrown by strategy callbacks")
                .register(meterRegistry);
        this.haltActivations = Counter.builder("halt.activations")
                .description("Emergency halts that actually stopped trading")
                .register(meterRegistry);
    }

    public void recordTickRouted() {
        ticksRouted.increment();
    }

    public void recordTickDropped() {
        ticksDropped.increment();
    }

    public void recordStrategyError() {
        strategyErrors.increment();
    }

    public void recordHalt() {
        haltActivations.increment();
    }

    public void recordSignal(SignalAction action) {
        meterRegistry.counter("signals.received", "action", action.name()).increment();
    }

    public void recordSignalDropped(String reason) {
        meterRegistry.counter("signals.dropped", "reason", reason).increment();
    }

    public void recordRiskRejection(RiskRuleType ruleType) {
        meterRegistry
                .counter("risk.rejections", "rule", ruleType != null ? ruleType.name() : "NONE")
                .increment();
    }

    public void recordOrderPlaced(OrderKind kind) {
        meterRegistry.counter("orders.placed", "kind", kind.name()).increment();
    }

    /** Registers a gauge read lazily at scrape time. */
    public void registerGauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value, supplier -> supplier.get().doubleValue())
                .strongReference(true)
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        meterRegistry
                .counter("orders.events", "type", event.getEventType().name())
                .increment();
    }
}
