package com.tradingcore.oms;

import com.tradingcore.domain.enums.OrderKind;
import com.tradingcore.domain.model.Order;
import com.tradingcore.domain.model.OrderIntent;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.event.EventPublisherHelper;
import com.tradingcore.observability.TradingMetrics;
import com.tradingcore.pnl.PositionLedger;
import com.tradingcore.risk.RiskDecision;
import com.tradingcore.risk.RiskGate;
import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Turns strategy signals into orders.
 *
 * <p>Pipeline per signal:
 * <ol>
 *   <li>HOLD: dropped, never validated</li>
 *   <li>Throttle: duplicate signal ids and signals inside the cooldown are dropped</li>
 *   <li>Translation to an {@link OrderIntent}: kind from the optional prices, quantity defaulted,
 *       reference price from the signal or the last tick</li>
 *   <li>On the symbol's lane: risk validation, then placement if approved</li>
 * </ol>
 *
 * <p>Every risk decision is published for the journal. The returned future completes when the
 * intent has been validated and, if approved, recorded by the lifecycle manager.
 */
@Service
public class OrderRouter {

    private static final Logger log = LoggerFactory.getLogger(OrderRouter.class);

    private final RiskGate riskGate;
    private final OrderLifecycleManager orderLifecycleManager;
    private final SignalThrottle signalThrottle;
    private final SymbolOrderSequencer symbolOrderSequencer;
    private final PositionLedger positionLedger;
    private final EventPublisherHelper eventPublisherHelper;
    private final TradingMetrics tradingMetrics;
    private final int defaultQuantity;

    public OrderRouter(
            RiskGate riskGate,
            OrderLifecycleManager orderLifecycleManager,
            SignalThrottle signalThrottle,
            SymbolOrderSequencer symbolOrderSequencer,
            PositionLedger positionLedger,
            EventPublisherHelper eventPublisherHelper,
            TradingMetrics tradingMetrics,
            @Value("${tradingcore.router.default-quantity:10}") int defaultQuantity) {
        this.riskGate = riskGate;
        this.orderLifecycleManager = orderLifecycleManager;
        this.signalThrottle = signalThrottle;
        this.symbolOrderSequencer = symbolOrderSequencer;
        this.positionLedger = positionLedger;
        this.eventPublisherHelper = eventPublisherHelper;
        this.tradingMetrics = tradingMetrics;
        this.defaultQuantity = defaultQuantity;
    }

    public CompletableFuture<OrderRouteResult> route(Signal signal) {
        tradingMetrics.recordSignal(signal.getAction());

        if (signal.isHold()) {
            return CompletableFuture.completedFuture(OrderRouteResult.skipped("HOLD"));
        }

        SignalThrottle.Decision admission = signalThrottle.admit(signal);
        if (admission != SignalThrottle.Decision.ADMITTED) {
            tradingMetrics.recordSignalDropped(admission.name());
            return CompletableFuture.completedFuture(
                    OrderRouteResult.skipped(admission.name().toLowerCase() + " signal " + signal.getId()));
        }

        OrderIntent intent = toIntent(signal);
        return symbolOrderSequencer.submit(intent.getSymbol(), () -> validateAndPlace(intent));
    }

    private OrderRouteResult validateAndPlace(OrderIntent intent) {
        RiskDecision decision = riskGate.validate(intent);
        eventPublisherHelper.publishRiskDecision(this, intent, decision);

        if (decision.isRejected()) {
            tradingMetrics.recordRiskRejection(decision.getRuleType());
            return OrderRouteResult.rejected(decision.getReason());
        }

        Order order = orderLifecycleManager.place(intent);
        tradingMetrics.recordOrderPlaced(order.getKind());
        log.info(
                "Signal {} from {} placed as {} order {} ({} {} x {})",
                intent.getSignalId(),
                intent.getStrategyId(),
                order.getKind(),
                order.getId(),
                order.getSide(),
                order.getQuantity(),
                order.getSymbol());
        return OrderRouteResult.accepted(order);
    }

    /**
     * Translates a tradable signal into an intent. Kind is BRACKET when both stop-loss and
     * take-profit are set, COVER with a stop-loss only, LIMIT with a price only, MARKET otherwise.
     */
    public OrderIntent toIntent(Signal signal) {
        OrderKind kind;
        if (signal.getStopLoss() != null && signal.getTakeProfit() != null) {
            kind = OrderKind.BRACKET;
        } else if (signal.getStopLoss() != null) {
            kind = OrderKind.COVER;
        } else if (signal.getPrice() != null) {
            kind = OrderKind.LIMIT;
        } else {
            kind = OrderKind.MARKET;
        }

        BigDecimal referencePrice = signal.getPrice() != null
                ? signal.getPrice()
                : positionLedger.lastPrice(signal.getSymbol()).orElse(null);

        return OrderIntent.builder()
                .strategyId(signal.getStrategyId())
                .signalId(signal.getId())
                .symbol(signal.getSymbol())
                .side(signal.getAction().toSide())
                .kind(kind)
                .quantity(signal.getQuantity() != null ? signal.getQuantity() : defaultQuantity)
                .price(signal.getPrice())
                .stopLoss(signal.getStopLoss())
                .takeProfit(signal.getTakeProfit())
                .referencePrice(referencePrice)
                .build();
    }
}
