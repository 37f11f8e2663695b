package com.tradingcore.domain.model;

import com.tradingcore.domain.enums.SignalAction;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A trading intention produced by a strategy.
 *
 * <p>Every signal is consumed at most once; the router de-duplicates on {@link #getId()}.
 * HOLD signals are dropped before risk validation. Optional fields map onto the order kind:
 * stop-loss plus take-profit becomes a BRACKET, stop-loss alone a COVER, a price alone a LIMIT.
 */
@Getter
@ToString
public class Signal {

    private final String id;
    private final String strategyId;
    private final String symbol;
    private final SignalAction action;

    /** Conviction in the range 0..100. */
    private final int strength;

    private final BigDecimal price;
    private final Integer quantity;
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;
    private final Instant timestamp;
    private final Map<String, Object> metadata;

    @Builder(toBuilder = true)
    private Signal(
            String id,
            String strategyId,
            String symbol,
            SignalAction action,
            int strength,
            BigDecimal price,
            Integer quantity,
            BigDecimal stopLoss,
            BigDecimal takeProfit,
            Instant timestamp,
            Map<String, Object> metadata) {
        if (strength < 0 || strength > 100) {
            throw new IllegalArgumentException("Signal strength must be within 0..100, got " + strength);
        }
        if (quantity != null && quantity <= 0) {
            throw new IllegalArgumentException("Signal quantity must be positive, got " + quantity);
        }
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.strategyId = Objects.requireNonNull(strategyId, "strategyId");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.action = Objects.requireNonNull(action, "action");
        this.strength = strength;
        this.price = price;
        this.quantity = quantity;
        this.stopLoss = stopLoss;
        this.takeProfit = takeProfit;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public boolean isHold() {
        return action == SignalAction.HOLD;
    }
}
