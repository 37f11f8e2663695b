package com.tradingcore.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Normalized last-trade price for one symbol.
 *
 * <p>Ticks are immutable and never persisted. They mark positions to market and are fanned
 * out to every strategy subscribed to {@link #getSymbol()}.
 */
@Value
@Builder
public class Tick {

    String symbol;
    BigDecimal price;
    Instant timestamp;

    public static Tick of(String symbol, BigDecimal price, Instant timestamp) {
        return new Tick(symbol, price, timestamp);
    }
}
