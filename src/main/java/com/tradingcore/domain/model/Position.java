package com.tradingcore.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Value;

/**
 * Net holding in one symbol. Quantity is signed: positive long, negative short.
 * Positions are updated from fills and marked to market from ticks; flat positions are kept
 * so their realized P&L survives.
 */
@Value
@Builder(toBuilder = true)
public class Position {

    String symbol;
    int quantity;
    BigDecimal avgPrice;
    BigDecimal currentPrice;

    @Builder.Default
    BigDecimal realizedPnl = BigDecimal.ZERO;

    public static Position flat(String symbol) {
        return Position.builder()
                .symbol(symbol)
                .quantity(0)
                .avgPrice(BigDecimal.ZERO)
                .build();
    }

    public boolean isFlat() {
        return quantity == 0;
    }

    /** Signed market value at the current price, zero when no price is known. */
    public BigDecimal marketValue() {
        if (currentPrice == null) {
            return BigDecimal.ZERO;
        }
        return currentPrice.multiply(BigDecimal.valueOf(quantity));
    }

    public BigDecimal unrealizedPnl() {
        if (quantity == 0 || currentPrice == null) {
            return BigDecimal.ZERO;
        }
        return currentPrice.subtract(avgPrice).multiply(BigDecimal.valueOf(quantity));
    }

    /**
     * Unrealized return as a percentage of entry price, from the holder's point of view
     * (a short gains when price falls). Zero for flat positions.
     */
    public BigDecimal unrealizedPnlPercent() {
        if (quantity == 0 || currentPrice == null || avgPrice.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal move = currentPrice.subtract(avgPrice).multiply(BigDecimal.valueOf(Integer.signum(quantity)));
        return move.multiply(BigDecimal.valueOf(100)).divide(avgPrice, 4, RoundingMode.HALF_UP);
    }
}
