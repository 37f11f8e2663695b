package com.tradingcore.domain.enums;

/**
 * Direction of an order. A long position is opened with BUY and closed with SELL.
 */
public enum OrderSide {
    BUY,
    SELL;

    /** Side that closes or hedges a position opened with this side. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** +1 for BUY, -1 for SELL. Used for signed quantity and exposure arithmetic. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
