package com.tradingcore.domain.enums;

public enum SignalAction {
    BUY,
    SELL,
    HOLD;

    /** Maps a tradable action to an order side. HOLD has none. */
    public OrderSide toSide() {
        return switch (this) {
            case BUY -> OrderSide.BUY;
            case SELL -> OrderSide.SELL;
            case HOLD -> throw new IllegalStateException("HOLD signals have no order side");
        };
    }
}
