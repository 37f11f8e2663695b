package com.tradingcore.domain.enums;

/**
 * Position of an order inside a composite. Plain orders are STANDALONE.
 */
public enum OrderRole {
    STANDALONE,
    ENTRY,
    TAKE_PROFIT,
    STOP_LOSS;

    public boolean isProtective() {
        return this == TAKE_PROFIT || this == STOP_LOSS;
    }
}
