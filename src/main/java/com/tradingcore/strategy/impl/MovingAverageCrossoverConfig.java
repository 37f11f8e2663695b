package com.tradingcore.strategy.impl;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MovingAverageCrossoverConfig {

    @Builder.Default
    private int shortPeriod = 5;

    @Builder.Default
    private int longPeriod = 20;

    /** Fixed order quantity; null lets the router apply its default. */
    private Integer quantity;

    @Builder.Default
    private int signalStrength = 75;
}
