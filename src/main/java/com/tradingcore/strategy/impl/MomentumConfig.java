package com.tradingcore.strategy.impl;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MomentumConfig {

    /** RSI lookback in ticks. */
    @Builder.Default
    private int period = 14;

    /** Overbought level; oversold is 100 minus this. */
    @Builder.Default
    private double rsiThreshold = 70;

    /** Minimum tick-over-tick move, in percent, that counts as momentum. */
    @Builder.Default
    private double minMomentumPercent = 0.5;

    @Builder.Default
    private double stopLossPercent = 2.0;

    @Builder.Default
    private double takeProfitPercent = 3.0;

    private Integer quantity;

    @Builder.Default
    private double capital = 100_000;

    @Builder.Default
    private double capitalPercent = 2.5;
}
