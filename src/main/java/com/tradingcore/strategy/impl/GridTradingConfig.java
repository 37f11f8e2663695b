package com.tradingcore.strategy.impl;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class GridTradingConfig {

    /** Distance between adjacent levels as a fraction of the base price. */
    @Builder.Default
    private double gridSpacing = 0.005;

    /** Total levels, split evenly below and above the base price. */
    @Builder.Default
    private int gridLevels = 10;

    /** Grid centre; the first tick's price when unset. */
    private Double basePrice;

    private Integer quantity;

    @Builder.Default
    private double capital = 100_000;

    /** Share of capital spread over all levels. */
    @Builder.Default
    private double capitalPercent = 5.0;

    @Builder.Default
    private int signalStrength = 50;
}
