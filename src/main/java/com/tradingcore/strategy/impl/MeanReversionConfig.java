package com.tradingcore.strategy.impl;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MeanReversionConfig {

    @Builder.Default
    private int lookback = 20;

    /** Z-score beyond which price is considered stretched. */
    @Builder.Default
    private double threshold = 2.0;

    @Builder.Default
    private double stopLossPercent = 1.5;

    private Integer quantity;

    @Builder.Default
    private double capital = 100_000;

    @Builder.Default
    private double capitalPercent = 2.0;
}
