package com.tradingcore.domain.enums;

/**
 * Built-in strategy implementations that can be declared in configuration.
 */
public enum StrategyType {
    MA_CROSSOVER,
    MOMENTUM,
    MEAN_REVERSION,
    GRID_TRADING
}
