package com.tradingcore.strategy.impl;

import com.tradingcore.domain.enums.SignalAction;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.domain.model.Tick;
import com.tradingcore.strategy.base.BaseStrategy;
import java.util.List;
import java.util.Map;
import org.ta4j.core.indicators.SMAIndicator;

/**
 * Simple moving-average crossover, pull model.
 *
 * <p>Ticks only update state. When the short average crosses above the long one a BUY is
 * queued, when it crosses below a SELL; the dispatcher collects queued signals on its next poll.
 * The first full window only establishes which side the short average is on.
 */
public class MovingAverageCrossoverStrategy extends BaseStrategy {

    private final MovingAverageCrossoverConfig config;
    private final SMAIndicator shortMa;
    private final SMAIndicator longMa;

    /** +1 short above long, -1 below, 0 unknown. */
    private int lastRelation;

    public MovingAverageCrossoverStrategy(String id, String symbol, MovingAverageCrossoverConfig config) {
        super(id, symbol, config.getLongPeriod());
        if (config.getShortPeriod() >= config.getLongPeriod()) {
            throw new IllegalArgumentException("shortPeriod must be less than longPeriod");
        }
        this.config = config;
        this.shortMa = new SMAIndicator(closePrices(), config.getShortPeriod());
        this.longMa = new SMAIndicator(closePrices(), config.getLongPeriod());
    }

    @Override
    protected List<Signal> evaluate(Tick tick) {
        if (!hasFullHistory()) {
            return List.of();
        }
        double longAverage = valueAt(longMa, lastIndex());
        double shortAverage = valueAt(shortMa, lastIndex());
        int relation = Double.compare(shortAverage, longAverage);

        if (lastRelation != 0 && relation != 0 && relation != lastRelation) {
            SignalAction action = relation > 0 ? SignalAction.BUY : SignalAction.SELL;
            defer(signal(action, config.getSignalStrength())
                    .quantity(config.getQuantity())
                    .timestamp(tick.getTimestamp())
                    .metadata(Map.of("shortMa", shortAverage, "longMa", longAverage))
                    .build());
        }
        if (relation != 0) {
            lastRelation = relation;
        }
        return List.of();
    }
}
