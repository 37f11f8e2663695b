package com.tradingcore.strategy.impl;

import com.tradingcore.domain.enums.SignalAction;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.domain.model.Tick;
import com.tradingcore.strategy.base.BaseStrategy;
import java.util.List;
import java.util.Map;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;

/**
 * Z-score mean reversion, push model.
 *
 * <p>Sells when price is more than {@code threshold} standard deviations above the lookback
 * mean and buys when it is as far below. Signals carry a protective stop only, so they are routed
 * as COVER orders at market.
 */
public class MeanReversionStrategy extends BaseStrategy {

    private final MeanReversionConfig config;
    private final SMAIndicator mean;
    private final StandardDeviationIndicator stdDev;

    public MeanReversionStrategy(String id, String symbol, MeanReversionConfig config) {
        super(id, symbol, config.getLookback());
        this.config = config;
        this.mean = new SMAIndicator(closePrices(), config.getLookback());
        this.stdDev = new StandardDeviationIndicator(closePrices(), config.getLookback());
    }

    @Override
    protected List<Signal> evaluate(Tick tick) {
        if (!hasFullHistory()) {
            return List.of();
        }
        int index = lastIndex();
        double mean = valueAt(this.mean, index);
        double stdDev = valueAt(this.stdDev, index);
        if (stdDev == 0) {
            return List.of();
        }

        double current = valueAt(closePrices(), index);
        double zScore = (current - mean) / stdDev;

        SignalAction action;
        if (zScore > config.getThreshold()) {
            action = SignalAction.SELL;
        } else if (zScore < -config.getThreshold()) {
            action = SignalAction.BUY;
        } else {
            return List.of();
        }

        double direction = action == SignalAction.BUY ? 1 : -1;
        double stop = current * (1 - direction * config.getStopLossPercent() / 100.0);
        int strength = (int) Math.min(100, Math.round(Math.abs(zScore) / (2 * config.getThreshold()) * 100));

        return List.of(signal(action, strength)
                .stopLoss(price(stop))
                .quantity(positionSize(config.getQuantity(), config.getCapital(), config.getCapitalPercent(), current))
                .timestamp(tick.getTimestamp())
                .metadata(Map.of("zScore", zScore, "mean", mean))
                .build());
    }
}
