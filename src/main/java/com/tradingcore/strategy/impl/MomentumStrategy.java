package com.tradingcore.strategy.impl;

import com.tradingcore.domain.enums.SignalAction;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.domain.model.Tick;
import com.tradingcore.strategy.base.BaseStrategy;
import java.util.List;
import java.util.Map;
import org.ta4j.core.indicators.RSIIndicator;

/**
 * Momentum with RSI confirmation, push model.
 *
 * <p>RSI is ta4j's Wilder-smoothed {@link RSIIndicator} over {@code period} bars.
 *
 * <p>Buys on a positive move while RSI is below the oversold level and sells on a negative move
 * while RSI is above the overbought level. Every signal carries a stop-loss and a take-profit,
 * so it is routed as a BRACKET order.
 */
public class MomentumStrategy extends BaseStrategy {

    private final MomentumConfig config;
    private final RSIIndicator rsi;

    public MomentumStrategy(String id, String symbol, MomentumConfig config) {
        super(id, symbol, config.getPeriod() + 1);
        this.config = config;
        this.rsi = new RSIIndicator(closePrices(), config.getPeriod());
    }

    @Override
    protected List<Signal> evaluate(Tick tick) {
        if (!hasFullHistory()) {
            return List.of();
        }
        int index = lastIndex();
        double current = valueAt(closePrices(), index);
        double previous = valueAt(closePrices(), index - 1);
        double momentum = (current - previous) / previous * 100.0;
        double rsi = valueAt(this.rsi, index);

        SignalAction action;
        if (momentum > config.getMinMomentumPercent() && rsi < 100 - config.getRsiThreshold()) {
            action = SignalAction.BUY;
        } else if (momentum < -config.getMinMomentumPercent() && rsi > config.getRsiThreshold()) {
            action = SignalAction.SELL;
        } else {
            return List.of();
        }

        double direction = action == SignalAction.BUY ? 1 : -1;
        double stopLoss = current * (1 - direction * config.getStopLossPercent() / 100.0);
        double takeProfit = current * (1 + direction * config.getTakeProfitPercent() / 100.0);
        int strength = (int) Math.min(100, Math.round(Math.abs(momentum) * 20));

        return List.of(signal(action, strength)
                .price(price(current))
                .stopLoss(price(stopLoss))
                .takeProfit(price(takeProfit))
                .quantity(positionSize(config.getQuantity(), config.getCapital(), config.getCapitalPercent(), current))
                .timestamp(tick.getTimestamp())
                .metadata(Map.of("momentum", momentum, "rsi", rsi))
                .build());
    }
}
