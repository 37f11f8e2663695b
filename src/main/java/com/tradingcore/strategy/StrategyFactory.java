package com.tradingcore.strategy;

import com.tradingcore.config.StrategyProperties.StrategyDefinition;
import com.tradingcore.strategy.base.TradingStrategy;
import com.tradingcore.strategy.impl.GridTradingConfig;
import com.tradingcore.strategy.impl.GridTradingStrategy;
import com.tradingcore.strategy.impl.MeanReversionConfig;
import com.tradingcore.strategy.impl.MeanReversionStrategy;
import com.tradingcore.strategy.impl.MomentumConfig;
import com.tradingcore.strategy.impl.MomentumStrategy;
import com.tradingcore.strategy.impl.MovingAverageCrossoverConfig;
import com.tradingcore.strategy.impl.MovingAverageCrossoverStrategy;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds strategy instances from their configured definition.
 *
 * <p>Missing parameters fall back to the defaults of each config class. A malformed value or a
 * missing id, type or symbol is a configuration error and throws {@link IllegalArgumentException}.
 */
@Component
public class StrategyFactory {

    public TradingStrategy create(StrategyDefinition definition) {
        if (definition.getId() == null || definition.getId().isBlank()) {
            throw new IllegalArgumentException("Strategy definition without id");
        }
        if (definition.getType() == null) {
            throw new IllegalArgumentException("Strategy " + definition.getId() + " has no type");
        }
        if (definition.getSymbol() == null || definition.getSymbol().isBlank()) {
            throw new IllegalArgumentException("Strategy " + definition.getId() + " has no symbol");
        }

        Params params = new Params(definition.getId(), definition.getParams());
        return switch (definition.getType()) {
            case MA_CROSSOVER -> new MovingAverageCrossoverStrategy(
                    definition.getId(), definition.getSymbol(), movingAverageConfig(params));
            case MOMENTUM -> new MomentumStrategy(definition.getId(), definition.getSymbol(), momentumConfig(params));
            case MEAN_REVERSION -> new MeanReversionStrategy(
                    definition.getId(), definition.getSymbol(), meanReversionConfig(params));
            case GRID_TRADING -> new GridTradingStrategy(
                    definition.getId(), definition.getSymbol(), gridTradingConfig(params));
        };
    }

    private MovingAverageCrossoverConfig movingAverageConfig(Params params) {
        MovingAverageCrossoverConfig config = MovingAverageCrossoverConfig.builder().build();
        config.setShortPeriod(params.getInt("short-period", config.getShortPeriod()));
        config.setLongPeriod(params.getInt("long-period", config.getLongPeriod()));
        config.setSignalStrength(params.getInt("signal-strength", config.getSignalStrength()));
        config.setQuantity(params.getInteger("quantity"));
        return config;
    }

    private MomentumConfig momentumConfig(Params params) {
        MomentumConfig config = MomentumConfig.builder().build();
        config.setPeriod(params.getInt("period", config.getPeriod()));
        config.setRsiThreshold(params.getDouble("rsi-threshold", config.getRsiThreshold()));
        config.setMinMomentumPercent(params.getDouble("min-momentum-percent", config.getMinMomentumPercent()));
        config.setStopLossPercent(params.getDouble("stop-loss-percent", config.getStopLossPercent()));
        config.setTakeProfitPercent(params.getDouble("take-profit-percent", config.getTakeProfitPercent()));
        config.setCapital(params.getDouble("capital", config.getCapital()));
        config.setCapitalPercent(params.getDouble("capital-percent", config.getCapitalPercent()));
        config.setQuantity(params.getInteger("quantity"));
        return config;
    }

    private MeanReversionConfig meanReversionConfig(Params params) {
        MeanReversionConfig config = MeanReversionConfig.builder().build();
        config.setLookback(params.getInt("lookback", config.getLookback()));
        config.setThreshold(params.getDouble("threshold", config.getThreshold()));
        config.setStopLossPercent(params.getDouble("stop-loss-percent", config.getStopLossPercent()));
        config.setCapital(params.getDouble("capital", config.getCapital()));
        config.setCapitalPercent(params.getDouble("capital-percent", config.getCapitalPercent()));
        config.setQuantity(params.getInteger("quantity"));
        return config;
    }

    private GridTradingConfig gridTradingConfig(Params params) {
        GridTradingConfig config = GridTradingConfig.builder().build();
        config.setGridSpacing(params.getDouble("grid-spacing", config.getGridSpacing()));
        config.setGridLevels(params.getInt("grid-levels", config.getGridLevels()));
        config.setBasePrice(params.getOptionalDouble("base-price"));
        config.setCapital(params.getDouble("capital", config.getCapital()));
        config.setCapitalPercent(params.getDouble("capital-percent", config.getCapitalPercent()));
        config.setSignalStrength(params.getInt("signal-strength", config.getSignalStrength()));
        config.setQuantity(params.getInteger("quantity"));
        return config;
    }

    private record Params(String strategyId, Map<String, String> values) {

        int getInt(String key, int defaultValue) {
            Integer value = getInteger(key);
            return value != null ? value : defaultValue;
        }

        Integer getInteger(String key) {
            String raw = raw(key);
            if (raw == null) {
                return null;
            }
            try {
                return Integer.valueOf(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Strategy " + strategyId + ": parameter " + key + " is not an integer: " + raw, e);
            }
        }

        double getDouble(String key, double defaultValue) {
            Double value = getOptionalDouble(key);
            return value != null ? value : defaultValue;
        }

        Double getOptionalDouble(String key) {
            String raw = raw(key);
            if (raw == null) {
                return null;
            }
            try {
                return Double.valueOf(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Strategy " + strategyId + ": parameter " + key + " is not a number: " + raw, e);
            }
        }

        private String raw(String key) {
            if (values == null) {
                return null;
            }
            String value = values.get(key);
            return value == null || value.isBlank() ? null : value.trim();
        }
    }
}
