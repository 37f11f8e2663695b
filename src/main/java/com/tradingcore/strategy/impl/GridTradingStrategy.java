package com.tradingcore.strategy.impl;

import com.tradingcore.domain.enums.OrderSide;
import com.tradingcore.domain.enums.OrderStatus;
import com.tradingcore.domain.enums.SignalAction;
import com.tradingcore.domain.model.Order;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.domain.model.Tick;
import com.tradingcore.strategy.base.BaseStrategy;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grid trading with resting limit orders, mixed push and pull.
 *
 * <p>The first tick lays out the grid: {@code gridLevels / 2} BUY limits below the base price and
 * as many SELL limits above it, {@code gridSpacing} apart. When a grid order fills, a counter
 * order one step away on the opposite side is queued for the next poll, so a BUY filled at
 * {@code p} is followed by a SELL at {@code p * (1 + gridSpacing)} and vice versa. A level that
 * already has a working order is not placed twice. Rejected orders free their level.
 */
public class GridTradingStrategy extends BaseStrategy {

    private static final Logger log = LoggerFactory.getLogger(GridTradingStrategy.class);

    private final GridTradingConfig config;

    /** Limit prices of grid orders sent and not yet filled or rejected. */
    private final NavigableSet<BigDecimal> workingLevels = new TreeSet<>();

    private boolean gridPlaced;

    public GridTradingStrategy(String id, String symbol, GridTradingConfig config) {
        super(id, symbol, 2);
        if (config.getGridLevels() < 2) {
            throw new IllegalArgumentException("gridLevels must be at least 2, got " + config.getGridLevels());
        }
        if (config.getGridSpacing() <= 0 || config.getGridSpacing() >= 1) {
            throw new IllegalArgumentException("gridSpacing must be within (0, 1), got " + config.getGridSpacing());
        }
        this.config = config;
    }

    @Override
    protected List<Signal> evaluate(Tick tick) {
        if (gridPlaced) {
            return List.of();
        }
        gridPlaced = true;

        double base = config.getBasePrice() != null ? config.getBasePrice() : tick.getPrice().doubleValue();
        int perSide = config.getGridLevels() / 2;
        List<Signal> signals = new ArrayList<>(perSide * 2);
        double step = base * config.getGridSpacing();
        for (int level = 1; level <= perSide; level++) {
            addLevel(signals, SignalAction.BUY, base - step * level, Map.of("gridLevel", -level));
        }
        for (int level = 1; level <= perSide; level++) {
            addLevel(signals, SignalAction.SELL, base + step * level, Map.of("gridLevel", level));
        }
        log.info("[{}] Grid of {} orders around {}", getId(), signals.size(), price(base));
        return signals;
    }

    @Override
    public void onFill(Order order) {
        super.onFill(order);
        if (order.getPrice() == null) {
            return;
        }
        if (order.getStatus() == OrderStatus.REJECTED) {
            workingLevels.remove(order.getPrice());
            log.warn("[{}] Grid order at {} rejected, level freed", getId(), order.getPrice());
            return;
        }
        if (order.getStatus() != OrderStatus.FILLED || !workingLevels.remove(order.getPrice())) {
            return;
        }

        double step = order.getPrice().doubleValue() * config.getGridSpacing();
        Map<String, Object> metadata = Map.of("counterTo", order.getId());
        List<Signal> counter = new ArrayList<>(1);
        if (order.getSide() == OrderSide.BUY) {
            addLevel(counter, SignalAction.SELL, order.getPrice().doubleValue() + step, metadata);
        } else {
            addLevel(counter, SignalAction.BUY, order.getPrice().doubleValue() - step, metadata);
        }
        counter.forEach(this::defer);
    }

    private void addLevel(List<Signal> out, SignalAction action, double levelPrice, Map<String, Object> metadata) {
        BigDecimal limit = price(levelPrice);
        if (!workingLevels.add(limit)) {
            log.debug("[{}] Level {} already working, skipped", getId(), limit);
            return;
        }
        out.add(signal(action, config.getSignalStrength())
                .price(limit)
                .quantity(positionSize(
                        config.getQuantity(),
                        config.getCapital(),
                        config.getCapitalPercent() / config.getGridLevels(),
                        levelPrice))
                .metadata(metadata)
                .build());
    }
}
