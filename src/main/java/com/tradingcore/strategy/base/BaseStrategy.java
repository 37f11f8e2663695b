package com.tradingcore.strategy.base;

import com.tradingcore.domain.enums.SignalAction;
import com.tradingcore.domain.model.Order;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.domain.model.Tick;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBar;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.Num;

/**
 * Template for price-driven strategies.
 *
 * <p>Every tick becomes one bar of a bounded ta4j {@link BarSeries}, so subclasses build their
 * indicators once over {@link #closePrices()} and read them at {@link #lastIndex()}. Subclasses
 * implement {@link #evaluate(Tick)}, which runs after the tick's bar has been added and returns
 * the signals to emit immediately; signals queued with {@link #defer(Signal)} are handed out on
 * the next {@link #generateSignals()} poll.
 *
 * <p>Not thread-safe by itself: relies on the dispatcher's per-strategy serialization.
 */
public abstract class BaseStrategy implements TradingStrategy {

    private static final Logger log = LoggerFactory.getLogger(BaseStrategy.class);

    protected static final int PRICE_SCALE = 2;

    /** Bars kept beyond the warm-up so recursive indicators such as RSI have settled history. */
    private static final int MIN_RETAINED_BARS = 500;

    private static final Duration TICK_PERIOD = Duration.ofMillis(1);

    private final String id;
    private final String symbol;
    private final int warmUpBars;
    private final BarSeries series;
    private final ClosePriceIndicator closePrice;
    private final List<Signal> deferred = new ArrayList<>();

    protected BaseStrategy(String id, String symbol, int warmUpBars) {
        if (warmUpBars < 2) {
            throw new IllegalArgumentException("warmUpBars must be at least 2, got " + warmUpBars);
        }
        this.id = id;
        this.symbol = symbol;
        this.warmUpBars = warmUpBars;
        this.series = new BaseBarSeriesBuilder()
                .withName(id + ":" + symbol)
                .withMaxBarCount(Math.max(warmUpBars, MIN_RETAINED_BARS))
                .build();
        this.closePrice = new ClosePriceIndicator(series);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    // ========================
    // TEMPLATE
    // ========================

    @Override
    public final List<Signal> onTick(Tick tick) {
        appendBar(tick);
        return evaluate(tick);
    }

    @Override
    public List<Signal> generateSignals() {
        if (deferred.isEmpty()) {
            return List.of();
        }
        List<Signal> ready = List.copyOf(deferred);
        deferred.clear();
        return ready;
    }

    @Override
    public void onFill(Order order) {
        log.info(
                "[{}] {} {} {} x {} @ {}",
                id,
                order.getStatus(),
                order.getSide(),
                order.getFilledQuantity(),
                order.getSymbol(),
                order.getAverageFillPrice());
    }

    /**
     * Strategy logic for one tick. The tick's price is already the close of the bar at
     * {@link #lastIndex()}.
     */
    protected abstract List<Signal> evaluate(Tick tick);

    // ========================
    // HELPERS
    // ========================

    protected void defer(Signal signal) {
        deferred.add(signal);
    }

    protected BarSeries series() {
        return series;
    }

    protected ClosePriceIndicator closePrices() {
        return closePrice;
    }

    protected int lastIndex() {
        return series.getEndIndex();
    }

    protected boolean hasFullHistory() {
        return series.getBarCount() >= warmUpBars;
    }

    protected static double valueAt(Indicator<Num> indicator, int index) {
        return indicator.getValue(index).doubleValue();
    }

    protected Signal.SignalBuilder signal(SignalAction action, int strength) {
        return Signal.builder()
                .strategyId(id)
                .symbol(symbol)
                .action(action)
                .strength(Math.max(0, Math.min(100, strength)));
    }

    protected static BigDecimal price(double value) {
        return BigDecimal.valueOf(value).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Order size from a fixed quantity if configured, otherwise from a share of capital at the
     * given price. Never less than one.
     */
    protected static int positionSize(Integer fixedQuantity, double capital, double capitalPercent, double atPrice) {
        if (fixedQuantity != null) {
            return fixedQuantity;
        }
        int sized = (int) Math.floor(capital * capitalPercent / 100.0 / atPrice);
        return Math.max(1, sized);
    }

    private void appendBar(Tick tick) {
        ZonedDateTime endTime = ZonedDateTime.ofInstant(tick.getTimestamp(), ZoneOffset.UTC);
        if (series.getBarCount() > 0) {
            ZonedDateTime lastEnd = series.getLastBar().getEndTime();
            // bar end times must increase strictly
            if (!endTime.isAfter(lastEnd)) {
                endTime = lastEnd.plusNanos(1);
            }
        }
        double price = tick.getPrice().doubleValue();
        series.addBar(new BaseBar(TICK_PERIOD, endTime, price, price, price, price, 0));
    }
}
