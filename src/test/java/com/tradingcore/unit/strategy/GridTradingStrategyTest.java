package com.tradingcore.unit.strategy;

import static com.tradingcore.unit.strategy.StrategyTestSupport.feed;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.tradingcore.domain.enums.OrderSide;
import com.tradingcore.domain.enums.OrderStatus;
import com.tradingcore.domain.enums.SignalAction;
import com.tradingcore.domain.model.Order;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.strategy.impl.GridTradingConfig;
import com.tradingcore.strategy.impl.GridTradingStrategy;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GridTradingStrategyTest {

    private final GridTradingStrategy strategy = new GridTradingStrategy(
            "grid-1",
            "AAPL",
            GridTradingConfig.builder().gridSpacing(0.01).gridLevels(4).quantity(5).build());

    private static Order gridOrder(OrderSide side, String price, OrderStatus status) {
        return Order.builder()
                .id("o-" + price)
                .strategyId("grid-1")
                .symbol("AAPL")
                .side(side)
                .price(new BigDecimal(price))
                .quantity(5)
                .filledQuantity(status == OrderStatus.FILLED ? 5 : 0)
                .status(status)
                .build();
    }

    @Test
    @DisplayName("First tick lays out limit orders below and above the price")
    void firstTick_placesGrid() {
        assertThat(feed(strategy, 100, 100.5, 99))
                .extracting(Signal::getAction, signal -> signal.getPrice().toPlainString(), Signal::getQuantity)
                .containsExactly(
                        tuple(SignalAction.BUY, "99.00", 5),
                        tuple(SignalAction.BUY, "98.00", 5),
                        tuple(SignalAction.SELL, "101.00", 5),
                        tuple(SignalAction.SELL, "102.00", 5));
    }

    @Test
    @DisplayName("A configured base price centres the grid instead of the first tick")
    void basePriceConfigured() {
        GridTradingStrategy centred = new GridTradingStrategy(
                "grid-2",
                "AAPL",
                GridTradingConfig.builder().gridSpacing(0.01).gridLevels(2).basePrice(200.0).build());

        assertThat(feed(centred, 100))
                .extracting(signal -> signal.getPrice().toPlainString())
                .containsExactly("198.00", "202.00");
    }

    @Test
    @DisplayName("Without a fixed quantity each level gets an equal share of the capital slice")
    void sizedFromCapital() {
        GridTradingStrategy sized = new GridTradingStrategy("grid-3", "AAPL", GridTradingConfig.builder().build());

        assertThat(feed(sized, 100)).first().satisfies(signal -> {
            assertThat(signal.getPrice()).isEqualByComparingTo("99.50");
            assertThat(signal.getQuantity()).isEqualTo(5);
        });
    }

    @Test
    @DisplayName("A filled BUY queues a SELL one step above for the next poll")
    void buyFilled_countersAbove() {
        feed(strategy, 100);

        strategy.onFill(gridOrder(OrderSide.BUY, "99.00", OrderStatus.FILLED));

        assertThat(strategy.generateSignals()).singleElement().satisfies(signal -> {
            assertThat(signal.getAction()).isEqualTo(SignalAction.SELL);
            assertThat(signal.getPrice()).isEqualByComparingTo("99.99");
            assertThat(signal.getMetadata()).containsEntry("counterTo", "o-99.00");
        });
        assertThat(strategy.generateSignals()).isEmpty();
    }

    @Test
    @DisplayName("A filled SELL queues a BUY one step below")
    void sellFilled_countersBelow() {
        feed(strategy, 100);

        strategy.onFill(gridOrder(OrderSide.SELL, "102.00", OrderStatus.FILLED));

        assertThat(strategy.generateSignals())
                .extracting(Signal::getAction, signal -> signal.getPrice().toPlainString())
                .containsExactly(tuple(SignalAction.BUY, "100.98"));
    }

    @Test
    @DisplayName("Partial fills and unknown prices queue nothing")
    void partialOrForeign_ignored() {
        feed(strategy, 100);

        strategy.onFill(gridOrder(OrderSide.BUY, "99.00", OrderStatus.PARTIAL));
        strategy.onFill(gridOrder(OrderSide.BUY, "97.00", OrderStatus.FILLED));

        assertThat(strategy.generateSignals()).isEmpty();
    }

    @Test
    @DisplayName("A repeated fill report for one level queues a single counter order")
    void repeatedFill_countersOnce() {
        GridTradingStrategy wide = new GridTradingStrategy(
                "grid-4",
                "AAPL",
                GridTradingConfig.builder().gridSpacing(0.01).gridLevels(4).basePrice(100.0).build());
        feed(wide, 100);
        wide.onFill(gridOrder(OrderSide.SELL, "101.00", OrderStatus.FILLED));
        assertThat(wide.generateSignals()).hasSize(1);

        wide.onFill(gridOrder(OrderSide.SELL, "101.00", OrderStatus.FILLED));

        assertThat(wide.generateSignals()).isEmpty();
    }

    @Test
    @DisplayName("Fewer than two levels is a configuration error")
    void invalidLevels() {
        assertThatThrownBy(() -> new GridTradingStrategy(
                        "grid-5", "AAPL", GridTradingConfig.builder().gridLevels(1).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("gridLevels");
    }
}
