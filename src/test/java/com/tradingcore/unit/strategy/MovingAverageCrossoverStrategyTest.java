package com.tradingcore.unit.strategy;

import static com.tradingcore.unit.strategy.StrategyTestSupport.feed;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradingcore.domain.enums.SignalAction;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.domain.model.Tick;
import com.tradingcore.strategy.impl.MovingAverageCrossoverConfig;
import com.tradingcore.strategy.impl.MovingAverageCrossoverStrategy;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MovingAverageCrossoverStrategyTest {

    private final MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(
            "ma-1",
            "AAPL",
            MovingAverageCrossoverConfig.builder().shortPeriod(2).longPeriod(4).build());

    @Test
    @DisplayName("Crossovers are deferred until the next poll")
    void crossoverDeferredToPoll() {
        List<Signal> onTick = feed(strategy, 10, 11, 12, 13, 9);

        assertThat(onTick).isEmpty();
        List<Signal> polled = strategy.generateSignals();
        assertThat(polled).singleElement().satisfies(signal -> {
            assertThat(signal.getAction()).isEqualTo(SignalAction.SELL);
            assertThat(signal.getStrategyId()).isEqualTo("ma-1");
            assertThat(signal.getStrength()).isEqualTo(75);
            assertThat(signal.getQuantity()).isNull();
        });
        assertThat(strategy.generateSignals()).isEmpty();
    }

    @Test
    @DisplayName("Upward cross after a downward one queues a BUY")
    void crossBackUp() {
        feed(strategy, 10, 11, 12, 13, 9);
        strategy.generateSignals();

        feed(strategy, 20);

        assertThat(strategy.generateSignals())
                .extracting(Signal::getAction)
                .containsExactly(SignalAction.BUY);
    }

    @Test
    @DisplayName("The first full window only sets the reference side")
    void firstWindowNoSignal() {
        feed(strategy, 10, 11, 12, 13, 14, 15);

        assertThat(strategy.generateSignals()).isEmpty();
    }

    @Test
    @DisplayName("Ticks sharing a timestamp each count as a bar")
    void sameTimestampTicks_eachCounted() {
        Instant sameInstant = Instant.parse("2024-03-01T10:00:00Z");
        for (double price : new double[] {10, 11, 12, 13, 9}) {
            strategy.onTick(Tick.of("AAPL", BigDecimal.valueOf(price), sameInstant));
        }

        assertThat(strategy.generateSignals())
                .extracting(Signal::getAction)
                .containsExactly(SignalAction.SELL);
    }

    @Test
    @DisplayName("Short period must be below long period")
    void invalidPeriods() {
        MovingAverageCrossoverConfig config =
                MovingAverageCrossoverConfig.builder().shortPeriod(5).longPeriod(5).build();

        assertThatThrownBy(() -> new MovingAverageCrossoverStrategy("ma-1", "AAPL", config))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
