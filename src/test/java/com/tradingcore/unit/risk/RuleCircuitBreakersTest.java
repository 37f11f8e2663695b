package com.tradingcore.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradingcore.domain.enums.RiskRuleType;
import com.tradingcore.event.EventPublisherHelper;
import com.tradingcore.event.RiskEvent;
import com.tradingcore.event.RiskEventType;
import com.tradingcore.risk.CircuitBreakerState;
import com.tradingcore.risk.RiskLimits;
import com.tradingcore.risk.RiskLimitsStore;
import com.tradingcore.risk.RiskRuleKey;
import com.tradingcore.risk.RuleCircuitBreakers;
import com.tradingcore.support.MutableClock;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RuleCircuitBreakersTest {

    private static final RiskRuleKey X_ORDER_VALUE = RiskRuleKey.of("X", RiskRuleType.ORDER_VALUE);

    private final List<Object> events = new ArrayList<>();
    private MutableClock clock;
    private RuleCircuitBreakers breakers;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        EventPublisherHelper helper = new EventPublisherHelper(event -> {
            synchronized (events) {
                events.add(event);
            }
        });
        RiskLimitsStore store = new RiskLimitsStore(
                RiskLimits.builder()
                        .breakerFailureThreshold(3)
                        .breakerFailureWindow(Duration.ofMinutes(1))
                        .breakerCooldown(Duration.ofMinutes(5))
                        .build(),
                helper);
        events.clear();
        breakers = new RuleCircuitBreakers(store, helper, clock);
    }

    private List<RiskEventType> riskEventTypes() {
        synchronized (events) {
            return events.stream()
                    .filter(RiskEvent.class::isInstance)
                    .map(event -> ((RiskEvent) event).getEventType())
                    .toList();
        }
    }

    @Test
    @DisplayName("Threshold failures inside the window open the breaker once")
    void thresholdReached_opens() {
        breakers.recordFailure(X_ORDER_VALUE);
        breakers.recordFailure(X_ORDER_VALUE);
        assertThat(breakers.isOpen(X_ORDER_VALUE)).isFalse();

        breakers.recordFailure(X_ORDER_VALUE);
        breakers.recordFailure(X_ORDER_VALUE);

        assertThat(breakers.isOpen(X_ORDER_VALUE)).isTrue();
        assertThat(breakers.getState(X_ORDER_VALUE))
                .get()
                .extracting(CircuitBreakerState::getState)
                .isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(riskEventTypes()).containsExactly(RiskEventType.CIRCUIT_BREAKER_OPENED);
    }

    @Test
    @DisplayName("Failures older than the window roll out one second at a time")
    void slidingWindow_dropsOldFailures() {
        breakers.recordFailure(X_ORDER_VALUE);
        clock.advance(Duration.ofSeconds(30));
        breakers.recordFailure(X_ORDER_VALUE);
        clock.advance(Duration.ofSeconds(31));
        breakers.recordFailure(X_ORDER_VALUE);

        assertThat(breakers.isOpen(X_ORDER_VALUE)).isFalse();
        assertThat(breakers.getState(X_ORDER_VALUE))
                .get()
                .extracting(CircuitBreakerState::getFailureCount)
                .isEqualTo(2);

        breakers.recordFailure(X_ORDER_VALUE);

        assertThat(breakers.isOpen(X_ORDER_VALUE)).isTrue();
    }

    @Test
    @DisplayName("Failures spread beyond the window start a new count")
    void windowExpired_restartsCount() {
        breakers.recordFailure(X_ORDER_VALUE);
        breakers.recordFailure(X_ORDER_VALUE);
        clock.advance(Duration.ofSeconds(61));
        breakers.recordFailure(X_ORDER_VALUE);

        assertThat(breakers.isOpen(X_ORDER_VALUE)).isFalse();
        assertThat(breakers.getState(X_ORDER_VALUE))
                .get()
                .extracting(CircuitBreakerState::getFailureCount)
                .isEqualTo(1);
    }

    @Test
    @DisplayName("Keys are independent: one symbol's breaker does not affect another")
    void keysIndependent() {
        for (int i = 0; i < 3; i++) {
            breakers.recordFailure(X_ORDER_VALUE);
        }

        assertThat(breakers.isOpen(RiskRuleKey.of("Y", RiskRuleType.ORDER_VALUE))).isFalse();
        assertThat(breakers.isOpen(RiskRuleKey.of("X", RiskRuleType.POSITION_VALUE))).isFalse();
    }

    @Test
    @DisplayName("Portfolio rules share one key regardless of symbol")
    void portfolioRule_ignoresSymbol() {
        assertThat(RiskRuleKey.of("X", RiskRuleType.DRAWDOWN)).isEqualTo(RiskRuleKey.portfolio(RiskRuleType.DRAWDOWN));
        assertThat(RiskRuleKey.portfolio(RiskRuleType.DAILY_LOSS).toString()).isEqualTo("*/DAILY_LOSS");
    }

    @Test
    @DisplayName("Open breaker closes, not half-opens, on the first check after the cooldown")
    void cooldownElapsed_closesOnCheck() {
        for (int i = 0; i < 3; i++) {
            breakers.recordFailure(X_ORDER_VALUE);
        }
        clock.advance(Duration.ofMinutes(4));
        assertThat(breakers.isOpen(X_ORDER_VALUE)).isTrue();

        clock.advance(Duration.ofMinutes(1).plusSeconds(1));

        assertThat(breakers.isOpen(X_ORDER_VALUE)).isFalse();
        assertThat(breakers.getState(X_ORDER_VALUE)).isEmpty();
        assertThat(breakers.isOpen(X_ORDER_VALUE)).isFalse();
        assertThat(riskEventTypes())
                .containsExactly(RiskEventType.CIRCUIT_BREAKER_OPENED, RiskEventType.CIRCUIT_BREAKER_CLOSED);
    }

    @Test
    @DisplayName("Scheduled sweep closes every cooled-down breaker")
    void sweep_closesExpired() {
        RiskRuleKey drawdown = RiskRuleKey.portfolio(RiskRuleType.DRAWDOWN);
        for (int i = 0; i < 3; i++) {
            breakers.recordFailure(X_ORDER_VALUE);
            breakers.recordFailure(drawdown);
        }
        clock.advance(Duration.ofMinutes(6));

        breakers.sweepExpired();

        assertThat(breakers.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Operator reset closes an open breaker and publishes the close")
    void reset_closesImmediately() {
        for (int i = 0; i < 3; i++) {
            breakers.recordFailure(X_ORDER_VALUE);
        }

        breakers.reset(X_ORDER_VALUE);

        assertThat(breakers.isOpen(X_ORDER_VALUE)).isFalse();
        assertThat(riskEventTypes()).endsWith(RiskEventType.CIRCUIT_BREAKER_CLOSED);
    }

    @Test
    @DisplayName("Concurrent failures are all counted and the breaker opens exactly once")
    void concurrentFailures_openOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 0; i < 50; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    breakers.recordFailure(X_ORDER_VALUE);
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(riskEventTypes()).containsExactly(RiskEventType.CIRCUIT_BREAKER_OPENED);
        assertThat(breakers.isOpen(X_ORDER_VALUE)).isTrue();
    }
}
