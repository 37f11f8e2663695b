package com.tradingcore.risk;

import com.tradingcore.domain.enums.AlertSeverity;
import com.tradingcore.event.EventPublisherHelper;
import com.tradingcore.event.RiskEventType;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Per-rule circuit breakers for the risk gate, one resilience4j {@link CircuitBreaker} per
 * {@link RiskRuleKey}.
 *
 * <p>Each breaker uses a time-based sliding window of {@link RiskLimits#getBreakerFailureWindow()}
 * in which every recorded call is a failure, so it opens once
 * {@link RiskLimits#getBreakerFailureThreshold()} failures land inside the window. While open, every
 * intent the key applies to is rejected without evaluating the rule.
 *
 * <p>Once {@link RiskLimits#getBreakerCooldown()} has passed, the first {@link #isOpen} check or
 * scheduled sweep closes the breaker outright instead of leaving it half-open: a risk rule has no
 * trial call to let through. A closed breaker is dropped, so the next failure for its key starts a
 * fresh breaker under the limits current at that time.
 */
@Component
public class RuleCircuitBreakers {

    private static final Logger log = LoggerFactory.getLogger(RuleCircuitBreakers.class);

    private final Map<RiskRuleKey, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final RiskLimitsStore riskLimitsStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public RuleCircuitBreakers(RiskLimitsStore riskLimitsStore, EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.riskLimitsStore = riskLimitsStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // FAILURE RECORDING
    // ========================

    /** Counts one failure for the key. */
    public void recordFailure(RiskRuleKey key) {
        breakers.computeIfAbsent(key, this::createBreaker)
                .onError(0, TimeUnit.NANOSECONDS, new RuleFailure(key));
    }

    private CircuitBreaker createBreaker(RiskRuleKey key) {
        RiskLimits limits = riskLimitsStore.get();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.TIME_BASED)
                .slidingWindowSize((int) Math.max(1, limits.getBreakerFailureWindow().toSeconds()))
                .minimumNumberOfCalls(limits.getBreakerFailureThreshold())
                .failureRateThreshold(100)
                .waitDurationInOpenState(limits.getBreakerCooldown())
                .build();

        CircuitBreaker breaker = new CircuitBreakerStateMachine(key.toString(), config, clock);
        breaker.getEventPublisher()
                .onStateTransition(event -> onTransition(key, limits, event.getStateTransition()));
        return breaker;
    }

    private void onTransition(RiskRuleKey key, RiskLimits limits, CircuitBreaker.StateTransition transition) {
        if (transition.getToState() == CircuitBreaker.State.OPEN) {
            log.warn(
                    "Circuit breaker OPEN for {} after {} failures, cooldown {}",
                    key,
                    limits.getBreakerFailureThreshold(),
                    limits.getBreakerCooldown());
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.CIRCUIT_BREAKER_OPENED,
                    AlertSeverity.WARNING,
                    "Circuit breaker opened for " + key,
                    Map.of("symbol", key.symbol(), "rule", key.ruleType().name()));
        } else if (transition.getToState() == CircuitBreaker.State.CLOSED) {
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.CIRCUIT_BREAKER_CLOSED,
                    AlertSeverity.INFO,
                    "Circuit breaker closed for " + key);
        }
    }

    // ========================
    // STATE QUERIES
    // ========================

    /**
     * Whether the breaker for this key is open. An open breaker whose cooldown has passed is
     * closed as a side effect and reported as closed.
     */
    public boolean isOpen(RiskRuleKey key) {
        CircuitBreaker breaker = breakers.get(key);
        if (breaker == null || breaker.getState() == CircuitBreaker.State.CLOSED) {
            return false;
        }
        closeIfCooledDown(key, breaker);
        return breaker.getState() == CircuitBreaker.State.OPEN;
    }

    public Optional<CircuitBreakerState> getState(RiskRuleKey key) {
        return Optional.ofNullable(breakers.get(key)).map(RuleCircuitBreakers::stateOf);
    }

    public Map<RiskRuleKey, CircuitBreakerState> snapshot() {
        return breakers.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, entry -> stateOf(entry.getValue())));
    }

    private static CircuitBreakerState stateOf(CircuitBreaker breaker) {
        return CircuitBreakerState.builder()
                .state(breaker.getState())
                .failureCount(breaker.getMetrics().getNumberOfFailedCalls())
                .build();
    }

    // ========================
    // CLOSING
    // ========================

    /**
     * Closes every breaker whose cooldown has passed.
     */
    @Scheduled(fixedDelayString = "${tradingcore.risk.breaker-sweep-interval-ms:5000}")
    public void sweepExpired() {
        breakers.forEach((key, breaker) -> {
            if (breaker.getState() != CircuitBreaker.State.CLOSED) {
                closeIfCooledDown(key, breaker);
            }
        });
    }

    /** Operator reset of one breaker. */
    public void reset(RiskRuleKey key) {
        CircuitBreaker removed = breakers.remove(key);
        if (removed != null && removed.getState() != CircuitBreaker.State.CLOSED) {
            log.info("Circuit breaker for {} reset by operator", key);
            removed.transitionToClosedState();
        }
    }

    /** Operator reset of all breakers. */
    public void resetAll() {
        for (RiskRuleKey key : breakers.keySet()) {
            reset(key);
        }
    }

    private void closeIfCooledDown(RiskRuleKey key, CircuitBreaker breaker) {
        // an open breaker only grants a permission once its wait duration is over, moving to half-open
        if (breaker.getState() == CircuitBreaker.State.OPEN && !breaker.tryAcquirePermission()) {
            return;
        }
        if (breakers.remove(key, breaker)) {
            log.info("Circuit breaker for {} closed after cooldown", key);
            breaker.transitionToClosedState();
        }
    }

    /** Failure recorded against a rule's breaker. */
    private static final class RuleFailure extends RuntimeException {

        RuleFailure(RiskRuleKey key) {
            super("risk rule failed: " + key, null, false, false);
        }
    }
}
