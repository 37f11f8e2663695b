package com.tradingcore.risk;

import com.tradingcore.domain.enums.OrderSide;
import com.tradingcore.domain.enums.RiskRuleType;
import com.tradingcore.domain.model.OrderIntent;
import com.tradingcore.oms.OrderLifecycleManager;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pre-trade validation of every order intent.
 *
 * <p>Checks run in a fixed order and the first failure wins:
 * <ol>
 *   <li>emergency stop flag</li>
 *   <li>open circuit breakers, portfolio-wide first, then the intent's symbol</li>
 *   <li>order value: quantity x reference price against {@code maxOrderValue}</li>
 *   <li>projected position value against {@code maxPositionValue}</li>
 * </ol>
 *
 * <p>A failed value check counts a failure on that rule's breaker, so a strategy that keeps
 * producing oversized orders for one symbol gets that symbol's rule tripped for the cooldown.
 *
 * <p>The projection includes open entry orders for the symbol, read together with the position
 * in one consistent snapshot from the order lifecycle manager. Callers that need two intents for
 * the same symbol to be checked against each other must validate and place them serially; the
 * order router does this through its per-symbol lanes.
 */
@Service
public class RiskGate {

    private static final Logger log = LoggerFactory.getLogger(RiskGate.class);

    private static final List<RiskRuleType> PORTFOLIO_RULES = List.of(RiskRuleType.DRAWDOWN, RiskRuleType.DAILY_LOSS);
    private static final List<RiskRuleType> SYMBOL_RULES =
            List.of(RiskRuleType.ORDER_VALUE, RiskRuleType.POSITION_VALUE);

    private final RiskLimitsStore riskLimitsStore;
    private final RuleCircuitBreakers circuitBreakers;
    private final OrderLifecycleManager orderLifecycleManager;

    private final AtomicBoolean emergencyStop = new AtomicBoolean(false);

    public RiskGate(
            RiskLimitsStore riskLimitsStore,
            RuleCircuitBreakers circuitBreakers,
            OrderLifecycleManager orderLifecycleManager) {
        this.riskLimitsStore = riskLimitsStore;
        this.circuitBreakers = circuitBreakers;
        this.orderLifecycleManager = orderLifecycleManager;
    }

    // ========================
    // VALIDATION
    // ========================

    public RiskDecision validate(OrderIntent intent) {
        RiskLimits limits = riskLimitsStore.get();
        String symbol = intent.getSymbol();

        if (emergencyStop.get()) {
            return reject(intent, RiskDecision.rejected(RiskRuleType.EMERGENCY_STOP, "emergency stop active"));
        }

        for (RiskRuleType rule : PORTFOLIO_RULES) {
            RiskRuleKey key = RiskRuleKey.portfolio(rule);
            if (circuitBreakers.isOpen(key)) {
                return reject(intent, RiskDecision.rejected(rule, "circuit breaker open for " + key));
            }
        }
        for (RiskRuleType rule : SYMBOL_RULES) {
            RiskRuleKey key = RiskRuleKey.of(symbol, rule);
            if (circuitBreakers.isOpen(key)) {
                return reject(intent, RiskDecision.rejected(rule, "circuit breaker open for " + key));
            }
        }

        if (intent.getQuantity() <= 0) {
            return reject(intent, RiskDecision.rejected(null, "quantity must be positive"));
        }
        BigDecimal orderValue = intent.notional();
        if (orderValue == null) {
            return reject(intent, RiskDecision.rejected(null, "no reference price for " + symbol));
        }

        if (limits.getMaxOrderValue() != null && orderValue.compareTo(limits.getMaxOrderValue()) > 0) {
            circuitBreakers.recordFailure(RiskRuleKey.of(symbol, RiskRuleType.ORDER_VALUE));
            return reject(
                    intent,
                    RiskDecision.rejected(
                            RiskRuleType.ORDER_VALUE,
                            "order value " + orderValue.toPlainString() + " exceeds max order value "
                                    + limits.getMaxOrderValue().toPlainString()));
        }

        if (limits.getMaxPositionValue() != null) {
            BigDecimal projected = projectedPositionValue(intent, orderValue);
            if (projected.compareTo(limits.getMaxPositionValue()) > 0) {
                circuitBreakers.recordFailure(RiskRuleKey.of(symbol, RiskRuleType.POSITION_VALUE));
                return reject(
                        intent,
                        RiskDecision.rejected(
                                RiskRuleType.POSITION_VALUE,
                                "projected position value " + projected.toPlainString()
                                        + " exceeds max position value "
                                        + limits.getMaxPositionValue().toPlainString()));
            }
        }

        log.debug(
                "Risk approved: {} {} {} x {} ({})",
                intent.getStrategyId(),
                intent.getSide(),
                intent.getQuantity(),
                symbol,
                orderValue);
        return RiskDecision.allowed();
    }

    /**
     * Absolute value of the signed position the intent would leave behind, counting open entry
     * orders as if filled. A BUY adds the order value and a SELL subtracts it, so selling from
     * flat or adding to a short grows the projection.
     */
    BigDecimal projectedPositionValue(OrderIntent intent, BigDecimal orderValue) {
        BigDecimal exposure =
                orderLifecycleManager.committedExposure(intent.getSymbol(), intent.getReferencePrice());
        BigDecimal signedOrderValue = intent.getSide() == OrderSide.BUY ? orderValue : orderValue.negate();
        return exposure.add(signedOrderValue).abs();
    }

    private RiskDecision reject(OrderIntent intent, RiskDecision decision) {
        log.info(
                "Risk rejected: {} {} {} x {}: {}",
                intent.getStrategyId(),
                intent.getSide(),
                intent.getQuantity(),
                intent.getSymbol(),
                decision.getReason());
        return decision;
    }

    // ========================
    // EMERGENCY STOP
    // ========================

    /** Returns true if this call set the flag. */
    public boolean activateEmergencyStop() {
        boolean set = emergencyStop.compareAndSet(false, true);
        if (set) {
            log.error("Emergency stop ACTIVE: all new orders will be rejected");
        }
        return set;
    }

    public void resetEmergencyStop() {
        if (emergencyStop.compareAndSet(true, false)) {
            log.warn("Emergency stop reset");
        }
    }

    public boolean isEmergencyStopActive() {
        return emergencyStop.get();
    }

    public RiskLimits getLimits() {
        return riskLimitsStore.get();
    }

    // ========================
    // OPERATOR BREAKER RESET
    // ========================

    public void resetBreaker(RiskRuleKey key) {
        circuitBreakers.reset(key);
    }

    public void resetAllBreakers() {
        circuitBreakers.resetAll();
    }
}
