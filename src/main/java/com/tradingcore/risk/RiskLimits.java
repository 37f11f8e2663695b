package com.tradingcore.risk;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Risk limits enforced by {@link RiskGate} and {@link PortfolioLimitMonitor}.
 *
 * <p>Immutable: a runtime change replaces the whole object through
 * {@link RiskLimitsStore#update(RiskLimits)}, and each validation reads exactly one instance.
 * A null limit disables its check.
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {

    // ==================== Portfolio-Level Limits ====================

    /** Maximum decline from the portfolio high-water mark, in percent. */
    BigDecimal maxDrawdownPercent;

    /** Maximum loss since the start of the trading day. */
    BigDecimal maxDailyLoss;

    /** Unrealized loss per position, in percent of entry price, that raises a stop-loss warning. */
    BigDecimal stopLossPercent;

    /** Whether a portfolio limit breach triggers the emergency halt. */
    boolean emergencyStopEnabled;

    // ==================== Order-Level Limits ====================

    /** Maximum quantity x reference price of a single order. */
    BigDecimal maxOrderValue;

    /** Maximum absolute value of the position an order would leave behind, open orders included. */
    BigDecimal maxPositionValue;

    // ==================== Circuit Breaker ====================

    /** Failures of one rule within {@link #breakerFailureWindow} that open its breaker. */
    @Builder.Default
    int breakerFailureThreshold = 3;

    @Builder.Default
    Duration breakerFailureWindow = Duration.ofMinutes(1);

    /** How long an open breaker stays open before closing on its own. */
    @Builder.Default
    Duration breakerCooldown = Duration.ofMinutes(5);
}
