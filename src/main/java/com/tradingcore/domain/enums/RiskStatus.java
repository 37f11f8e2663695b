package com.tradingcore.domain.enums;

/**
 * Overall risk posture reported by the portfolio monitor.
 */
public enum RiskStatus {
    SAFE,
    /** At least one metric has reached 70% of its limit. */
    WARNING,
    /** At least one limit is breached. */
    DANGER,
    /** Trading halted. */
    EMERGENCY_STOP
}
