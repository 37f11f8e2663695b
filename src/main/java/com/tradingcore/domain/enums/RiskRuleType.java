package com.tradingcore.domain.enums;

/**
 * Risk rules enforced by the gate and the portfolio monitor.
 * ORDER_VALUE and POSITION_VALUE are per symbol; DRAWDOWN and DAILY_LOSS are portfolio-wide.
 */
public enum RiskRuleType {
    EMERGENCY_STOP(false),
    ORDER_VALUE(false),
    POSITION_VALUE(false),
    DRAWDOWN(true),
    DAILY_LOSS(true);

    private final boolean portfolioWide;

    RiskRuleType(boolean portfolioWide) {
        this.portfolioWide = portfolioWide;
    }

    public boolean isPortfolioWide() {
        return portfolioWide;
    }
}
