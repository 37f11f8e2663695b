package com.tradingcore.risk;

import com.tradingcore.domain.enums.RiskRuleType;

/**
 * Circuit breaker key. Portfolio-wide rules use {@link #PORTFOLIO} as the symbol.
 */
public record RiskRuleKey(String symbol, RiskRuleType ruleType) {

    public static final String PORTFOLIO = "*";

    public static RiskRuleKey of(String symbol, RiskRuleType ruleType) {
        return new RiskRuleKey(ruleType.isPortfolioWide() ? PORTFOLIO : symbol, ruleType);
    }

    public static RiskRuleKey portfolio(RiskRuleType ruleType) {
        return new RiskRuleKey(PORTFOLIO, ruleType);
    }

    @Override
    public String toString() {
        return symbol + "/" + ruleType;
    }
}
