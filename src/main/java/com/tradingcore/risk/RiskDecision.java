package com.tradingcore.risk;

import com.tradingcore.domain.enums.RiskRuleType;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of {@link RiskGate#validate}. Rejections are values, never exceptions.
 * {@code ruleType} names the rule that failed, or is null for approvals and for
 * rejections that are not tied to a configurable rule.
 */
@Getter
@ToString
public class RiskDecision {

    private static final RiskDecision ALLOWED = new RiskDecision(true, null, null);

    private final boolean allowed;
    private final String reason;
    private final RiskRuleType ruleType;

    private RiskDecision(boolean allowed, String reason, RiskRuleType ruleType) {
        this.allowed = allowed;
        this.reason = reason;
        this.ruleType = ruleType;
    }

    public static RiskDecision allowed() {
        return ALLOWED;
    }

    public static RiskDecision rejected(RiskRuleType ruleType, String reason) {
        return new RiskDecision(false, reason, ruleType);
    }

    public boolean isRejected() {
        return !allowed;
    }
}
