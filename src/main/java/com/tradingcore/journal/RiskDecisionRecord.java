package com.tradingcore.journal;

import com.tradingcore.domain.enums.OrderKind;
import com.tradingcore.domain.enums.OrderSide;
import com.tradingcore.domain.enums.RiskRuleType;
import com.tradingcore.domain.model.OrderIntent;
import com.tradingcore.risk.RiskDecision;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Journaled form of a risk decision together with the intent it was made for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskDecisionRecord {

    private String signalId;
    private String strategyId;
    private String symbol;
    private OrderSide side;
    private OrderKind kind;
    private int quantity;
    private BigDecimal referencePrice;
    private BigDecimal notional;
    private boolean allowed;
    private String reason;
    private RiskRuleType ruleType;

    public static RiskDecisionRecord of(OrderIntent intent, RiskDecision decision) {
        return RiskDecisionRecord.builder()
                .signalId(intent.getSignalId())
                .strategyId(intent.getStrategyId())
                .symbol(intent.getSymbol())
                .side(intent.getSide())
                .kind(intent.getKind())
                .quantity(intent.getQuantity())
                .referencePrice(intent.getReferencePrice())
                .notional(intent.notional())
                .allowed(decision.isAllowed())
                .reason(decision.getReason())
                .ruleType(decision.getRuleType())
                .build();
    }
}
