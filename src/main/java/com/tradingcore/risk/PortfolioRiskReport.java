package com.tradingcore.risk;

import com.tradingcore.domain.enums.RiskRuleType;
import com.tradingcore.domain.enums.RiskStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Result of one portfolio limit check.
 */
@Value
@Builder
public class PortfolioRiskReport {

    RiskStatus status;
    BigDecimal totalValue;

    /** High-water mark of {@code totalValue}; never decreases. */
    BigDecimal peakValue;

    BigDecimal drawdownPercent;
    BigDecimal dailyPnl;

    @Builder.Default
    List<RiskRuleType> breaches = List.of();

    /** Symbols whose unrealized loss has reached the stop-loss percentage. */
    @Builder.Default
    List<String> stopLossBreaches = List.of();

    boolean haltTriggered;
    Instant asOf;
}
