package com.tradingcore.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time portfolio valuation used by the portfolio limit checks.
 */
@Value
@Builder
public class PortfolioSnapshot {

    BigDecimal totalValue;
    BigDecimal dailyPnl;
    BigDecimal realizedPnl;
    BigDecimal unrealizedPnl;
    Instant asOf;
}
