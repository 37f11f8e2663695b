package com.tradingcore.pnl;

import com.tradingcore.domain.model.PortfolioSnapshot;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Values the portfolio as starting capital plus realized and unrealized P&L.
 *
 * <p>Daily P&L is measured against the value seen at the first valuation of each trading day
 * in the configured zone.
 */
@Service
public class PortfolioValuationService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioValuationService.class);

    private final PositionLedger positionLedger;
    private final BigDecimal startingCapital;
    private final ZoneId tradingZone;
    private final Clock clock;

    private LocalDate currentDay;
    private BigDecimal dayStartValue;

    public PortfolioValuationService(
            PositionLedger positionLedger,
            @Value("${tradingcore.portfolio.starting-capital:100000}") BigDecimal startingCapital,
            @Value("${tradingcore.portfolio.trading-zone:UTC}") String tradingZone,
            Clock clock) {
        this.positionLedger = positionLedger;
        this.startingCapital = startingCapital;
        this.tradingZone = ZoneId.of(tradingZone);
        this.clock = clock;
    }

    public synchronized PortfolioSnapshot snapshot() {
        Instant now = clock.instant();
        BigDecimal realized = positionLedger.totalRealizedPnl();
        BigDecimal unrealized = positionLedger.totalUnrealizedPnl();
        BigDecimal totalValue = startingCapital.add(realized).add(unrealized);

        LocalDate today = LocalDate.ofInstant(now, tradingZone);
        if (!today.equals(currentDay)) {
            currentDay = today;
            dayStartValue = totalValue;
            log.info("New trading day {}: opening portfolio value {}", today, totalValue);
        }

        return PortfolioSnapshot.builder()
                .totalValue(totalValue)
                .dailyPnl(totalValue.subtract(dayStartValue))
                .realizedPnl(realized)
                .unrealizedPnl(unrealized)
                .asOf(now)
                .build();
    }

    public BigDecimal getStartingCapital() {
        return startingCapital;
    }
}
