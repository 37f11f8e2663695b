package com.tradingcore.risk;

import com.tradingcore.domain.enums.AlertSeverity;
import com.tradingcore.domain.enums.RiskRuleType;
import com.tradingcore.domain.enums.RiskStatus;
import com.tradingcore.domain.model.PortfolioSnapshot;
import com.tradingcore.domain.model.Position;
import com.tradingcore.event.EventPublisherHelper;
import com.tradingcore.event.RiskEventType;
import com.tradingcore.pnl.PortfolioValuationService;
import com.tradingcore.pnl.PositionLedger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic portfolio-level risk checks: drawdown from the high-water mark, loss since the start
 * of the day and per-position stop-loss levels.
 *
 * <p>A breach records a failure on the rule's portfolio circuit breaker on every check while it
 * lasts, so a sustained breach blocks new orders even with the emergency stop disabled. With
 * {@code emergencyStopEnabled}, the first check of a breach episode triggers the emergency halt;
 * the episode ends when a check finds no breach.
 *
 * <p>Breach events are published once per episode and rule, not on every check.
 */
@Service
public class PortfolioLimitMonitor {

    private static final Logger log = LoggerFactory.getLogger(PortfolioLimitMonitor.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal WARNING_RATIO = new BigDecimal("0.7");

    private final RiskLimitsStore riskLimitsStore;
    private final RuleCircuitBreakers circuitBreakers;
    private final PortfolioValuationService portfolioValuationService;
    private final PositionLedger positionLedger;
    private final EmergencyHaltService emergencyHaltService;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicReference<BigDecimal> peakValue = new AtomicReference<>();
    private final AtomicBoolean breachEpisode = new AtomicBoolean(false);
    private final Set<RiskRuleType> activeBreaches = EnumSet.noneOf(RiskRuleType.class);
    private final Set<String> stopLossSymbols = new HashSet<>();

    public PortfolioLimitMonitor(
            RiskLimitsStore riskLimitsStore,
            RuleCircuitBreakers circuitBreakers,
            PortfolioValuationService portfolioValuationService,
            PositionLedger positionLedger,
            EmergencyHaltService emergencyHaltService,
            EventPublisherHelper eventPublisherHelper) {
        this.riskLimitsStore = riskLimitsStore;
        this.circuitBreakers = circuitBreakers;
        this.portfolioValuationService = portfolioValuationService;
        this.positionLedger = positionLedger;
        this.emergencyHaltService = emergencyHaltService;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // PORTFOLIO LIMITS
    // ========================

    @Scheduled(fixedDelayString = "${tradingcore.risk.portfolio-check-interval-ms:1000}")
    public synchronized PortfolioRiskReport checkPortfolioLimits() {
        RiskLimits limits = riskLimitsStore.get();
        PortfolioSnapshot snapshot = portfolioValuationService.snapshot();
        BigDecimal value = snapshot.getTotalValue();
        BigDecimal peak = peakValue.accumulateAndGet(value, (current, candidate) ->
                current == null || candidate.compareTo(current) > 0 ? candidate : current);

        BigDecimal drawdownPercent = drawdownPercent(peak, value);
        BigDecimal dailyLoss = snapshot.getDailyPnl().signum() < 0 ? snapshot.getDailyPnl().negate() : BigDecimal.ZERO;

        List<RiskRuleType> breaches = new ArrayList<>();
        boolean warning = false;

        if (limits.getMaxDrawdownPercent() != null) {
            if (drawdownPercent.compareTo(limits.getMaxDrawdownPercent()) > 0) {
                breaches.add(RiskRuleType.DRAWDOWN);
                onBreach(
                        RiskRuleType.DRAWDOWN,
                        RiskEventType.DRAWDOWN_BREACH,
                        "drawdown " + drawdownPercent + "% exceeds " + limits.getMaxDrawdownPercent() + "%",
                        Map.of("drawdownPercent", drawdownPercent, "limit", limits.getMaxDrawdownPercent()));
            } else {
                warning |= nearLimit(drawdownPercent, limits.getMaxDrawdownPercent());
            }
        }
        if (limits.getMaxDailyLoss() != null) {
            if (dailyLoss.compareTo(limits.getMaxDailyLoss()) > 0) {
                breaches.add(RiskRuleType.DAILY_LOSS);
                onBreach(
                        RiskRuleType.DAILY_LOSS,
                        RiskEventType.DAILY_LOSS_BREACH,
                        "daily loss " + dailyLoss + " exceeds " + limits.getMaxDailyLoss(),
                        Map.of("dailyLoss", dailyLoss, "limit", limits.getMaxDailyLoss()));
            } else {
                warning |= nearLimit(dailyLoss, limits.getMaxDailyLoss());
            }
        }
        activeBreaches.retainAll(breaches);

        boolean haltTriggered = false;
        if (breaches.isEmpty()) {
            if (breachEpisode.compareAndSet(true, false)) {
                log.info("Portfolio back within limits");
            }
        } else if (breachEpisode.compareAndSet(false, true)
                && limits.isEmergencyStopEnabled()
                && !emergencyHaltService.isActive()) {
            String reason = "portfolio limit breached: " + breaches + " (value " + value + ", peak " + peak + ")";
            haltTriggered = emergencyHaltService.activate(reason).isFirstActivation();
        }

        List<String> stopLossBreaches = monitorStopLosses();

        RiskStatus status;
        if (emergencyHaltService.isActive()) {
            status = RiskStatus.EMERGENCY_STOP;
        } else if (!breaches.isEmpty()) {
            status = RiskStatus.DANGER;
        } else if (warning || !stopLossBreaches.isEmpty()) {
            status = RiskStatus.WARNING;
        } else {
            status = RiskStatus.SAFE;
        }

        return PortfolioRiskReport.builder()
                .status(status)
                .totalValue(value)
                .peakValue(peak)
                .drawdownPercent(drawdownPercent)
                .dailyPnl(snapshot.getDailyPnl())
                .breaches(List.copyOf(breaches))
                .stopLossBreaches(stopLossBreaches)
                .haltTriggered(haltTriggered)
                .asOf(snapshot.getAsOf())
                .build();
    }

    private void onBreach(RiskRuleType ruleType, RiskEventType eventType, String message, Map<String, Object> details) {
        circuitBreakers.recordFailure(RiskRuleKey.portfolio(ruleType));
        if (activeBreaches.add(ruleType)) {
            log.error("Portfolio limit breached: {}", message);
            eventPublisherHelper.publishRiskEvent(this, eventType, AlertSeverity.CRITICAL, message, details);
        }
    }

    static BigDecimal drawdownPercent(BigDecimal peak, BigDecimal value) {
        if (peak == null || peak.signum() <= 0 || value.compareTo(peak) >= 0) {
            return BigDecimal.ZERO;
        }
        return peak.subtract(value).multiply(HUNDRED).divide(peak, 4, RoundingMode.HALF_UP);
    }

    private static boolean nearLimit(BigDecimal metric, BigDecimal limit) {
        return limit.signum() > 0 && metric.compareTo(limit.multiply(WARNING_RATIO)) >= 0;
    }

    // ========================
    // POSITION STOP-LOSS
    // ========================

    /**
     * Raises a STOP_LOSS_BREACH warning for each position whose unrealized loss reaches
     * {@code stopLossPercent}. Alerts once per breach; a position must recover above the level
     * before it can alert again.
     *
     * @return symbols currently beyond their stop-loss level
     */
    public synchronized List<String> monitorStopLosses() {
        BigDecimal stopLossPercent = riskLimitsStore.get().getStopLossPercent();
        if (stopLossPercent == null) {
            stopLossSymbols.clear();
            return List.of();
        }
        BigDecimal threshold = stopLossPercent.negate();

        List<String> breached = new ArrayList<>();
        for (Position position : positionLedger.getPositions()) {
            if (position.isFlat()) {
                continue;
            }
            BigDecimal pnlPercent = position.unrealizedPnlPercent();
            if (pnlPercent.compareTo(threshold) <= 0) {
                breached.add(position.getSymbol());
                if (stopLossSymbols.add(position.getSymbol())) {
                    String message = position.getSymbol() + " unrealized " + pnlPercent + "% reached stop-loss of -"
                            + stopLossPercent + "%";
                    log.warn("Stop-loss breach: {}", message);
                    eventPublisherHelper.publishRiskEvent(
                            this,
                            RiskEventType.STOP_LOSS_BREACH,
                            AlertSeverity.WARNING,
                            message,
                            Map.of(
                                    "symbol", position.getSymbol(),
                                    "quantity", position.getQuantity(),
                                    "unrealizedPnlPercent", pnlPercent));
                }
            }
        }
        stopLossSymbols.retainAll(breached);
        return List.copyOf(breached);
    }

    public BigDecimal getPeakValue() {
        return peakValue.get();
    }
}
