package com.tradingcore.risk;

import com.tradingcore.core.engine.StrategyStats;
import com.tradingcore.core.engine.TickDispatcher;
import com.tradingcore.domain.enums.AlertSeverity;
import com.tradingcore.event.EventPublisherHelper;
import com.tradingcore.event.RiskEventType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Halts trading when a strategy stops responding.
 *
 * <p>A strategy whose last heartbeat is older than {@code staleAfter} is stuck: its lane has not
 * completed a tick or poll in that time, while polls reach every running strategy each second.
 * Paused strategies are skipped, and nothing is checked while the halt is already active.
 */
@Service
public class StrategyHeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(StrategyHeartbeatMonitor.class);

    private final TickDispatcher tickDispatcher;
    private final EmergencyHaltService emergencyHaltService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final Duration staleAfter;

    public StrategyHeartbeatMonitor(
            TickDispatcher tickDispatcher,
            EmergencyHaltService emergencyHaltService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock,
            @Value("${tradingcore.risk.heartbeat.stale-after:300s}") Duration staleAfter) {
        this.tickDispatcher = tickDispatcher;
        this.emergencyHaltService = emergencyHaltService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    /**
     * Returns the ids of the stale strategies found; a non-empty result has activated the halt.
     */
    @Scheduled(fixedDelayString = "${tradingcore.risk.heartbeat.check-interval-ms:60000}")
    public List<String> checkHeartbeats() {
        if (emergencyHaltService.isActive()) {
            return List.of();
        }
        Instant cutoff = clock.instant().minus(staleAfter);
        List<String> stale = tickDispatcher.getStrategyStats().stream()
                .filter(stats -> !stats.isPaused())
                .filter(stats -> stats.getLastHeartbeatAt().isBefore(cutoff))
                .map(StrategyStats::getStrategyId)
                .toList();
        if (stale.isEmpty()) {
            log.debug("All strategy heartbeats within {}", staleAfter);
            return stale;
        }

        String reason = "stale heartbeat from strategies " + stale + " (no activity for " + staleAfter + ")";
        log.warn("Stale strategy heartbeats: {}", stale);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.STALE_HEARTBEAT,
                AlertSeverity.CRITICAL,
                reason,
                Map.of("strategies", stale, "staleAfter", staleAfter.toString()));
        emergencyHaltService.activate(reason);
        return stale;
    }
}
