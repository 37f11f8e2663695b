package com.tradingcore.risk;

import com.tradingcore.domain.enums.AlertSeverity;
import com.tradingcore.event.EventPublisherHelper;
import com.tradingcore.event.RiskEventType;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the active {@link RiskLimits}. Replacement is atomic; a validation already in flight
 * keeps the snapshot it read and the new limits apply from the next one.
 */
@Component
public class RiskLimitsStore {

    private static final Logger log = LoggerFactory.getLogger(RiskLimitsStore.class);

    private final AtomicReference<RiskLimits> current;
    private final EventPublisherHelper eventPublisherHelper;

    public RiskLimitsStore(RiskLimits riskLimits, EventPublisherHelper eventPublisherHelper) {
        this.current = new AtomicReference<>(Objects.requireNonNull(riskLimits, "riskLimits"));
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public RiskLimits get() {
        return current.get();
    }

    public void update(RiskLimits limits) {
        RiskLimits previous = current.getAndSet(Objects.requireNonNull(limits, "limits"));
        log.info("Risk limits updated: {} -> {}", previous, limits);
        eventPublisherHelper.publishRiskEvent(
                this, RiskEventType.LIMITS_UPDATED, AlertSeverity.INFO, "Risk limits updated");
    }
}
