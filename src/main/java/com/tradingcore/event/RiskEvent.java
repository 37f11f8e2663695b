package com.tradingcore.event;

import com.tradingcore.domain.enums.AlertSeverity;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the risk layer detects a condition worth surfacing: a breaker opening,
 * a portfolio limit breach, a stop-loss breach or an emergency halt.
 *
 * <p>NotificationService forwards WARNING and CRITICAL events to the alert notifier.
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final AlertSeverity severity;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, AlertSeverity severity, String message) {
        this(source, eventType, severity, message, null);
    }

    public RiskEvent(
            Object source,
            RiskEventType eventType,
            AlertSeverity severity,
            String message,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.severity = severity;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific values, for example {"drawdownPercent": 12.5, "limit": 10} for
     * DRAWDOWN_BREACH.
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
