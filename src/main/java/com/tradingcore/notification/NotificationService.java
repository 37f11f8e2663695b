package com.tradingcore.notification;

import com.tradingcore.domain.enums.AlertSeverity;
import com.tradingcore.domain.model.Order;
import com.tradingcore.event.OrderEvent;
import com.tradingcore.event.OrderEventType;
import com.tradingcore.event.RiskEvent;
import com.tradingcore.event.RiskEventType;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget alert delivery.
 *
 * <p>Alerts are handed to the {@link AlertNotifier} on the event executor so a slow or failing
 * channel never delays order handling. Delivery failures are logged and dropped.
 *
 * <p>Besides direct {@link #notify} calls, forwards WARNING and CRITICAL risk events and order
 * reconciliation warnings. Emergency halt alerts are sent by the halt service itself, so the
 * matching risk event is not forwarded again.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final AlertNotifier alertNotifier;
    private final Executor eventExecutor;

    public NotificationService(AlertNotifier alertNotifier, @Qualifier("eventExecutor") Executor eventExecutor) {
        this.alertNotifier = alertNotifier;
        this.eventExecutor = eventExecutor;
    }

    public void notify(String message, AlertSeverity severity) {
        eventExecutor.execute(() -> {
            try {
                alertNotifier.notify(message, severity);
            } catch (Exception e) {
                log.error("Failed to deliver {} alert '{}': {}", severity, message, e.getMessage());
            }
        });
    }

    @EventListener
    public void onRiskEvent(RiskEvent event) {
        if (event.getSeverity() == AlertSeverity.INFO || event.getEventType() == RiskEventType.EMERGENCY_HALT) {
            return;
        }
        notify(event.getEventType() + ": " + event.getMessage(), event.getSeverity());
    }

    @EventListener
    public void onOrderEvent(OrderEvent event) {
        if (event.getEventType() != OrderEventType.RECONCILIATION_WARNING) {
            return;
        }
        Order order = event.getOrder();
        notify(
                String.format(
                        "Reconciliation warning for order %s (%s %s %s): %s",
                        order.getId(),
                        order.getSide(),
                        order.getSymbol(),
                        order.getRole(),
                        event.getDetail()),
                AlertSeverity.WARNING);
    }
}
