package com.tradingcore.event;

import com.tradingcore.domain.enums.AlertSeverity;
import com.tradingcore.domain.enums.OrderStatus;
import com.tradingcore.domain.model.Order;
import com.tradingcore.domain.model.OrderIntent;
import com.tradingcore.domain.model.Tick;
import com.tradingcore.risk.RiskDecision;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Delivery is synchronous unless the listener is {@code @Async}; callers must not hold
 * locks while publishing.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Tick ----

    public void publishTick(Object source, Tick tick) {
        applicationEventPublisher.publishEvent(new TickEvent(source, tick));
    }

    // ---- Order ----

    public void publishOrderEvent(Object source, Order order, OrderEventType type, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, type, previousStatus));
    }

    public void publishReconciliationWarning(Object source, Order order, String detail) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.RECONCILIATION_WARNING, order.getStatus(), detail));
    }

    public void publish(OrderEvent event) {
        applicationEventPublisher.publishEvent(event);
    }

    // ---- Risk ----

    public void publishRiskEvent(Object source, RiskEventType type, AlertSeverity severity, String message) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, type, severity, message));
    }

    public void publishRiskEvent(
            Object source, RiskEventType type, AlertSeverity severity, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, type, severity, message, details));
    }

    public void publishRiskDecision(Object source, OrderIntent intent, RiskDecision decision) {
        applicationEventPublisher.publishEvent(new RiskDecisionEvent(source, intent, decision));
    }
}
