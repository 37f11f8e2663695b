package com.tradingcore.event;

import com.tradingcore.domain.enums.OrderStatus;
import com.tradingcore.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the lifecycle manager after every order mutation.
 *
 * <p>The carried order is a snapshot taken while the manager held its lock, so listeners may
 * read it freely. Events are published after the lock is released.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>TickDispatcher: routes fills and rejections back to the owning strategy</li>
 *   <li>OrderEventJournalWriter: appends to the event journal</li>
 *   <li>TradingMetrics: counts fills and rejections</li>
 * </ul>
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;
    private final String detail;

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus, String detail) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
        this.detail = detail;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        this(source, order, eventType, previousStatus, null);
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType) {
        this(source, order, eventType, null, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** Status before this change, null for PLACED. */
    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }

    /** Free-text detail, set for reconciliation warnings. */
    public String getDetail() {
        return detail;
    }
}
