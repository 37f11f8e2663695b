package com.tradingcore.broker;

import com.tradingcore.oms.OrderLifecycleManager;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Entry point for asynchronous broker order updates.
 *
 * <p>Resolves the broker order id to the internal order and hands the event to the lifecycle
 * manager. Events that arrive before the placement acknowledgment are resolved by the echoed
 * client order id. Broker adapters call {@link #handle} directly; the simulated broker publishes
 * events through the application context.
 */
@Component
public class BrokerEventHandler {

    private static final Logger log = LoggerFactory.getLogger(BrokerEventHandler.class);

    private final OrderLifecycleManager orderLifecycleManager;

    public BrokerEventHandler(OrderLifecycleManager orderLifecycleManager) {
        this.orderLifecycleManager = orderLifecycleManager;
    }

    @EventListener
    public void handle(BrokerOrderEvent event) {
        Optional<String> orderId = resolve(event);
        if (orderId.isEmpty()) {
            log.warn(
                    "Broker event {} for unknown order brokerOrderId={} clientOrderId={}",
                    event.getType(),
                    event.getBrokerOrderId(),
                    event.getClientOrderId());
            return;
        }
        orderLifecycleManager.onBrokerEvent(orderId.get(), event);
    }

    private Optional<String> resolve(BrokerOrderEvent event) {
        if (event.getBrokerOrderId() != null) {
            Optional<String> byBrokerId = orderLifecycleManager.findOrderIdByBrokerOrderId(event.getBrokerOrderId());
            if (byBrokerId.isPresent()) {
                return byBrokerId;
            }
        }
        if (event.getClientOrderId() != null && orderLifecycleManager.exists(event.getClientOrderId())) {
            return Optional.of(event.getClientOrderId());
        }
        return Optional.empty();
    }
}
