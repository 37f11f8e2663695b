package com.tradingcore.broker;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Asynchronous order update from the broker.
 *
 * <p>{@code brokerOrderId} is the primary key. {@code clientOrderId} is set when the broker
 * echoes it and resolves events that arrive before the placement acknowledgment.
 */
@Value
@Builder
public class BrokerOrderEvent {

    String brokerOrderId;
    String clientOrderId;
    BrokerOrderEventType type;

    /** Quantity of this execution, for FILL. */
    int fillQuantity;

    BigDecimal fillPrice;
    String reason;
    Instant timestamp;

    public static BrokerOrderEvent fill(String brokerOrderId, int quantity, BigDecimal price) {
        return BrokerOrderEvent.builder()
                .brokerOrderId(brokerOrderId)
                .type(BrokerOrderEventType.FILL)
                .fillQuantity(quantity)
                .fillPrice(price)
                .timestamp(Instant.now())
                .build();
    }

    public static BrokerOrderEvent cancelled(String brokerOrderId, String reason) {
        return BrokerOrderEvent.builder()
                .brokerOrderId(brokerOrderId)
                .type(BrokerOrderEventType.CANCELLED)
                .reason(reason)
                .timestamp(Instant.now())
                .build();
    }

    public static BrokerOrderEvent rejected(String brokerOrderId, String reason) {
        return BrokerOrderEvent.builder()
                .brokerOrderId(brokerOrderId)
                .type(BrokerOrderEventType.REJECTED)
                .reason(reason)
                .timestamp(Instant.now())
                .build();
    }
}
