package com.tradingcore.broker;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Broker's view of a working order, as returned by {@link BrokerGateway#queryOpenOrders()}.
 */
@Value
@Builder
public class BrokerOrderSnapshot {

    String brokerOrderId;
    String clientOrderId;
    String symbol;
    int quantity;

    /** Cumulative filled quantity. */
    int filledQuantity;

    BigDecimal averagePrice;
}
