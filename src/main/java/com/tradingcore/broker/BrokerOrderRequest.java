package com.tradingcore.broker;

import com.tradingcore.domain.enums.OrderKind;
import com.tradingcore.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A single leg as sent to the broker. Composite orders are decomposed before they get here,
 * so {@code kind} is always MARKET, LIMIT or STOP. {@code clientOrderId} is the internal order
 * id and is echoed back on broker events.
 */
@Value
@Builder(toBuilder = true)
public class BrokerOrderRequest {

    String clientOrderId;
    String symbol;
    OrderSide side;
    OrderKind kind;
    int quantity;

    /** Limit price, or trigger price for STOP. Null for MARKET. */
    BigDecimal price;

    /** Last known price, used by simulated execution of MARKET orders. */
    BigDecimal referencePrice;
}
