package com.tradingcore.domain.model;

import com.tradingcore.domain.enums.OrderKind;
import com.tradingcore.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A signal translated into an order request, ready for risk validation.
 *
 * <p>{@code referencePrice} is what order and position values are computed from: the
 * signal's limit price if it has one, otherwise the symbol's last traded price.
 */
@Value
@Builder(toBuilder = true)
public class OrderIntent {

    String strategyId;
    String signalId;
    String symbol;
    OrderSide side;
    OrderKind kind;
    int quantity;
    BigDecimal price;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    BigDecimal referencePrice;

    /** quantity x referencePrice, or null when no reference price is known. */
    public BigDecimal notional() {
        return referencePrice != null ? referencePrice.multiply(BigDecimal.valueOf(quantity)) : null;
    }
}
