package com.tradingcore.exception;

import com.tradingcore.domain.enums.OrderStatus;
import java.util.Map;

/**
 * An operation was attempted that the order's current state does not allow, such as
 * cancelling an order that is already filled.
 */
public class InvalidOrderStateException extends BaseException {

    public InvalidOrderStateException(String orderId, OrderStatus status, String operation) {
        super(
                ErrorCode.INVALID_ORDER_STATE,
                "Cannot " + operation + " order " + orderId + " in state " + status,
                Map.of("orderId", orderId, "status", status, "operation", operation));
    }
}
