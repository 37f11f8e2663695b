package com.tradingcore.oms;

import com.tradingcore.domain.model.Order;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of routing one signal. A signal is either turned into an order (accepted), refused by
 * the risk gate (rejected), or dropped before validation (skipped: HOLD, duplicate, cooldown).
 */
@Getter
@ToString
public class OrderRouteResult {

    public enum Outcome {
        ACCEPTED,
        REJECTED,
        SKIPPED
    }

    private final Outcome outcome;
    private final Order order;
    private final String reason;

    private OrderRouteResult(Outcome outcome, Order order, String reason) {
        this.outcome = outcome;
        this.order = order;
        this.reason = reason;
    }

    public static OrderRouteResult accepted(Order order) {
        return new OrderRouteResult(Outcome.ACCEPTED, order, null);
    }

    public static OrderRouteResult rejected(String reason) {
        return new OrderRouteResult(Outcome.REJECTED, null, reason);
    }

    public static OrderRouteResult skipped(String reason) {
        return new OrderRouteResult(Outcome.SKIPPED, null, reason);
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
