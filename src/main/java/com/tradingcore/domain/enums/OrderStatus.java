package com.tradingcore.domain.enums;

/**
 * Order lifecycle states.
 *
 * <p>Legal transitions: PENDING to any other state, PARTIAL to PARTIAL, FILLED or CANCELLED.
 * FILLED, CANCELLED and REJECTED are terminal.
 */
public enum OrderStatus {
    PENDING,
    PARTIAL,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    public boolean canTransitionTo(OrderStatus target) {
        return switch (this) {
            case PENDING -> target != PENDING;
            case PARTIAL -> target == PARTIAL || target == FILLED || target == CANCELLED;
            default -> false;
        };
    }
}
