package com.tradingcore.event;

public enum OrderEventType {
    PLACED,
    ACKNOWLEDGED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    /** Quantity of an open protective leg changed to match the position it covers. */
    AMENDED,
    /** Composite status of an entry changed (protected, resolved, abandoned). */
    COMPOSITE_UPDATED,
    /** Local and broker state disagree; the order keeps its best-known state. */
    RECONCILIATION_WARNING
}
