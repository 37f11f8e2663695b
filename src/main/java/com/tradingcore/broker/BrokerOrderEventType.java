package com.tradingcore.broker;

public enum BrokerOrderEventType {
    /** An incremental execution; carries the quantity of this execution only. */
    FILL,
    CANCELLED,
    REJECTED
}
