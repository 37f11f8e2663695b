package com.tradingcore.domain.enums;

/**
 * PAPER routes orders to the in-memory simulated broker; LIVE expects a real
 * {@code BrokerGateway} bean to be supplied by a broker adapter module.
 */
public enum TradingMode {
    PAPER,
    LIVE
}
