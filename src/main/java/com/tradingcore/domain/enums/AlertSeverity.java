package com.tradingcore.domain.enums;

/**
 * Severity for operator alerts and risk events.
 * CRITICAL alerts are delivered regardless of any quiet-hours or throttling on the notifier side.
 */
public enum AlertSeverity {
    CRITICAL,
    WARNING,
    INFO
}
