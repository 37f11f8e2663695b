package com.tradingcore.notification;

import com.tradingcore.domain.enums.AlertSeverity;

/**
 * Delivery channel for operator alerts (chat, pager, e-mail).
 * Implementations may block; {@link NotificationService} always calls them off the trading path.
 */
public interface AlertNotifier {

    void notify(String message, AlertSeverity severity);
}
