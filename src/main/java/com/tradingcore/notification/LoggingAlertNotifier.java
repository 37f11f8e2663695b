package com.tradingcore.notification;

import com.tradingcore.domain.enums.AlertSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback notifier that writes alerts to the application log. Used when no delivery
 * channel is configured.
 */
public class LoggingAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertNotifier.class);

    @Override
    public void notify(String message, AlertSeverity severity) {
        switch (severity) {
            case CRITICAL -> log.error("[ALERT] {}", message);
            case WARNING -> log.warn("[ALERT] {}", message);
            case INFO -> log.info("[ALERT] {}", message);
        }
    }
}
