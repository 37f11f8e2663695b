package com.tradingcore.unit.notification;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.tradingcore.domain.enums.AlertSeverity;
import com.tradingcore.domain.enums.OrderSide;
import com.tradingcore.domain.model.Order;
import com.tradingcore.event.OrderEvent;
import com.tradingcore.event.OrderEventType;
import com.tradingcore.event.RiskEvent;
import com.tradingcore.event.RiskEventType;
import com.tradingcore.notification.AlertNotifier;
import com.tradingcore.notification.NotificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private AlertNotifier alertNotifier;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(alertNotifier, Runnable::run);
    }

    @Test
    @DisplayName("Warning risk events are forwarded with their type")
    void forwardsRiskWarnings() {
        notificationService.onRiskEvent(
                new RiskEvent(this, RiskEventType.DRAWDOWN_BREACH, AlertSeverity.CRITICAL, "drawdown 12%"));

        verify(alertNotifier).notify("DRAWDOWN_BREACH: drawdown 12%", AlertSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Info events and halt events are not forwarded")
    void skipsInfoAndHalt() {
        notificationService.onRiskEvent(
                new RiskEvent(this, RiskEventType.LIMITS_UPDATED, AlertSeverity.INFO, "limits updated"));
        notificationService.onRiskEvent(
                new RiskEvent(this, RiskEventType.EMERGENCY_HALT, AlertSeverity.CRITICAL, "halt"));

        verify(alertNotifier, never()).notify(anyString(), any());
    }

    @Test
    @DisplayName("Reconciliation warnings become WARNING alerts")
    void forwardsReconciliationWarnings() {
        Order order = Order.builder().id("o-1").side(OrderSide.SELL).symbol("AAPL").build();

        notificationService.onOrderEvent(new OrderEvent(
                this, order, OrderEventType.RECONCILIATION_WARNING, null, "fill after cancel"));
        notificationService.onOrderEvent(new OrderEvent(this, order, OrderEventType.FILLED));

        verify(alertNotifier)
                .notify(
                        "Reconciliation warning for order o-1 (SELL AAPL STANDALONE): fill after cancel",
                        AlertSeverity.WARNING);
    }

    @Test
    @DisplayName("A failing channel does not reach the caller")
    void deliveryFailureContained() {
        doThrow(new IllegalStateException("channel down")).when(alertNotifier).notify(anyString(), any());

        assertThatCode(() -> notificationService.notify("test", AlertSeverity.WARNING))
                .doesNotThrowAnyException();
    }
}
