package com.tradingcore.risk;

import com.tradingcore.broker.BrokerCallExecutor;
import com.tradingcore.broker.BrokerGateway;
import com.tradingcore.core.engine.TickDispatcher;
import com.tradingcore.domain.enums.AlertSeverity;
import com.tradingcore.domain.model.Order;
import com.tradingcore.event.EventPublisherHelper;
import com.tradingcore.event.RiskEventType;
import com.tradingcore.notification.NotificationService;
import com.tradingcore.observability.TradingMetrics;
import com.tradingcore.oms.OrderLifecycleManager;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Emergency halt: stop trading, pull every working order and flatten.
 *
 * <p><b>Execution order:</b>
 * <ol>
 *   <li>Halt the tick dispatcher and set the risk gate's emergency stop, so no new signal and
 *       no new order gets through</li>
 *   <li>Cancel every PENDING or PARTIAL order concurrently on the bounded halt pool</li>
 *   <li>Ask the broker to liquidate all positions</li>
 *   <li>Send a CRITICAL alert with the reason</li>
 * </ol>
 *
 * <p>Only the call that actually sets the dispatcher's halt flag performs steps 1 to 3.
 * Concurrent and repeated calls only alert. Every step is attempted even if an earlier one
 * fails; failures are logged and collected in {@link HaltResult#getErrors()}.
 *
 * <p>{@link #reset()} is the operator action that clears both flags.
 */
@Service
public class EmergencyHaltService {

    private static final Logger log = LoggerFactory.getLogger(EmergencyHaltService.class);

    private final TickDispatcher tickDispatcher;
    private final RiskGate riskGate;
    private final OrderLifecycleManager orderLifecycleManager;
    private final BrokerGateway brokerGateway;
    private final BrokerCallExecutor brokerCallExecutor;
    private final NotificationService notificationService;
    private final Executor haltExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final TradingMetrics tradingMetrics;
    private final Clock clock;
    private final long timeoutSeconds;

    public EmergencyHaltService(
            TickDispatcher tickDispatcher,
            RiskGate riskGate,
            OrderLifecycleManager orderLifecycleManager,
            BrokerGateway brokerGateway,
            BrokerCallExecutor brokerCallExecutor,
            NotificationService notificationService,
            @Qualifier("haltExecutor") Executor haltExecutor,
            EventPublisherHelper eventPublisherHelper,
            TradingMetrics tradingMetrics,
            Clock clock,
            @Value("${tradingcore.halt.timeout-seconds:30}") long timeoutSeconds) {
        this.tickDispatcher = tickDispatcher;
        this.riskGate = riskGate;
        this.orderLifecycleManager = orderLifecycleManager;
        this.brokerGateway = brokerGateway;
        this.brokerCallExecutor = brokerCallExecutor;
        this.notificationService = notificationService;
        this.haltExecutor = haltExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.tradingMetrics = tradingMetrics;
        this.clock = clock;
        this.timeoutSeconds = timeoutSeconds;
    }

    // ========================
    // ACTIVATION
    // ========================

    /**
     * Halts trading. Safe to call from any thread, any number of times.
     *
     * @param reason human-readable cause, included in the alert
     */
    public HaltResult activate(String reason) {
        Instant activatedAt = clock.instant();
        boolean first = tickDispatcher.halt();

        HaltResult.HaltResultBuilder result =
                HaltResult.builder().firstActivation(first).reason(reason).activatedAt(activatedAt);

        if (!first) {
            log.warn("Emergency halt already active, alerting only: {}", reason);
            notificationService.notify("EMERGENCY HALT (already active): " + reason, AlertSeverity.CRITICAL);
            return result.build();
        }

        log.error("EMERGENCY HALT ACTIVATED: {}", reason);
        List<String> errors = new ArrayList<>();

        riskGate.activateEmergencyStop();
        tradingMetrics.recordHalt();
        eventPublisherHelper.publishRiskEvent(
                this, RiskEventType.EMERGENCY_HALT, AlertSeverity.CRITICAL, reason, Map.of("activatedAt", activatedAt));

        AtomicInteger cancelled = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        cancelOpenOrders(cancelled, failed, errors);

        boolean liquidationRequested = liquidate(errors);

        notificationService.notify("EMERGENCY HALT: " + reason, AlertSeverity.CRITICAL);

        if (errors.isEmpty()) {
            log.error(
                    "Emergency halt complete: {} orders cancelled, liquidation requested={}",
                    cancelled.get(),
                    liquidationRequested);
        } else {
            log.error("Emergency halt completed with {} errors: {}", errors.size(), errors);
        }

        return result.ordersCancelled(cancelled.get())
                .cancelsFailed(failed.get())
                .liquidationRequested(liquidationRequested)
                .errors(errors)
                .build();
    }

    /** Operator reset: resumes tick dispatch and order acceptance. */
    public void reset() {
        tickDispatcher.resetHalt();
        riskGate.resetEmergencyStop();
        eventPublisherHelper.publishRiskEvent(this, RiskEventType.HALT_RESET, AlertSeverity.WARNING, "halt reset");
        log.warn("Emergency halt reset by operator");
    }

    public boolean isActive() {
        return tickDispatcher.isHalted();
    }

    // ========================
    // STEPS
    // ========================

    private void cancelOpenOrders(AtomicInteger cancelled, AtomicInteger failed, List<String> errors) {
        List<Order> openOrders = orderLifecycleManager.getOpenOrders();
        if (openOrders.isEmpty()) {
            return;
        }

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (Order order : openOrders) {
            CompletableFuture<Void> future = CompletableFuture.supplyAsync(
                            () -> orderLifecycleManager.cancelForHalt(order.getId()), haltExecutor)
                    .thenCompose(cancel -> cancel)
                    .handle((confirmed, error) -> {
                        if (error != null) {
                            failed.incrementAndGet();
                            String message = "Failed to cancel order " + order.getId() + ": "
                                    + BrokerCallExecutor.unwrap(error).getMessage();
                            log.error(message);
                            synchronized (errors) {
                                errors.add(message);
                            }
                        } else if (Boolean.TRUE.equals(confirmed)) {
                            cancelled.incrementAndGet();
                        } else {
                            log.warn("Order {} not confirmed cancelled by broker during halt", order.getId());
                        }
                        return null;
                    });
            futures.add(future);
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.error("Timed out after {}s waiting for halt cancellations", timeoutSeconds);
            synchronized (errors) {
                errors.add("Timeout waiting for order cancellations after " + timeoutSeconds + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            synchronized (errors) {
                errors.add("Interrupted waiting for order cancellations");
            }
        } catch (Exception e) {
            log.error("Waiting for halt cancellations failed", e);
            synchronized (errors) {
                errors.add("Waiting for order cancellations failed: " + e.getMessage());
            }
        }
    }

    private boolean liquidate(List<String> errors) {
        try {
            boolean accepted = brokerCallExecutor
                    .submit("liquidateAll", brokerGateway::liquidateAll)
                    .join();
            if (!accepted) {
                synchronized (errors) {
                    errors.add("Broker did not accept liquidation");
                }
            }
            return accepted;
        } catch (RuntimeException e) {
            Throwable cause = BrokerCallExecutor.unwrap(e);
            log.error("Liquidation request failed: {}", cause.toString());
            synchronized (errors) {
                errors.add("Liquidation failed: " + cause.getMessage());
            }
            return false;
        }
    }
}
