package com.tradingcore.oms;

import com.tradingcore.broker.BrokerCallExecutor;
import com.tradingcore.broker.BrokerGateway;
import com.tradingcore.broker.BrokerOrderEvent;
import com.tradingcore.broker.BrokerOrderSnapshot;
import com.tradingcore.domain.model.Order;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Compares the local order book with the broker's working orders and repairs what can be
 * repaired without guessing.
 *
 * <p>Per sweep:
 * <ul>
 *   <li>Placements that timed out are matched to broker orders by client order id and get
 *       their broker id attached.</li>
 *   <li>Broker fills that never arrived as events are applied as fills.</li>
 *   <li>Unconfirmed placements the broker does not know are rejected.</li>
 *   <li>Orders terminal locally but still working at the broker get a new cancel.</li>
 *   <li>Anything else that disagrees is reported as a reconciliation warning, and the order
 *       keeps its best-known state.</li>
 * </ul>
 *
 * <p>Orders created after the broker was queried are skipped, since their placement may simply
 * not have reached the broker yet.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final OrderLifecycleManager orderLifecycleManager;
    private final BrokerGateway brokerGateway;
    private final BrokerCallExecutor brokerCallExecutor;
    private final Clock clock;

    public ReconciliationService(
            OrderLifecycleManager orderLifecycleManager,
            BrokerGateway brokerGateway,
            BrokerCallExecutor brokerCallExecutor,
            Clock clock) {
        this.orderLifecycleManager = orderLifecycleManager;
        this.brokerGateway = brokerGateway;
        this.brokerCallExecutor = brokerCallExecutor;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${tradingcore.oms.reconciliation-interval-ms:30000}",
            initialDelayString = "${tradingcore.oms.reconciliation-initial-delay-ms:10000}")
    public ReconciliationReport sweep() {
        Instant startedAt = clock.instant();
        ReconciliationReport report =
                ReconciliationReport.builder().startedAt(startedAt).build();

        List<BrokerOrderSnapshot> brokerOrders;
        try {
            brokerOrders = brokerCallExecutor
                    .query("queryOpenOrders", brokerGateway::queryOpenOrders)
                    .join();
        } catch (RuntimeException e) {
            Throwable cause = BrokerCallExecutor.unwrap(e);
            log.warn("Reconciliation skipped, broker query failed: {}", cause.toString());
            report.getWarnings().add("broker query failed: " + cause.getMessage());
            return report;
        }
        report.setBrokerQueried(true);
        report.setBrokerOpenOrders(brokerOrders.size());

        Map<String, BrokerOrderSnapshot> byBrokerId = new HashMap<>();
        Map<String, BrokerOrderSnapshot> byClientId = new HashMap<>();
        for (BrokerOrderSnapshot snapshot : brokerOrders) {
            if (snapshot.getBrokerOrderId() != null) {
                byBrokerId.put(snapshot.getBrokerOrderId(), snapshot);
            }
            if (snapshot.getClientOrderId() != null) {
                byClientId.put(snapshot.getClientOrderId(), snapshot);
            }
        }

        Set<String> flagged = orderLifecycleManager.getOrdersAwaitingReconciliation();
        Set<String> matchedBrokerIds = new HashSet<>();
        List<Order> openOrders = orderLifecycleManager.getOpenOrders();
        report.setLocalOpenOrders(openOrders.size());

        for (Order order : openOrders) {
            if (order.getCreatedAt() != null && order.getCreatedAt().isAfter(startedAt)) {
                continue;
            }
            BrokerOrderSnapshot snapshot = order.getBrokerOrderId() != null
                    ? byBrokerId.get(order.getBrokerOrderId())
                    : byClientId.get(order.getId());

            if (snapshot != null) {
                matchedBrokerIds.add(snapshot.getBrokerOrderId());
                reconcileMatched(order, snapshot, report);
            } else {
                reconcileMissing(order, flagged.contains(order.getId()), report);
            }
        }

        for (BrokerOrderSnapshot snapshot : brokerOrders) {
            if (!matchedBrokerIds.contains(snapshot.getBrokerOrderId())) {
                reconcileUnmatched(snapshot, report);
            }
        }

        if (report.getWarnings().isEmpty()) {
            log.debug(
                    "Reconciliation clean: {} local open, {} broker open",
                    report.getLocalOpenOrders(),
                    report.getBrokerOpenOrders());
        } else {
            log.warn(
                    "Reconciliation finished with {} warnings (attached={}, missedFills={}, rejected={}, cancelsResent={})",
                    report.getWarnings().size(),
                    report.getBrokerIdsAttached(),
                    report.getMissedFillsApplied(),
                    report.getPlacementsRejected(),
                    report.getCancelsResent());
        }
        return report;
    }

    private void reconcileMatched(Order order, BrokerOrderSnapshot snapshot, ReconciliationReport report) {
        if (order.getBrokerOrderId() == null) {
            orderLifecycleManager.onPlacementAcknowledged(order.getId(), snapshot.getBrokerOrderId());
            report.setBrokerIdsAttached(report.getBrokerIdsAttached() + 1);
        }

        int missed = snapshot.getFilledQuantity() - order.getFilledQuantity();
        if (missed > 0) {
            BigDecimal price = missedFillPrice(order, snapshot, missed);
            if (price == null) {
                warn(order, "broker reports " + missed + " more filled without a price", report);
                return;
            }
            orderLifecycleManager.onBrokerEvent(
                    order.getId(), BrokerOrderEvent.fill(snapshot.getBrokerOrderId(), missed, price));
            report.setMissedFillsApplied(report.getMissedFillsApplied() + 1);
            log.info("Applied missed fill of {} @ {} to order {}", missed, price, order.getId());
        } else if (missed < 0) {
            warn(
                    order,
                    "broker reports " + snapshot.getFilledQuantity() + " filled, local has "
                            + order.getFilledQuantity(),
                    report);
        }
    }

    /**
     * Price of the executions the order book has not seen, derived from the broker's cumulative
     * average. Falls back to the broker average when the local average is unknown.
     */
    static BigDecimal missedFillPrice(Order order, BrokerOrderSnapshot snapshot, int missed) {
        if (snapshot.getAveragePrice() == null) {
            return null;
        }
        if (order.getFilledQuantity() == 0 || order.getAverageFillPrice() == null) {
            return snapshot.getAveragePrice();
        }
        BigDecimal brokerTotal = snapshot.getAveragePrice().multiply(BigDecimal.valueOf(snapshot.getFilledQuantity()));
        BigDecimal localTotal = order.getAverageFillPrice().multiply(BigDecimal.valueOf(order.getFilledQuantity()));
        BigDecimal price = brokerTotal.subtract(localTotal).divide(BigDecimal.valueOf(missed), 6, RoundingMode.HALF_UP);
        return price.signum() > 0 ? price : snapshot.getAveragePrice();
    }

    private void reconcileMissing(Order order, boolean flagged, ReconciliationReport report) {
        if (order.getBrokerOrderId() != null) {
            warn(order, "open locally but not working at broker " + order.getBrokerOrderId(), report);
            return;
        }
        if (flagged) {
            orderLifecycleManager.onPlacementRejected(order.getId(), "placement not confirmed by broker");
            report.setPlacementsRejected(report.getPlacementsRejected() + 1);
            log.warn("Order {} rejected: placement timed out and the broker has no such order", order.getId());
        }
    }

    private void reconcileUnmatched(BrokerOrderSnapshot snapshot, ReconciliationReport report) {
        Optional<String> orderId = orderLifecycleManager.findOrderIdByBrokerOrderId(snapshot.getBrokerOrderId());
        if (orderId.isEmpty() && snapshot.getClientOrderId() != null
                && orderLifecycleManager.exists(snapshot.getClientOrderId())) {
            orderId = Optional.of(snapshot.getClientOrderId());
        }
        if (orderId.isEmpty()) {
            String detail = "broker order " + snapshot.getBrokerOrderId() + " on " + snapshot.getSymbol()
                    + " is unknown locally";
            log.warn("Reconciliation: {}", detail);
            report.getWarnings().add(detail);
            return;
        }

        Optional<Order> order = orderLifecycleManager.getOrder(orderId.get());
        if (order.isPresent() && order.get().isTerminal()) {
            orderLifecycleManager.resendBrokerCancel(order.get().getId());
            report.setCancelsResent(report.getCancelsResent() + 1);
            warn(
                    order.get(),
                    order.get().getStatus() + " locally but still working at broker, cancel re-sent",
                    report);
        }
    }

    private void warn(Order order, String detail, ReconciliationReport report) {
        report.getWarnings().add(order.getId() + ": " + detail);
        orderLifecycleManager.reportReconciliationWarning(order.getId(), detail);
    }
}
