package com.tradingcore.oms;

import com.tradingcore.broker.BrokerCallExecutor;
import com.tradingcore.broker.BrokerGateway;
import com.tradingcore.broker.BrokerOrderEvent;
import com.tradingcore.broker.BrokerOrderRequest;
import com.tradingcore.domain.enums.CompositeStatus;
import com.tradingcore.domain.enums.OrderKind;
import com.tradingcore.domain.enums.OrderRole;
import com.tradingcore.domain.enums.OrderSide;
import com.tradingcore.domain.enums.OrderStatus;
import com.tradingcore.domain.model.Order;
import com.tradingcore.domain.model.OrderIntent;
import com.tradingcore.event.EventPublisherHelper;
import com.tradingcore.event.OrderEvent;
import com.tradingcore.event.OrderEventType;
import com.tradingcore.exception.BrokerException;
import com.tradingcore.exception.InvalidOrderStateException;
import com.tradingcore.exception.ResourceNotFoundException;
import com.tradingcore.pnl.PositionLedger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Owns every order from placement to terminal state, including composite BRACKET and COVER
 * orders and the one-cancels-other link between their protective legs.
 *
 * <p><b>State machine:</b> PENDING to FILLED, PARTIAL, CANCELLED or REJECTED; PARTIAL to FILLED
 * or CANCELLED. Terminal orders never change again; a broker event that would change one is
 * reported as a reconciliation warning.
 *
 * <p><b>Composites:</b>
 * <ul>
 *   <li>BRACKET: the entry works alone. When it fills, the take-profit (LIMIT) and stop-loss
 *       (STOP) children are created in the same locked step, so no observer ever sees one
 *       without the other.</li>
 *   <li>COVER: the entry and its STOP child are created together. A missing or wrong-side stop
 *       rejects the entry; a broker refusal of the stop cancels the entry.</li>
 *   <li>The first protective leg to fill wins: its sibling is cancelled locally at once and a
 *       broker cancel follows. A sibling fill that still arrives is a reconciliation warning.</li>
 *   <li>Protective legs always cover the open position. A partial fill of one leg resizes its
 *       sibling to the leg's remaining quantity, and a COVER entry cancelled after a partial
 *       fill has its stop resized to the filled quantity. Resizes are amended in place at the
 *       broker, so a composite never owns more legs than it was created with.</li>
 * </ul>
 *
 * <p><b>Concurrency:</b> all state changes happen under a single lock. Broker calls and event
 * publication happen after the lock is released: each operation collects its side effects in a
 * {@link Mutation} and {@link #flush flushes} them once unlocked. Broker calls are asynchronous
 * and time-limited; a timed-out placement stays PENDING and is flagged for reconciliation.
 */
@Service
public class OrderLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleManager.class);

    private static final int PRICE_SCALE = 6;

    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final Map<String, String> brokerOrderIndex = new ConcurrentHashMap<>();
    private final Set<String> awaitingReconciliation = ConcurrentHashMap.newKeySet();
    private final Map<String, Integer> sentQuantities = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final BrokerGateway brokerGateway;
    private final BrokerCallExecutor brokerCallExecutor;
    private final PositionLedger positionLedger;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final boolean strictInvariants;

    public OrderLifecycleManager(
            BrokerGateway brokerGateway,
            BrokerCallExecutor brokerCallExecutor,
            PositionLedger positionLedger,
            EventPublisherHelper eventPublisherHelper,
            Clock clock,
            @Value("${tradingcore.oms.strict-invariants:true}") boolean strictInvariants) {
        this.brokerGateway = brokerGateway;
        this.brokerCallExecutor = brokerCallExecutor;
        this.positionLedger = positionLedger;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.strictInvariants = strictInvariants;
    }

    // ========================
    // PLACEMENT
    // ========================

    /**
     * Creates the order(s) for an approved intent and sends them to the broker.
     *
     * <p>Returns as soon as the orders are recorded; the broker acknowledgment or refusal is
     * applied asynchronously. A composite whose protective prices are invalid is returned
     * REJECTED without reaching the broker.
     */
    public Order place(OrderIntent intent) {
        Objects.requireNonNull(intent, "intent");
        Mutation mutation = new Mutation();
        String entryId;

        lock.lock();
        try {
            Order entry = newOrder(intent);
            entryId = entry.getId();
            orders.put(entryId, entry);

            switch (intent.getKind()) {
                case MARKET, LIMIT, STOP -> {
                    mutation.event(entry, OrderEventType.PLACED, null);
                    mutation.placements.add(entryId);
                }
                case BRACKET -> {
                    entry.setRole(OrderRole.ENTRY);
                    String invalid = validateBracket(intent);
                    if (invalid != null) {
                        rejectOnCreation(entry, invalid, mutation);
                    } else {
                        entry.setCompositeStatus(CompositeStatus.AWAITING_ENTRY);
                        mutation.event(entry, OrderEventType.PLACED, null);
                        mutation.placements.add(entryId);
                    }
                }
                case COVER -> {
                    entry.setRole(OrderRole.ENTRY);
                    String invalid = validateCover(intent);
                    if (invalid != null) {
                        rejectOnCreation(entry, invalid, mutation);
                    } else {
                        Order stop = newChild(
                                entry, OrderRole.STOP_LOSS, OrderKind.STOP, intent.getStopLoss(), entry.getQuantity());
                        entry.getChildOrderIds().add(stop.getId());
                        entry.setCompositeStatus(CompositeStatus.PROTECTED);
                        orders.put(stop.getId(), stop);
                        mutation.event(entry, OrderEventType.PLACED, null);
                        mutation.event(stop, OrderEventType.PLACED, null);
                        mutation.placements.add(entryId);
                        mutation.placements.add(stop.getId());
                    }
                }
            }
            mutation.seal();
        } finally {
            lock.unlock();
        }

        flush(mutation);
        return getOrder(entryId).orElseThrow(() -> new ResourceNotFoundException("Order", entryId));
    }

    private Order newOrder(OrderIntent intent) {
        return Order.builder()
                .id(UUID.randomUUID().toString())
                .strategyId(intent.getStrategyId())
                .signalId(intent.getSignalId())
                .symbol(intent.getSymbol())
                .side(intent.getSide())
                .kind(intent.getKind())
                .quantity(intent.getQuantity())
                .remainingQuantity(intent.getQuantity())
                .price(intent.getPrice())
                .referencePrice(intent.getReferencePrice())
                .stopLoss(intent.getStopLoss())
                .takeProfit(intent.getTakeProfit())
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
    }

    private Order newChild(Order parent, OrderRole role, OrderKind kind, BigDecimal price, int quantity) {
        return Order.builder()
                .id(UUID.randomUUID().toString())
                .strategyId(parent.getStrategyId())
                .signalId(parent.getSignalId())
                .symbol(parent.getSymbol())
                .side(parent.getSide().opposite())
                .kind(kind)
                .role(role)
                .quantity(quantity)
                .remainingQuantity(quantity)
                .price(price)
                .referencePrice(price)
                .parentOrderId(parent.getId())
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
    }

    private String validateBracket(OrderIntent intent) {
        if (intent.getStopLoss() == null || intent.getTakeProfit() == null) {
            return "bracket order requires both stop-loss and take-profit";
        }
        String stopProblem = checkStopSide(intent);
        if (stopProblem != null) {
            return stopProblem;
        }
        BigDecimal entryPrice = entryPrice(intent);
        if (entryPrice != null) {
            boolean valid = intent.getSide() == OrderSide.BUY
                    ? intent.getTakeProfit().compareTo(entryPrice) > 0
                    : intent.getTakeProfit().compareTo(entryPrice) < 0;
            if (!valid) {
                return "take-profit " + intent.getTakeProfit().toPlainString() + " is on the wrong side of entry "
                        + entryPrice.toPlainString() + " for a " + intent.getSide() + " bracket";
            }
        }
        return null;
    }

    private String validateCover(OrderIntent intent) {
        if (intent.getStopLoss() == null) {
            return "cover order requires a stop-loss";
        }
        return checkStopSide(intent);
    }

    private String checkStopSide(OrderIntent intent) {
        if (intent.getStopLoss().signum() <= 0) {
            return "stop-loss must be positive";
        }
        BigDecimal entryPrice = entryPrice(intent);
        if (entryPrice == null) {
            return null;
        }
        boolean valid = intent.getSide() == OrderSide.BUY
                ? intent.getStopLoss().compareTo(entryPrice) < 0
                : intent.getStopLoss().compareTo(entryPrice) > 0;
        return valid
                ? null
                : "stop-loss " + intent.getStopLoss().toPlainString() + " is on the wrong side of entry "
                        + entryPrice.toPlainString() + " for a " + intent.getSide() + " order";
    }

    private BigDecimal entryPrice(OrderIntent intent) {
        return intent.getPrice() != null ? intent.getPrice() : intent.getReferencePrice();
    }

    private void rejectOnCreation(Order entry, String reason, Mutation mutation) {
        log.warn("Order {} rejected on creation: {}", entry.getId(), reason);
        entry.setStatus(OrderStatus.REJECTED);
        entry.setRemainingQuantity(0);
        entry.setRejectionReason(reason);
        entry.setCompositeStatus(CompositeStatus.ABANDONED);
        mutation.event(entry, OrderEventType.REJECTED, OrderStatus.PENDING);
    }

    // ========================
    // BROKER PLACEMENT RESULTS
    // ========================

    void onPlacementAcknowledged(String orderId, String brokerOrderId) {
        Mutation mutation = new Mutation();
        lock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null) {
                return;
            }
            boolean alreadyKnown = order.getBrokerOrderId() != null;
            attachBrokerOrderId(order, brokerOrderId);
            touch(order);
            mutation.event(order, OrderEventType.ACKNOWLEDGED, order.getStatus());
            Integer sentQuantity = sentQuantities.remove(orderId);
            if (order.getStatus() == OrderStatus.CANCELLED && !alreadyKnown) {
                // Cancelled locally while the placement was in flight
                mutation.brokerCancels.add(orderId);
            } else if (order.isOpen() && sentQuantity != null && sentQuantity != order.getQuantity()) {
                // Resized locally while the placement was in flight
                mutation.amendments.add(orderId);
            }
            mutation.seal();
        } finally {
            lock.unlock();
        }
        log.info("Order {} acknowledged by broker as {}", orderId, brokerOrderId);
        flush(mutation);
    }

    void onPlacementRejected(String orderId, String reason) {
        Mutation mutation = new Mutation();
        lock.lock();
        try {
            Order order = orders.get(orderId);
            sentQuantities.remove(orderId);
            if (order == null) {
                return;
            }
            if (order.getStatus() != OrderStatus.PENDING) {
                log.warn("Broker refused order {} which is already {}: {}", orderId, order.getStatus(), reason);
                return;
            }
            applyRejection(order, reason, mutation);
            mutation.seal();
        } finally {
            lock.unlock();
        }
        flush(mutation);
    }

    void onPlacementUncertain(String orderId, Throwable cause) {
        sentQuantities.remove(orderId);
        awaitingReconciliation.add(orderId);
        log.warn(
                "Placement outcome of order {} unknown ({}), left PENDING for reconciliation",
                orderId,
                cause.toString());
    }

    private void attachBrokerOrderId(Order order, String brokerOrderId) {
        if (brokerOrderId == null) {
            return;
        }
        order.setBrokerOrderId(brokerOrderId);
        brokerOrderIndex.put(brokerOrderId, order.getId());
        awaitingReconciliation.remove(order.getId());
    }

    // ========================
    // BROKER EVENTS
    // ========================

    /**
     * Applies an asynchronous broker update. This is the only way an order's fill state changes
     * after placement.
     */
    public void onBrokerEvent(String orderId, BrokerOrderEvent event) {
        Mutation mutation = new Mutation();
        lock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null) {
                log.warn("Broker event {} for unknown order {}", event.getType(), orderId);
                return;
            }
            if (order.getBrokerOrderId() == null && event.getBrokerOrderId() != null) {
                attachBrokerOrderId(order, event.getBrokerOrderId());
            }

            if (order.isTerminal()) {
                onEventForTerminalOrder(order, event, mutation);
            } else {
                switch (event.getType()) {
                    case FILL -> applyFill(order, event.getFillQuantity(), event.getFillPrice(), mutation);
                    case CANCELLED -> cancelLocally(order, false, mutation);
                    case REJECTED -> {
                        if (order.getStatus().canTransitionTo(OrderStatus.REJECTED)) {
                            applyRejection(order, event.getReason(), mutation);
                        } else {
                            mutation.warning(
                                    order, "broker rejected a " + order.getStatus() + " order: " + event.getReason());
                            cancelLocally(order, false, mutation);
                        }
                    }
                }
            }
            mutation.seal();
        } finally {
            lock.unlock();
        }
        flush(mutation);
    }

    private void onEventForTerminalOrder(Order order, BrokerOrderEvent event, Mutation mutation) {
        switch (event.getType()) {
            case FILL -> {
                log.warn(
                        "Fill of {} @ {} received for {} order {} ({}), state kept",
                        event.getFillQuantity(),
                        event.getFillPrice(),
                        order.getStatus(),
                        order.getId(),
                        order.getRole());
                awaitingReconciliation.add(order.getId());
                mutation.warning(
                        order,
                        "fill of " + event.getFillQuantity() + " received after order became " + order.getStatus());
            }
            case CANCELLED, REJECTED -> log.debug(
                    "Ignoring broker {} for order {} already {}", event.getType(), order.getId(), order.getStatus());
        }
    }

    private void applyFill(Order order, int quantity, BigDecimal price, Mutation mutation) {
        if (quantity <= 0 || price == null) {
            mutation.warning(order, "malformed fill: quantity=" + quantity + ", price=" + price);
            return;
        }
        int applied = quantity;
        if (quantity > order.getRemainingQuantity()) {
            applied = order.getRemainingQuantity();
            mutation.warning(
                    order, "overfill: " + quantity + " reported against " + applied + " remaining, capped");
        }

        OrderStatus previous = order.getStatus();
        int filled = order.getFilledQuantity() + applied;
        BigDecimal previousCost = order.getAverageFillPrice() != null
                ? order.getAverageFillPrice().multiply(BigDecimal.valueOf(order.getFilledQuantity()))
                : BigDecimal.ZERO;
        BigDecimal averagePrice = previousCost
                .add(price.multiply(BigDecimal.valueOf(applied)))
                .divide(BigDecimal.valueOf(filled), PRICE_SCALE, RoundingMode.HALF_UP);

        order.setFilledQuantity(filled);
        order.setRemainingQuantity(order.getQuantity() - filled);
        order.setAverageFillPrice(averagePrice);
        order.setStatus(order.getRemainingQuantity() == 0 ? OrderStatus.FILLED : OrderStatus.PARTIAL);
        touch(order);
        positionLedger.applyFill(order.getSymbol(), order.getSide(), applied, price);

        log.info(
                "Order {} {} {} {} x {} @ {} ({}/{})",
                order.getId(),
                order.getStatus(),
                order.getSide(),
                applied,
                order.getSymbol(),
                price,
                filled,
                order.getQuantity());
        mutation.event(
                order,
                order.getStatus() == OrderStatus.FILLED ? OrderEventType.FILLED : OrderEventType.PARTIALLY_FILLED,
                previous);

        if (order.getRole() == OrderRole.ENTRY
                && order.getKind() == OrderKind.BRACKET
                && order.getStatus() == OrderStatus.FILLED
                && order.getChildOrderIds().isEmpty()) {
            protectBracket(order, order.getFilledQuantity(), mutation);
        } else if (order.getRole().isProtective()) {
            if (order.getStatus() == OrderStatus.FILLED) {
                resolveOneCancelsOther(order, mutation);
            } else {
                resizeSiblings(order, mutation);
            }
        }
    }

    private void applyRejection(Order order, String reason, Mutation mutation) {
        OrderStatus previous = order.getStatus();
        order.setStatus(OrderStatus.REJECTED);
        order.setRemainingQuantity(0);
        order.setRejectionReason(reason);
        touch(order);
        log.warn("Order {} ({} {} {}) rejected: {}", order.getId(), order.getRole(), order.getSide(), order.getSymbol(), reason);
        mutation.event(order, OrderEventType.REJECTED, previous);

        if (order.getRole() == OrderRole.ENTRY) {
            cancelOpenChildren(order, mutation);
            setComposite(order, CompositeStatus.ABANDONED, mutation);
            return;
        }
        if (order.getRole().isProtective()) {
            Order parent = orders.get(order.getParentOrderId());
            if (parent == null) {
                return;
            }
            if (parent.getKind() == OrderKind.COVER && parent.isOpen()) {
                log.warn("Protective stop {} rejected, cancelling cover entry {}", order.getId(), parent.getId());
                cancelLocally(parent, true, mutation);
            } else {
                mutation.warning(parent, "protective " + order.getRole() + " leg rejected: " + reason);
            }
        }
    }

    // ========================
    // COMPOSITES
    // ========================

    private void protectBracket(Order entry, int quantity, Mutation mutation) {
        Order takeProfit = newChild(entry, OrderRole.TAKE_PROFIT, OrderKind.LIMIT, entry.getTakeProfit(), quantity);
        Order stopLoss = newChild(entry, OrderRole.STOP_LOSS, OrderKind.STOP, entry.getStopLoss(), quantity);
        orders.put(takeProfit.getId(), takeProfit);
        orders.put(stopLoss.getId(), stopLoss);
        entry.getChildOrderIds().add(takeProfit.getId());
        entry.getChildOrderIds().add(stopLoss.getId());

        log.info(
                "Bracket {} entry filled, protective legs created: TP {} @ {}, SL {} @ {}",
                entry.getId(),
                takeProfit.getId(),
                takeProfit.getPrice(),
                stopLoss.getId(),
                stopLoss.getPrice());
        mutation.event(takeProfit, OrderEventType.PLACED, null);
        mutation.event(stopLoss, OrderEventType.PLACED, null);
        mutation.placements.add(takeProfit.getId());
        mutation.placements.add(stopLoss.getId());
        setComposite(entry, CompositeStatus.PROTECTED, mutation);
    }

    private void resolveOneCancelsOther(Order filledLeg, Mutation mutation) {
        Order parent = orders.get(filledLeg.getParentOrderId());
        if (parent == null) {
            return;
        }
        for (String siblingId : parent.getChildOrderIds()) {
            Order sibling = orders.get(siblingId);
            if (sibling != null && !siblingId.equals(filledLeg.getId()) && sibling.isOpen()) {
                log.info("OCO: {} filled, cancelling sibling {} {}", filledLeg.getId(), sibling.getRole(), siblingId);
                cancelLocally(sibling, true, mutation);
            }
        }
        setComposite(parent, CompositeStatus.RESOLVED, mutation);
    }

    /**
     * After a partial fill of a protective leg only its remaining quantity is still open, so the
     * sibling is cut to match.
     */
    private void resizeSiblings(Order partiallyFilledLeg, Mutation mutation) {
        Order parent = orders.get(partiallyFilledLeg.getParentOrderId());
        if (parent == null) {
            return;
        }
        for (String siblingId : parent.getChildOrderIds()) {
            Order sibling = orders.get(siblingId);
            if (sibling != null && !siblingId.equals(partiallyFilledLeg.getId()) && sibling.isOpen()) {
                resizeRemaining(sibling, partiallyFilledLeg.getRemainingQuantity(), mutation);
            }
        }
    }

    private void fitCoverStopToFill(Order entry, Mutation mutation) {
        for (String childId : entry.getChildOrderIds()) {
            Order stop = orders.get(childId);
            if (stop != null && stop.isOpen()) {
                log.info(
                        "Cover {} cancelled after filling {} of {}, cutting stop {} to match",
                        entry.getId(),
                        entry.getFilledQuantity(),
                        entry.getQuantity(),
                        stop.getId());
                resizeRemaining(stop, entry.getFilledQuantity() - stop.getFilledQuantity(), mutation);
            }
        }
    }

    /**
     * Changes an open order's remaining quantity, keeping what already filled. Zero or less
     * cancels it instead. The broker is amended once the order has a broker id; a placement
     * still in flight is amended when it is acknowledged.
     */
    private void resizeRemaining(Order order, int remaining, Mutation mutation) {
        if (remaining <= 0) {
            cancelLocally(order, true, mutation);
            return;
        }
        if (remaining == order.getRemainingQuantity()) {
            return;
        }
        int previousQuantity = order.getQuantity();
        order.setQuantity(order.getFilledQuantity() + remaining);
        order.setRemainingQuantity(remaining);
        touch(order);
        log.info(
                "Order {} ({} {}) resized from {} to {}",
                order.getId(),
                order.getRole(),
                order.getSymbol(),
                previousQuantity,
                order.getQuantity());
        mutation.event(order, OrderEventType.AMENDED, order.getStatus());
        if (order.getBrokerOrderId() != null) {
            mutation.amendments.add(order.getId());
        }
    }

    private void cancelOpenChildren(Order parent, Mutation mutation) {
        for (String childId : parent.getChildOrderIds()) {
            Order child = orders.get(childId);
            if (child != null && child.isOpen()) {
                cancelLocally(child, true, mutation);
            }
        }
    }

    private void setComposite(Order entry, CompositeStatus status, Mutation mutation) {
        if (entry.getCompositeStatus() == status || entry.getCompositeStatus() == CompositeStatus.NONE) {
            return;
        }
        entry.setCompositeStatus(status);
        touch(entry);
        mutation.event(entry, OrderEventType.COMPOSITE_UPDATED, entry.getStatus());
    }

    // ========================
    // CANCELLATION
    // ========================

    /**
     * Cancels an open order, cascading to the open children of a composite entry. The order is
     * CANCELLED locally at once; the returned future completes with whether the broker accepted
     * every cancel request.
     *
     * @throws ResourceNotFoundException if the order is unknown
     * @throws InvalidOrderStateException if the order is terminal and strict invariants are on
     */
    public CompletableFuture<Boolean> cancel(String orderId) {
        return cancel(orderId, true, true);
    }

    /**
     * Like {@link #cancel} but a terminal order is a no-op returning false. Used for bulk
     * cancellation, where cascades may already have closed later orders in the batch.
     */
    public CompletableFuture<Boolean> cancelIfOpen(String orderId) {
        return cancel(orderId, false, true);
    }

    /**
     * Like {@link #cancelIfOpen} but never creates or resizes protective legs: a partially filled
     * entry has its open legs cancelled and is ABANDONED, leaving the filled quantity to the
     * liquidation that follows. Used by the emergency halt, which must not start new order flow.
     */
    public CompletableFuture<Boolean> cancelForHalt(String orderId) {
        return cancel(orderId, false, false);
    }

    private CompletableFuture<Boolean> cancel(String orderId, boolean enforceOpen, boolean protectFills) {
        Mutation mutation = new Mutation();
        lock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null) {
                throw new ResourceNotFoundException("Order", orderId);
            }
            if (!order.isOpen()) {
                if (enforceOpen) {
                    if (strictInvariants) {
                        throw new InvalidOrderStateException(orderId, order.getStatus(), "cancel");
                    }
                    log.warn("Refusing to cancel order {} in terminal state {}", orderId, order.getStatus());
                }
                return CompletableFuture.completedFuture(false);
            }
            cancelLocally(order, true, protectFills, mutation);
            mutation.seal();
        } finally {
            lock.unlock();
        }

        List<CompletableFuture<Boolean>> brokerCancels = flush(mutation);
        return CompletableFuture.allOf(brokerCancels.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> brokerCancels.stream().allMatch(CompletableFuture::join));
    }

    private void cancelLocally(Order order, boolean notifyBroker, Mutation mutation) {
        cancelLocally(order, notifyBroker, true, mutation);
    }

    /**
     * Marks an order CANCELLED and applies the composite consequences. {@code notifyBroker} is
     * false when the cancel came from the broker itself. With {@code protectFills} off, the
     * filled part of a composite entry is left unprotected.
     */
    private void cancelLocally(Order order, boolean notifyBroker, boolean protectFills, Mutation mutation) {
        OrderStatus previous = order.getStatus();
        order.setStatus(OrderStatus.CANCELLED);
        order.setRemainingQuantity(0);
        touch(order);
        log.info("Order {} ({} {} {}) cancelled", order.getId(), order.getRole(), order.getSide(), order.getSymbol());
        mutation.event(order, OrderEventType.CANCELLED, previous);
        if (notifyBroker && order.getBrokerOrderId() != null) {
            mutation.brokerCancels.add(order.getId());
        }

        if (order.getRole() != OrderRole.ENTRY) {
            return;
        }
        if (order.getFilledQuantity() == 0) {
            cancelOpenChildren(order, mutation);
            setComposite(order, CompositeStatus.ABANDONED, mutation);
        } else if (!protectFills) {
            cancelOpenChildren(order, mutation);
            setComposite(order, CompositeStatus.ABANDONED, mutation);
            mutation.warning(
                    order, "entry cancelled by halt with " + order.getFilledQuantity() + " filled and unprotected");
        } else if (order.getKind() == OrderKind.BRACKET && order.getChildOrderIds().isEmpty()) {
            protectBracket(order, order.getFilledQuantity(), mutation);
        } else if (order.getKind() == OrderKind.COVER) {
            fitCoverStopToFill(order, mutation);
        }
    }

    // ========================
    // SIDE EFFECTS
    // ========================

    private List<CompletableFuture<Boolean>> flush(Mutation mutation) {
        mutation.sealedEvents.forEach(eventPublisherHelper::publish);
        for (String orderId : mutation.placements) {
            submitPlacement(orderId);
        }
        for (String orderId : mutation.amendments) {
            submitAmendment(orderId);
        }
        List<CompletableFuture<Boolean>> cancels = new ArrayList<>();
        for (String orderId : mutation.brokerCancels) {
            cancels.add(submitBrokerCancel(orderId));
        }
        return cancels;
    }

    private void submitPlacement(String orderId) {
        BrokerOrderRequest request;
        lock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null || order.getStatus() != OrderStatus.PENDING) {
                // Cancelled before it was ever sent
                return;
            }
            request = toBrokerRequest(order);
            sentQuantities.put(orderId, order.getQuantity());
        } finally {
            lock.unlock();
        }

        brokerCallExecutor
                .submit("placeOrder " + orderId, () -> brokerGateway.placeOrder(request))
                .whenComplete((brokerOrderId, error) -> {
                    if (error == null) {
                        onPlacementAcknowledged(orderId, brokerOrderId);
                        return;
                    }
                    Throwable cause = BrokerCallExecutor.unwrap(error);
                    if (cause instanceof BrokerException) {
                        onPlacementRejected(orderId, cause.getMessage());
                    } else {
                        onPlacementUncertain(orderId, cause);
                    }
                });
    }

    private void submitAmendment(String orderId) {
        String brokerOrderId;
        int quantity;
        lock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null || !order.isOpen() || order.getBrokerOrderId() == null) {
                return;
            }
            brokerOrderId = order.getBrokerOrderId();
            quantity = order.getQuantity();
        } finally {
            lock.unlock();
        }

        brokerCallExecutor
                .submit("modifyOrder " + orderId, () -> {
                    brokerGateway.modifyOrder(brokerOrderId, quantity);
                    return Boolean.TRUE;
                })
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        awaitingReconciliation.add(orderId);
                        reportReconciliationWarning(
                                orderId,
                                "broker resize to " + quantity + " failed: "
                                        + BrokerCallExecutor.unwrap(error).getMessage());
                    }
                });
    }

    private CompletableFuture<Boolean> submitBrokerCancel(String orderId) {
        String brokerOrderId = orders.get(orderId).getBrokerOrderId();
        return brokerCallExecutor
                .submit("cancelOrder " + orderId, () -> brokerGateway.cancelOrder(brokerOrderId))
                .handle((accepted, error) -> {
                    if (error != null) {
                        awaitingReconciliation.add(orderId);
                        reportReconciliationWarning(
                                orderId, "broker cancel failed: " + BrokerCallExecutor.unwrap(error).getMessage());
                        return false;
                    }
                    if (!Boolean.TRUE.equals(accepted)) {
                        awaitingReconciliation.add(orderId);
                        reportReconciliationWarning(orderId, "broker did not accept cancel");
                        return false;
                    }
                    return true;
                });
    }

    static BrokerOrderRequest toBrokerRequest(Order order) {
        OrderKind brokerKind = switch (order.getKind()) {
            case BRACKET, COVER -> order.getPrice() != null ? OrderKind.LIMIT : OrderKind.MARKET;
            default -> order.getKind();
        };
        return BrokerOrderRequest.builder()
                .clientOrderId(order.getId())
                .symbol(order.getSymbol())
                .side(order.getSide())
                .kind(brokerKind)
                .quantity(order.getQuantity())
                .price(order.getPrice())
                .referencePrice(order.getReferencePrice())
                .build();
    }

    private void touch(Order order) {
        order.setVersion(order.getVersion() + 1);
        order.setUpdatedAt(clock.instant());
    }

    // ========================
    // RECONCILIATION SUPPORT
    // ========================

    /**
     * Publishes a reconciliation warning for the order without changing its state.
     */
    public void reportReconciliationWarning(String orderId, String detail) {
        Order snapshot;
        lock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null) {
                return;
            }
            snapshot = order.copy();
        } finally {
            lock.unlock();
        }
        log.warn("Reconciliation warning for order {}: {}", orderId, detail);
        eventPublisherHelper.publishReconciliationWarning(this, snapshot, detail);
    }

    public Set<String> getOrdersAwaitingReconciliation() {
        return Set.copyOf(awaitingReconciliation);
    }

    void clearReconciliationFlag(String orderId) {
        awaitingReconciliation.remove(orderId);
    }

    /**
     * Re-sends a cancel for an order that is terminal locally but still working at the broker.
     */
    CompletableFuture<Boolean> resendBrokerCancel(String orderId) {
        return submitBrokerCancel(orderId);
    }

    // ========================
    // RECOVERY
    // ========================

    /**
     * Replaces in-memory state with previously journaled orders. Open orders without a broker
     * id are flagged for reconciliation since their placement outcome is unknown.
     */
    public void restore(Collection<Order> restored) {
        lock.lock();
        try {
            orders.clear();
            brokerOrderIndex.clear();
            awaitingReconciliation.clear();
            for (Order order : restored) {
                Order copy = order.copy();
                orders.put(copy.getId(), copy);
                if (copy.getBrokerOrderId() != null) {
                    brokerOrderIndex.put(copy.getBrokerOrderId(), copy.getId());
                } else if (copy.isOpen()) {
                    awaitingReconciliation.add(copy.getId());
                }
            }
        } finally {
            lock.unlock();
        }
        log.info("Restored {} orders ({} awaiting reconciliation)", restored.size(), awaitingReconciliation.size());
    }

    // ========================
    // QUERIES
    // ========================

    public Optional<Order> getOrder(String orderId) {
        lock.lock();
        try {
            Order order = orders.get(orderId);
            return order != null ? Optional.of(order.copy()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public boolean exists(String orderId) {
        return orders.containsKey(orderId);
    }

    public Optional<String> findOrderIdByBrokerOrderId(String brokerOrderId) {
        return Optional.ofNullable(brokerOrderIndex.get(brokerOrderId));
    }

    public List<Order> getOpenOrders() {
        return snapshotWhere(Order::isOpen);
    }

    public List<Order> getAllOrders() {
        return snapshotWhere(order -> true);
    }

    public List<Order> getChildren(String parentOrderId) {
        return snapshotWhere(order -> parentOrderId.equals(order.getParentOrderId()));
    }

    /**
     * Signed notional of working entry and standalone orders for the symbol, remaining
     * quantity at limit price (or reference price for market orders). Protective legs are
     * excluded since they only ever reduce the position.
     */
    public BigDecimal openEntryExposure(String symbol) {
        lock.lock();
        try {
            BigDecimal exposure = BigDecimal.ZERO;
            for (Order order : orders.values()) {
                if (!order.isOpen() || order.getRole().isProtective() || !symbol.equals(order.getSymbol())) {
                    continue;
                }
                BigDecimal price = order.getValuationPrice();
                if (price == null) {
                    continue;
                }
                exposure = exposure.add(price.multiply(
                        BigDecimal.valueOf((long) order.getSide().sign() * order.getRemainingQuantity())));
            }
            return exposure;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Signed position value at {@code referencePrice} plus {@link #openEntryExposure(String)}.
     *
     * <p>Both are read under the lock fills are applied under, so a fill that moves quantity out
     * of a working order and into the position is counted on exactly one side.
     */
    public BigDecimal committedExposure(String symbol, BigDecimal referencePrice) {
        lock.lock();
        try {
            return positionLedger.positionValue(symbol, referencePrice).add(openEntryExposure(symbol));
        } finally {
            lock.unlock();
        }
    }

    private List<Order> snapshotWhere(Predicate<Order> filter) {
        lock.lock();
        try {
            return orders.values().stream()
                    .filter(filter)
                    .sorted(Comparator.comparing(Order::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                    .map(Order::copy)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // MUTATION
    // ========================

    /**
     * Side effects of one locked operation. Events are recorded by order id and turned into
     * snapshots by {@link #seal()} while the lock is still held, so every snapshot reflects the
     * state at the end of the operation.
     */
    private final class Mutation {

        private final List<PendingEvent> events = new ArrayList<>();
        private final List<OrderEvent> sealedEvents = new ArrayList<>();
        private final List<String> placements = new ArrayList<>();
        private final List<String> amendments = new ArrayList<>();
        private final List<String> brokerCancels = new ArrayList<>();

        void event(Order order, OrderEventType type, OrderStatus previousStatus) {
            events.add(new PendingEvent(order.getId(), type, previousStatus, null));
        }

        void warning(Order order, String detail) {
            events.add(new PendingEvent(order.getId(), OrderEventType.RECONCILIATION_WARNING, order.getStatus(), detail));
        }

        void seal() {
            for (PendingEvent pending : events) {
                Order snapshot = orders.get(pending.orderId()).copy();
                sealedEvents.add(new OrderEvent(
                        OrderLifecycleManager.this,
                        snapshot,
                        pending.type(),
                        pending.previousStatus(),
                        pending.detail()));
            }
            events.clear();
        }
    }

    private record PendingEvent(String orderId, OrderEventType type, OrderStatus previousStatus, String detail) {}
}
