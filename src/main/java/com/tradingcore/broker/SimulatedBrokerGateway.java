package com.tradingcore.broker;

import com.tradingcore.domain.enums.OrderKind;
import com.tradingcore.domain.enums.OrderSide;
import com.tradingcore.domain.model.Tick;
import com.tradingcore.event.TickEvent;
import com.tradingcore.exception.BrokerException;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;

/**
 * In-memory broker for paper trading and tests.
 *
 * <p>Execution rules:
 * <ul>
 *   <li>MARKET: filled in full at placement, at the reference price or the last tick price</li>
 *   <li>LIMIT: rests until a tick trades through the limit (BUY at or below, SELL at or above)
 *       and fills at the tick price</li>
 *   <li>STOP: rests until a tick reaches the trigger (SELL at or below, BUY at or above) and
 *       fills at the tick price</li>
 * </ul>
 *
 * <p>Fills are published as {@link BrokerOrderEvent}s through the application context, the same
 * way a live adapter would report them. Orders for symbols marked with {@link #rejectSymbol} are
 * refused with {@link BrokerException}.
 */
public class SimulatedBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedBrokerGateway.class);

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    private final Map<String, RestingOrder> restingOrders = new LinkedHashMap<>();
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();
    private final Map<String, Integer> netPositions = new ConcurrentHashMap<>();
    private final Map<String, String> rejectedSymbols = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    public SimulatedBrokerGateway(ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    // ========================
    // ORDER ENTRY
    // ========================

    @Override
    public String placeOrder(BrokerOrderRequest request) {
        String refusal = rejectedSymbols.get(request.getSymbol());
        if (refusal != null) {
            throw new BrokerException(refusal);
        }
        if (request.getQuantity() <= 0) {
            throw new BrokerException("quantity must be positive");
        }

        String brokerOrderId = "SIM-" + idSequence.incrementAndGet();

        if (request.getKind() == OrderKind.MARKET) {
            BigDecimal price = request.getReferencePrice() != null
                    ? request.getReferencePrice()
                    : lastPrices.get(request.getSymbol());
            if (price == null) {
                throw new BrokerException("no price available for " + request.getSymbol());
            }
            log.info(
                    "[SIM] MARKET {} {} x {} filled @ {} as {}",
                    request.getSide(),
                    request.getSymbol(),
                    request.getQuantity(),
                    price,
                    brokerOrderId);
            publishFill(new RestingOrder(brokerOrderId, request), request.getQuantity(), price);
            return brokerOrderId;
        }

        if (request.getPrice() == null) {
            throw new BrokerException(request.getKind() + " order requires a price");
        }
        synchronized (restingOrders) {
            restingOrders.put(brokerOrderId, new RestingOrder(brokerOrderId, request));
        }
        log.info(
                "[SIM] {} {} {} x {} @ {} resting as {}",
                request.getKind(),
                request.getSide(),
                request.getSymbol(),
                request.getQuantity(),
                request.getPrice(),
                brokerOrderId);
        return brokerOrderId;
    }

    @Override
    public void modifyOrder(String brokerOrderId, int quantity) {
        if (quantity <= 0) {
            throw new BrokerException("quantity must be positive");
        }
        synchronized (restingOrders) {
            RestingOrder resting = restingOrders.get(brokerOrderId);
            if (resting == null) {
                throw new BrokerException("order " + brokerOrderId + " is not working");
            }
            restingOrders.put(
                    brokerOrderId,
                    new RestingOrder(brokerOrderId, resting.request.toBuilder().quantity(quantity).build()));
        }
        log.info("[SIM] modified {} to quantity {}", brokerOrderId, quantity);
    }

    @Override
    public boolean cancelOrder(String brokerOrderId) {
        RestingOrder removed;
        synchronized (restingOrders) {
            removed = restingOrders.remove(brokerOrderId);
        }
        if (removed == null) {
            log.debug("[SIM] cancel of {} ignored, not resting", brokerOrderId);
            return false;
        }
        log.info("[SIM] cancelled {}", brokerOrderId);
        return true;
    }

    @Override
    public List<BrokerOrderSnapshot> queryOpenOrders() {
        synchronized (restingOrders) {
            return restingOrders.values().stream()
                    .map(resting -> BrokerOrderSnapshot.builder()
                            .brokerOrderId(resting.brokerOrderId)
                            .clientOrderId(resting.request.getClientOrderId())
                            .symbol(resting.request.getSymbol())
                            .quantity(resting.request.getQuantity())
                            .filledQuantity(0)
                            .build())
                    .toList();
        }
    }

    /**
     * Drops every resting order and flattens the simulated positions. Nothing is published: the
     * caller cancels its own orders first.
     */
    @Override
    public boolean liquidateAll() {
        int cancelled;
        synchronized (restingOrders) {
            cancelled = restingOrders.size();
            restingOrders.clear();
        }
        Map<String, Integer> flattened = Map.copyOf(netPositions);
        netPositions.clear();
        log.warn("[SIM] liquidated positions {} and dropped {} resting orders", flattened, cancelled);
        return true;
    }

    // ========================
    // MATCHING
    // ========================

    @EventListener
    public void onTick(TickEvent event) {
        Tick tick = event.getTick();
        lastPrices.put(tick.getSymbol(), tick.getPrice());

        List<RestingOrder> triggered = new ArrayList<>();
        synchronized (restingOrders) {
            Iterator<RestingOrder> iterator = restingOrders.values().iterator();
            while (iterator.hasNext()) {
                RestingOrder resting = iterator.next();
                if (resting.request.getSymbol().equals(tick.getSymbol()) && resting.triggeredBy(tick.getPrice())) {
                    iterator.remove();
                    triggered.add(resting);
                }
            }
        }

        for (RestingOrder resting : triggered) {
            log.info(
                    "[SIM] {} {} {} x {} filled @ {} ({})",
                    resting.request.getKind(),
                    resting.request.getSide(),
                    resting.request.getSymbol(),
                    resting.request.getQuantity(),
                    tick.getPrice(),
                    resting.brokerOrderId);
            publishFill(resting, resting.request.getQuantity(), tick.getPrice());
        }
    }

    private void publishFill(RestingOrder order, int quantity, BigDecimal price) {
        netPositions.merge(
                order.request.getSymbol(), order.request.getSide().sign() * quantity, Integer::sum);
        applicationEventPublisher.publishEvent(BrokerOrderEvent.builder()
                .brokerOrderId(order.brokerOrderId)
                .clientOrderId(order.request.getClientOrderId())
                .type(BrokerOrderEventType.FILL)
                .fillQuantity(quantity)
                .fillPrice(price)
                .timestamp(clock.instant())
                .build());
    }

    // ========================
    // TEST AND PAPER CONTROLS
    // ========================

    /** Refuses every following order for the symbol with the given reason. */
    public void rejectSymbol(String symbol, String reason) {
        rejectedSymbols.put(symbol, reason);
    }

    public void acceptSymbol(String symbol) {
        rejectedSymbols.remove(symbol);
    }

    /** Net simulated position per symbol, signed. */
    public Map<String, Integer> getNetPositions() {
        return Map.copyOf(netPositions);
    }

    public int getRestingOrderCount() {
        synchronized (restingOrders) {
            return restingOrders.size();
        }
    }

    private static final class RestingOrder {

        private final String brokerOrderId;
        private final BrokerOrderRequest request;

        private RestingOrder(String brokerOrderId, BrokerOrderRequest request) {
            this.brokerOrderId = brokerOrderId;
            this.request = request;
        }

        private boolean triggeredBy(BigDecimal price) {
            int comparison = price.compareTo(request.getPrice());
            boolean buy = request.getSide() == OrderSide.BUY;
            if (request.getKind() == OrderKind.STOP) {
                return buy ? comparison >= 0 : comparison <= 0;
            }
            return buy ? comparison <= 0 : comparison >= 0;
        }
    }
}
