package com.tradingcore.broker;

import com.tradingcore.exception.BrokerException;
import java.util.List;

/**
 * Order-entry boundary to the broker.
 *
 * <p>Calls may block; the lifecycle manager always invokes them off its lock through
 * {@code BrokerCallExecutor}, which applies the configured time limit. Fills, cancels and
 * rejections that happen after placement arrive asynchronously through
 * {@link BrokerEventHandler}.
 */
public interface BrokerGateway {

    /**
     * Sends an order to the broker.
     *
     * @return the broker-assigned order id
     * @throws BrokerException if the broker refuses the order; the message is the broker's reason
     */
    String placeOrder(BrokerOrderRequest request);

    /**
     * Changes the total quantity of a working order.
     *
     * @throws BrokerException if the broker refuses the modification
     */
    void modifyOrder(String brokerOrderId, int quantity);

    /** Requests cancellation. Returns false if the broker did not accept the request. */
    boolean cancelOrder(String brokerOrderId);

    /** Orders the broker currently considers working, used for reconciliation. */
    List<BrokerOrderSnapshot> queryOpenOrders();

    /** Flattens every position at market. Returns false if the broker did not accept it. */
    boolean liquidateAll();
}
