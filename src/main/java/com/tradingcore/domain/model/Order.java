package com.tradingcore.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tradingcore.domain.enums.CompositeStatus;
import com.tradingcore.domain.enums.OrderKind;
import com.tradingcore.domain.enums.OrderRole;
import com.tradingcore.domain.enums.OrderSide;
import com.tradingcore.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An order tracked by the lifecycle manager.
 *
 * <p>Invariants maintained by {@code OrderLifecycleManager}:
 * <ul>
 *   <li>{@code filledQuantity + remainingQuantity == quantity}</li>
 *   <li>{@code remainingQuantity == 0} exactly when the status is terminal</li>
 *   <li>a BRACKET entry has zero or two children; a COVER entry has exactly one</li>
 * </ul>
 *
 * <p>Instances held by the manager are mutable and never leave it; callers and events
 * receive {@link #copy()} snapshots. {@code version} increases on every mutation so that
 * journal entries can be replayed by keeping the highest version per id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private String id;
    private String brokerOrderId;
    private String strategyId;
    private String signalId;
    private String symbol;
    private OrderSide side;
    private OrderKind kind;

    @Builder.Default
    private OrderRole role = OrderRole.STANDALONE;

    private int quantity;

    /** Limit price for LIMIT/BRACKET entries, trigger price for STOP legs. */
    private BigDecimal price;

    /** Price used for exposure when the order has no limit price (MARKET). */
    private BigDecimal referencePrice;

    private BigDecimal stopLoss;
    private BigDecimal takeProfit;

    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;

    private int filledQuantity;
    private int remainingQuantity;
    private BigDecimal averageFillPrice;

    private String parentOrderId;

    @Builder.Default
    private List<String> childOrderIds = new ArrayList<>();

    @Builder.Default
    private CompositeStatus compositeStatus = CompositeStatus.NONE;

    private String rejectionReason;
    private long version;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public boolean isOpen() {
        return status == OrderStatus.PENDING || status == OrderStatus.PARTIAL;
    }

    /** Price at which this order's exposure is valued. */
    @JsonIgnore
    public BigDecimal getValuationPrice() {
        return price != null ? price : referencePrice;
    }

    public Order copy() {
        return toBuilder().childOrderIds(new ArrayList<>(childOrderIds)).build();
    }
}
