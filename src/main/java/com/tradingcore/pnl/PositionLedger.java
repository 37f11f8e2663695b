package com.tradingcore.pnl;

import com.tradingcore.domain.enums.OrderSide;
import com.tradingcore.domain.model.Position;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Net positions per symbol, built from fills and marked to market from ticks.
 *
 * <p>Average-price accounting: fills that add to a position move the average price; fills that
 * reduce it realize P&L against the average; a fill that crosses zero closes the old position
 * and opens the remainder at the fill price.
 *
 * <p>Each symbol is updated atomically through {@link ConcurrentHashMap#compute}. Positions are
 * never removed.
 */
@Component
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private static final int PRICE_SCALE = 6;

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    // ========================
    // FILLS
    // ========================

    public Position applyFill(String symbol, OrderSide side, int quantity, BigDecimal price) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive, got " + quantity);
        }
        int signedFill = side.sign() * quantity;

        Position updated = positions.compute(symbol, (s, existing) -> {
            Position position = existing != null ? existing : Position.flat(s);
            int oldQty = position.getQuantity();
            int newQty = oldQty + signedFill;
            BigDecimal realized = position.getRealizedPnl();
            BigDecimal avgPrice = position.getAvgPrice();

            if (oldQty == 0 || Integer.signum(oldQty) == Integer.signum(signedFill)) {
                BigDecimal cost = avgPrice.multiply(BigDecimal.valueOf(Math.abs(oldQty)))
                        .add(price.multiply(BigDecimal.valueOf(quantity)));
                avgPrice = cost.divide(BigDecimal.valueOf(Math.abs(newQty)), PRICE_SCALE, RoundingMode.HALF_UP);
            } else {
                int closedQty = Math.min(Math.abs(oldQty), quantity);
                BigDecimal pnlPerUnit = price.subtract(avgPrice).multiply(BigDecimal.valueOf(Integer.signum(oldQty)));
                realized = realized.add(pnlPerUnit.multiply(BigDecimal.valueOf(closedQty)));
                if (newQty == 0) {
                    avgPrice = BigDecimal.ZERO;
                } else if (Integer.signum(newQty) != Integer.signum(oldQty)) {
                    avgPrice = price;
                }
            }

            return position.toBuilder()
                    .quantity(newQty)
                    .avgPrice(avgPrice)
                    .currentPrice(lastPrices.getOrDefault(s, price))
                    .realizedPnl(realized)
                    .build();
        });

        log.debug(
                "Position {} after {} {} @ {}: qty={}, avg={}, realized={}",
                symbol,
                side,
                quantity,
                price,
                updated.getQuantity(),
                updated.getAvgPrice(),
                updated.getRealizedPnl());
        return updated;
    }

    // ========================
    // MARK TO MARKET
    // ========================

    public void markToMarket(String symbol, BigDecimal price) {
        lastPrices.put(symbol, price);
        positions.computeIfPresent(
                symbol, (s, position) -> position.toBuilder().currentPrice(price).build());
    }

    public Optional<BigDecimal> lastPrice(String symbol) {
        return Optional.ofNullable(lastPrices.get(symbol));
    }

    // ========================
    // QUERIES
    // ========================

    public Optional<Position> getPosition(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public List<Position> getPositions() {
        return new ArrayList<>(positions.values());
    }

    /**
     * Signed value of the current position at the given price, zero when flat or when the
     * symbol has never traded.
     */
    public BigDecimal positionValue(String symbol, BigDecimal atPrice) {
        Position position = positions.get(symbol);
        if (position == null || position.isFlat() || atPrice == null) {
            return BigDecimal.ZERO;
        }
        return atPrice.multiply(BigDecimal.valueOf(position.getQuantity()));
    }

    public BigDecimal totalRealizedPnl() {
        return positions.values().stream().map(Position::getRealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalUnrealizedPnl() {
        return positions.values().stream().map(Position::unrealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
