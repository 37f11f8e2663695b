package com.tradingcore.marketdata;

import com.tradingcore.core.engine.TickDispatcher;
import com.tradingcore.domain.model.Tick;
import com.tradingcore.event.EventPublisherHelper;
import com.tradingcore.pnl.PositionLedger;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for normalized ticks from a market-data adapter.
 *
 * <p>Marks positions to market before the dispatcher sees the tick, so risk checks triggered by
 * the tick's signals value positions at this price. Malformed ticks are logged and dropped.
 */
@Component
public class MarketDataIngress {

    private static final Logger log = LoggerFactory.getLogger(MarketDataIngress.class);

    private final PositionLedger positionLedger;
    private final TickDispatcher tickDispatcher;
    private final EventPublisherHelper eventPublisherHelper;

    public MarketDataIngress(
            PositionLedger positionLedger, TickDispatcher tickDispatcher, EventPublisherHelper eventPublisherHelper) {
        this.positionLedger = positionLedger;
        this.tickDispatcher = tickDispatcher;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public void deliverTick(Tick tick) {
        if (tick == null || tick.getSymbol() == null || tick.getSymbol().isBlank()) {
            log.warn("Dropping tick without symbol: {}", tick);
            return;
        }
        if (tick.getPrice() == null || tick.getPrice().compareTo(BigDecimal.ZERO) <= 0) {
            log.warn("Dropping tick for {} with invalid price {}", tick.getSymbol(), tick.getPrice());
            return;
        }

        positionLedger.markToMarket(tick.getSymbol(), tick.getPrice());
        tickDispatcher.onTick(tick);
        eventPublisherHelper.publishTick(this, tick);
    }
}
