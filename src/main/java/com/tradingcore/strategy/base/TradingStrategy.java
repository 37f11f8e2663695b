package com.tradingcore.strategy.base;

import com.tradingcore.domain.model.Order;
import com.tradingcore.domain.model.Signal;
import com.tradingcore.domain.model.Tick;
import java.util.List;

/**
 * Contract between the tick dispatcher and a strategy.
 *
 * <p>The dispatcher guarantees that calls into one strategy never overlap: {@link #onTick},
 * {@link #generateSignals} and {@link #onFill} all run on the strategy's own serial lane, so
 * implementations need no locking for their own state. A strategy may emit signals when a
 * tick arrives (push) or hold them until the dispatcher polls (pull), or both.
 *
 * <p>Strategies only receive ticks for {@link #getSymbol()} and never need to filter.
 */
public interface TradingStrategy {

    String getId();

    String getSymbol();

    List<Signal> onTick(Tick tick);

    List<Signal> generateSignals();

    /**
     * Called when one of this strategy's orders fills, partially fills or is rejected.
     */
    void onFill(Order order);
}
