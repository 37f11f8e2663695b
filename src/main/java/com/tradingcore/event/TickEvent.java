package com.tradingcore.event;

import com.tradingcore.domain.model.Tick;
import org.springframework.context.ApplicationEvent;

/**
 * Published by MarketDataIngress after a tick has been applied to the position ledger and
 * handed to the dispatcher. The simulated broker uses it to match resting orders.
 */
public class TickEvent extends ApplicationEvent {

    private final Tick tick;

    public TickEvent(Object source, Tick tick) {
        super(source);
        this.tick = tick;
    }

    public Tick getTick() {
        return tick;
    }
}
