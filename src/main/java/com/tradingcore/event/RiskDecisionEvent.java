package com.tradingcore.event;

import com.tradingcore.domain.model.OrderIntent;
import com.tradingcore.risk.RiskDecision;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every intent the risk gate evaluates, approved or not, so that the
 * journal holds a complete record of risk decisions.
 */
public class RiskDecisionEvent extends ApplicationEvent {

    private final OrderIntent intent;
    private final RiskDecision decision;

    public RiskDecisionEvent(Object source, OrderIntent intent, RiskDecision decision) {
        super(source);
        this.intent = intent;
        this.decision = decision;
    }

    public OrderIntent getIntent() {
        return intent;
    }

    public RiskDecision getDecision() {
        return decision;
    }
}
