package com.tradingcore.core.engine;

import com.tradingcore.config.StrategyProperties;
import com.tradingcore.config.StrategyProperties.StrategyDefinition;
import com.tradingcore.strategy.StrategyFactory;
import com.tradingcore.strategy.base.TradingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Subscribes the configured strategies once the application is ready.
 *
 * <p>Runs after order recovery so that strategies never see ticks before the order book is
 * restored. A definition that fails to build is logged and skipped; the rest still start.
 */
@Component
@Order(100)
public class StrategyBootstrap implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(StrategyBootstrap.class);

    private final StrategyProperties strategyProperties;
    private final StrategyFactory strategyFactory;
    private final TickDispatcher tickDispatcher;

    public StrategyBootstrap(
            StrategyProperties strategyProperties, StrategyFactory strategyFactory, TickDispatcher tickDispatcher) {
        this.strategyProperties = strategyProperties;
        this.strategyFactory = strategyFactory;
        this.tickDispatcher = tickDispatcher;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        int started = 0;
        for (StrategyDefinition definition : strategyProperties.getStrategies()) {
            if (!definition.isEnabled()) {
                log.info("Strategy {} disabled, skipped", definition.getId());
                continue;
            }
            try {
                TradingStrategy strategy = strategyFactory.create(definition);
                if (tickDispatcher.subscribe(strategy)) {
                    started++;
                }
            } catch (IllegalArgumentException e) {
                log.error("Strategy {} not started: {}", definition.getId(), e.getMessage());
            }
        }
        log.info("Started {} of {} configured strategies", started, strategyProperties.getStrategies().size());
    }
}
