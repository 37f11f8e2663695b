package com.tradingcore.config;

import com.tradingcore.domain.enums.TradingMode;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name and trading mode, so paper and live runs can be
 * told apart on a shared backend. Meter definitions live in
 * {@link com.tradingcore.observability.TradingMetrics}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final TradingMode tradingMode;

    public MetricsConfig(
            MeterRegistry meterRegistry, @Value("${tradingcore.trading-mode:PAPER}") TradingMode tradingMode) {
        this.meterRegistry = meterRegistry;
        this.tradingMode = tradingMode;
    }

    @PostConstruct
    public void configureCommonTags() {
        meterRegistry.config().commonTags("application", "trading-core", "mode", tradingMode.name());
    }
}
