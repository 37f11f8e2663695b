package com.tradingcore.config;

import com.tradingcore.domain.enums.StrategyType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Strategies to subscribe at startup.
 *
 * <pre>
 * tradingcore:
 *   strategies:
 *     - id: ma-aapl
 *       type: MA_CROSSOVER
 *       symbol: AAPL
 *       params:
 *         short-period: 5
 *         long-period: 20
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "tradingcore")
@Getter
@Setter
public class StrategyProperties {

    private List<StrategyDefinition> strategies = new ArrayList<>();

    @Getter
    @Setter
    public static class StrategyDefinition {

        private String id;

        private StrategyType type;

        private String symbol;

        /** Whether the strategy is subscribed on startup. */
        private boolean enabled = true;

        /** Type-specific tuning in kebab-case; unknown keys are ignored. */
        private Map<String, String> params = new HashMap<>();
    }
}
