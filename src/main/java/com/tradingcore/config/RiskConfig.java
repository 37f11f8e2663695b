package com.tradingcore.config;

import com.tradingcore.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the startup {@link RiskLimits} from application.yml.
 *
 * <p>A limit set to an empty value disables its check. The limits can be replaced at runtime
 * through {@code RiskLimitsStore}.
 *
 * <p>Properties prefix: {@code tradingcore.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${tradingcore.risk.max-drawdown-percent:10}") BigDecimal maxDrawdownPercent,
            @Value("${tradingcore.risk.max-position-value:50000}") BigDecimal maxPositionValue,
            @Value("${tradingcore.risk.max-daily-loss:5000}") BigDecimal maxDailyLoss,
            @Value("${tradingcore.risk.max-order-value:10000}") BigDecimal maxOrderValue,
            @Value("${tradingcore.risk.stop-loss-percent:5}") BigDecimal stopLossPercent,
            @Value("${tradingcore.risk.emergency-stop-enabled:true}") boolean emergencyStopEnabled,
            @Value("${tradingcore.risk.breaker.failure-threshold:3}") int breakerFailureThreshold,
            @Value("${tradingcore.risk.breaker.failure-window:60s}") Duration breakerFailureWindow,
            @Value("${tradingcore.risk.breaker.cooldown:300s}") Duration breakerCooldown) {
        return RiskLimits.builder()
                .maxDrawdownPercent(maxDrawdownPercent)
                .maxPositionValue(maxPositionValue)
                .maxDailyLoss(maxDailyLoss)
                .maxOrderValue(maxOrderValue)
                .stopLossPercent(stopLossPercent)
                .emergencyStopEnabled(emergencyStopEnabled)
                .breakerFailureThreshold(breakerFailureThreshold)
                .breakerFailureWindow(breakerFailureWindow)
                .breakerCooldown(breakerCooldown)
                .build();
    }
}
