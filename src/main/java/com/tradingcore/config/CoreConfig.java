package com.tradingcore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingcore.broker.SimulatedBrokerGateway;
import com.tradingcore.journal.EventJournal;
import com.tradingcore.journal.InMemoryEventJournal;
import com.tradingcore.journal.JsonLinesEventJournal;
import com.tradingcore.notification.AlertNotifier;
import com.tradingcore.notification.LoggingAlertNotifier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Collaborator wiring: clock, broker resilience policies, default broker, journal and alerting.
 *
 * <p>{@code tradingcore.trading-mode=PAPER} (the default) installs the simulated broker. In LIVE
 * mode a {@code BrokerGateway} bean must be provided by a broker adapter.
 */
@Configuration
public class CoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TimeLimiter brokerTimeLimiter(TimeLimiterRegistry timeLimiterRegistry) {
        return timeLimiterRegistry.timeLimiter("brokerCalls");
    }

    @Bean
    public Retry brokerQueryRetry(RetryRegistry retryRegistry) {
        return retryRegistry.retry("brokerQueries");
    }

    @Bean
    @ConditionalOnProperty(name = "tradingcore.trading-mode", havingValue = "PAPER", matchIfMissing = true)
    public SimulatedBrokerGateway simulatedBrokerGateway(ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        log.info("PAPER mode: orders go to the simulated broker");
        return new SimulatedBrokerGateway(applicationEventPublisher, clock);
    }

    @Bean
    public EventJournal eventJournal(
            ObjectMapper objectMapper,
            @Value("${tradingcore.journal.type:file}") String journalType,
            @Value("${tradingcore.journal.path:data/journal/orders.jsonl}") String journalPath) {
        if ("memory".equalsIgnoreCase(journalType)) {
            log.warn("Journal is in memory: order state will not survive a restart");
            return new InMemoryEventJournal();
        }
        return new JsonLinesEventJournal(Path.of(journalPath), objectMapper.copy());
    }

    @Bean
    @ConditionalOnMissingBean(AlertNotifier.class)
    public AlertNotifier alertNotifier() {
        return new LoggingAlertNotifier();
    }
}
