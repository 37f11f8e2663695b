package com.tradingcore.broker;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs broker calls off the caller's thread under a Resilience4j time limit.
 *
 * <p>Two policies:
 * <ul>
 *   <li><b>{@link #submit}:</b> order-entry calls (place, cancel, liquidate). Time-limited
 *       ({@code brokerCalls}), never retried: a retried placement could duplicate an order.</li>
 *   <li><b>{@link #query}:</b> read-only calls. Time-limited and retried ({@code brokerQueries}).</li>
 * </ul>
 *
 * <p>A timed-out call completes exceptionally with {@link TimeoutException}; the underlying
 * broker call may still succeed later, which is why callers flag the order for reconciliation
 * instead of treating a timeout as a rejection.
 */
@Component
public class BrokerCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(BrokerCallExecutor.class);

    private final TimeLimiter timeLimiter;
    private final Retry queryRetry;
    private final Executor brokerExecutor;
    private final ScheduledExecutorService timeoutScheduler;

    public BrokerCallExecutor(
            TimeLimiter brokerTimeLimiter,
            Retry brokerQueryRetry,
            @Qualifier("brokerExecutor") Executor brokerExecutor,
            @Qualifier("brokerTimeoutScheduler") ScheduledExecutorService timeoutScheduler) {
        this.timeLimiter = brokerTimeLimiter;
        this.queryRetry = brokerQueryRetry;
        this.brokerExecutor = brokerExecutor;
        this.timeoutScheduler = timeoutScheduler;
    }

    public <T> CompletableFuture<T> submit(String operation, Supplier<T> call) {
        log.debug("Broker call {}", operation);
        return timeLimiter
                .executeCompletionStage(timeoutScheduler, () -> CompletableFuture.supplyAsync(call, brokerExecutor))
                .toCompletableFuture();
    }

    public <T> CompletableFuture<T> query(String operation, Supplier<T> call) {
        return submit(operation, Retry.decorateSupplier(queryRetry, call));
    }

    // ========================
    // FAILURE CLASSIFICATION
    // ========================

    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static boolean isTimeout(Throwable throwable) {
        return unwrap(throwable) instanceof TimeoutException;
    }
}
