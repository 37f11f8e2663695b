package com.tradingcore.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools.
 *
 * <ul>
 *   <li><b>strategyExecutor:</b> runs per-strategy serial lanes</li>
 *   <li><b>orderExecutor:</b> runs per-symbol validate-and-place lanes</li>
 *   <li><b>brokerExecutor:</b> blocking broker calls, bounded by the time limiter</li>
 *   <li><b>eventExecutor:</b> alert delivery and {@code @Async} work</li>
 *   <li><b>haltExecutor:</b> fixed-size pool for the halt's cancel fan-out</li>
 *   <li><b>brokerTimeoutScheduler:</b> time limiter timeouts only</li>
 *   <li><b>taskScheduler:</b> {@code @Scheduled} sweeps and checks</li>
 * </ul>
 *
 * <p>Lane executors use CallerRunsPolicy so that a saturated pool slows the producer down
 * instead of dropping ticks or orders.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${tradingcore.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${tradingcore.async.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${tradingcore.async.queue-capacity:10000}")
    private int queueCapacity;

    @Value("${tradingcore.halt.cancel-parallelism:8}")
    private int cancelParallelism;

    @Bean("strategyExecutor")
    public ThreadPoolTaskExecutor strategyExecutor() {
        return pool("strategy-", corePoolSize, maxPoolSize, queueCapacity);
    }

    @Bean("orderExecutor")
    public ThreadPoolTaskExecutor orderExecutor() {
        return pool("order-", corePoolSize, maxPoolSize, queueCapacity);
    }

    @Bean("brokerExecutor")
    public ThreadPoolTaskExecutor brokerExecutor() {
        return pool("broker-", corePoolSize, maxPoolSize, queueCapacity);
    }

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return pool("event-", 2, 4, 1000);
    }

    @Bean("haltExecutor")
    public ThreadPoolTaskExecutor haltExecutor() {
        return pool("halt-", cancelParallelism, cancelParallelism, Integer.MAX_VALUE);
    }

    @Bean(name = "brokerTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService brokerTimeoutScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "broker-timeout-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("sched-");
        scheduler.setErrorHandler(throwable -> LoggerFactory.getLogger(AsyncConfig.class)
                .error("Scheduled task failed: {}", throwable.getMessage(), throwable));
        return scheduler;
    }

    private ThreadPoolTaskExecutor pool(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
