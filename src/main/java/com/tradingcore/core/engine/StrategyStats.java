package com.tradingcore.core.engine;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Per-strategy activity counters as reported by {@link TickDispatcher#getStrategyStats()}.
 */
@Value
@Builder
public class StrategyStats {

    String strategyId;
    String symbol;
    long ticksProcessed;
    long signalsEmitted;
    long errors;
    Instant lastSignalAt;

    /** Completion time of the last tick or poll callback, or the subscribe time before any. */
    Instant lastHeartbeatAt;

    boolean paused;
    String lastError;
}
