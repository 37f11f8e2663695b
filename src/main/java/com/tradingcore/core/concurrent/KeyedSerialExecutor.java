package com.tradingcore.core.concurrent;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * One {@link SerialLane} per key over a shared executor: work for the same key is serialized,
 * work for different keys runs in parallel.
 */
public class KeyedSerialExecutor {

    private final String name;
    private final Executor delegate;
    private final Map<String, SerialLane> lanes = new ConcurrentHashMap<>();

    public KeyedSerialExecutor(String name, Executor delegate) {
        this.name = name;
        this.delegate = delegate;
    }

    public void execute(String key, Runnable task) {
        laneFor(key).execute(task);
    }

    public SerialLane laneFor(String key) {
        return lanes.computeIfAbsent(key, k -> new SerialLane(name + ":" + k, delegate));
    }

    /** Drops the lane for a key. Tasks already queued on it still run. */
    public void remove(String key) {
        lanes.remove(key);
    }

    public int laneCount() {
        return lanes.size();
    }
}
