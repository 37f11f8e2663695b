package com.tradingcore.core.concurrent;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared executor.
 *
 * <p>At most one drain task per lane is queued on the delegate at any time, so tasks of one lane
 * never overlap while different lanes run in parallel on the same pool. A task that throws is
 * logged and does not stop the lane.
 */
public class SerialLane implements Executor {

    private static final Logger log = LoggerFactory.getLogger(SerialLane.class);

    private final String name;
    private final Executor delegate;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public SerialLane(String name, Executor delegate) {
        this.name = name;
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable task) {
        tasks.add(task);
        scheduleDrain();
    }

    public int pendingTasks() {
        return tasks.size();
    }

    public String getName() {
        return name;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            delegate.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.error("Lane {} could not be scheduled, {} tasks waiting", name, tasks.size());
            throw e;
        }
    }

    private void drain() {
        try {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Task on lane {} failed: {}", name, e.getMessage(), e);
                }
            }
        } finally {
            draining.set(false);
        }
        // A task may have been added after the last poll but before the flag was cleared
        if (!tasks.isEmpty()) {
            scheduleDrain();
        }
    }
}
