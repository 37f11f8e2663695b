package com.tradingcore.unit.concurrent;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradingcore.core.concurrent.KeyedSerialExecutor;
import com.tradingcore.core.concurrent.SerialLane;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SerialLaneTest {

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Nested
    @DisplayName("Single lane")
    class SingleLane {

        @Test
        @DisplayName("Tasks run in submission order and never overlap")
        void tasksRunInOrderWithoutOverlap() throws Exception {
            SerialLane lane = new SerialLane("test", pool);
            List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxRunning = new AtomicInteger();
            CountDownLatch done = new CountDownLatch(200);

            for (int i = 0; i < 200; i++) {
                int n = i;
                lane.execute(() -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    seen.add(n);
                    running.decrementAndGet();
                    done.countDown();
                });
            }

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(maxRunning.get()).isEqualTo(1);
            assertThat(seen).hasSize(200);
            for (int i = 0; i < 200; i++) {
                assertThat(seen.get(i)).isEqualTo(i);
            }
        }

        @Test
        @DisplayName("A failing task does not stop the lane")
        void failingTaskDoesNotStopLane() {
            SerialLane lane = new SerialLane("direct", Runnable::run);
            List<String> seen = new ArrayList<>();

            lane.execute(() -> seen.add("first"));
            lane.execute(() -> {
                throw new IllegalStateException("boom");
            });
            lane.execute(() -> seen.add("third"));

            assertThat(seen).containsExactly("first", "third");
            assertThat(lane.pendingTasks()).isZero();
        }

        @Test
        @DisplayName("Task submitted from inside a task runs after it on a direct executor")
        void reentrantSubmissionIsQueued() {
            SerialLane lane = new SerialLane("direct", Runnable::run);
            List<String> seen = new ArrayList<>();

            lane.execute(() -> {
                lane.execute(() -> seen.add("inner"));
                seen.add("outer");
            });

            assertThat(seen).containsExactly("outer", "inner");
        }
    }

    @Nested
    @DisplayName("Keyed lanes")
    class KeyedLanes {

        @Test
        @DisplayName("Different keys run in parallel")
        void differentKeysRunInParallel() throws Exception {
            KeyedSerialExecutor lanes = new KeyedSerialExecutor("test", pool);
            CountDownLatch bothStarted = new CountDownLatch(2);
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch finished = new CountDownLatch(2);

            for (String key : List.of("A", "B")) {
                lanes.execute(key, () -> {
                    bothStarted.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    finished.countDown();
                });
            }

            assertThat(bothStarted.await(5, TimeUnit.SECONDS)).isTrue();
            release.countDown();
            assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(lanes.laneCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Removing a key drops its lane")
        void removeDropsLane() {
            KeyedSerialExecutor lanes = new KeyedSerialExecutor("test", Runnable::run);
            lanes.execute("A", () -> {});

            lanes.remove("A");

            assertThat(lanes.laneCount()).isZero();
        }
    }
}
