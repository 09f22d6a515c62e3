package com.outreach.scoring.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Debounces recomputation: a computation runs once the quiescence window has passed since the
 * last {@link #schedule} call. Scheduling again cancels a pending run. A run superseded while
 * it executes still finishes, but its result is discarded.
 *
 * States: IDLE -> SCHEDULED -> RUNNING -> IDLE (or SCHEDULED when a newer edit is pending).
 * One single-thread timer per instance; at most one pending run at a time.
 */
public class RecomputeScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RecomputeScheduler.class);

    private static final AtomicInteger INSTANCES = new AtomicInteger();

    public enum State {
        IDLE,
        SCHEDULED,
        RUNNING
    }

    private final Duration window;
    private final ScheduledExecutorService timer;
    private final Object lock = new Object();

    private State state = State.IDLE;
    private boolean running;
    private ScheduledFuture<?> pending;
    private long generation;

    public RecomputeScheduler(Duration window) {
        this.window = window;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "recompute-debounce-" + INSTANCES.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule a recompute after the quiescence window, replacing any pending one.
     * {@code publisher} only receives the result if no newer schedule or cancel happened meanwhile.
     */
    public <T> void schedule(Supplier<T> computation, Consumer<T> publisher) {
        synchronized (lock) {
            long scheduledGeneration = ++generation;
            if (pending != null) {
                pending.cancel(false);
            }
            pending = timer.schedule(() -> run(scheduledGeneration, computation, publisher),
                    window.toMillis(), TimeUnit.MILLISECONDS);
            if (!running) {
                state = State.SCHEDULED;
            }
        }
    }

    /**
     * Drop the pending recompute, if any, and discard the result of one in progress.
     */
    public void cancel() {
        synchronized (lock) {
            generation++;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            state = running ? State.RUNNING : State.IDLE;
        }
    }

    public State getState() {
        synchronized (lock) {
            return state;
        }
    }

    private <T> void run(long scheduledGeneration, Supplier<T> computation, Consumer<T> publisher) {
        synchronized (lock) {
            if (scheduledGeneration != generation) {
                return;
            }
            pending = null;
            running = true;
            state = State.RUNNING;
        }
        try {
            T result = computation.get();
            synchronized (lock) {
                if (scheduledGeneration == generation) {
                    publisher.accept(result);
                } else {
                    log.debug("Discarding stale recompute result (generation {} < {})", scheduledGeneration, generation);
                }
            }
        } catch (RuntimeException e) {
            log.error("Recompute failed: {}", e.getMessage(), e);
        } finally {
            synchronized (lock) {
                running = false;
                state = pending != null ? State.SCHEDULED : State.IDLE;
            }
        }
    }

    @Override
    public void close() {
        cancel();
        timer.shutdownNow();
    }
}
