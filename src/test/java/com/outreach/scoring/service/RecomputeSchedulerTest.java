package com.outreach.scoring.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RecomputeSchedulerTest {

    private RecomputeScheduler scheduler;
    private List<String> published;

    @BeforeEach
    void setUp() {
        scheduler = new RecomputeScheduler(Duration.ofMillis(100));
        published = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void schedule_runsAfterWindowAndReturnsToIdle() throws Exception {
        CountDownLatch done = new CountDownLatch(1);

        scheduler.schedule(() -> "result", value -> {
            published.add(value);
            done.countDown();
        });

        assertThat(scheduler.getState()).isEqualTo(RecomputeScheduler.State.SCHEDULED);
        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(published).containsExactly("result");
        awaitState(RecomputeScheduler.State.IDLE);
    }

    @Test
    void schedule_burstOfEdits_onlyLastComputed() throws Exception {
        AtomicInteger computations = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(1);

        for (int i = 1; i <= 5; i++) {
            String value = "edit-" + i;
            scheduler.schedule(() -> {
                computations.incrementAndGet();
                return value;
            }, v -> {
                published.add(v);
                done.countDown();
            });
        }

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(200);
        assertThat(published).containsExactly("edit-5");
        assertThat(computations.get()).isEqualTo(1);
    }

    @Test
    void cancel_pendingRunNeverExecutes() throws Exception {
        AtomicInteger computations = new AtomicInteger();
        scheduler.schedule(() -> computations.incrementAndGet(), v -> published.add("ran"));

        scheduler.cancel();
        Thread.sleep(300);

        assertThat(computations.get()).isZero();
        assertThat(published).isEmpty();
        assertThat(scheduler.getState()).isEqualTo(RecomputeScheduler.State.IDLE);
    }

    @Test
    void schedule_whileRunning_staleResultDiscarded() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);

        scheduler.schedule(() -> {
            started.countDown();
            awaitQuietly(release);
            return "stale";
        }, published::add);
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.getState()).isEqualTo(RecomputeScheduler.State.RUNNING);

        scheduler.schedule(() -> "fresh", value -> {
            published.add(value);
            done.countDown();
        });
        release.countDown();

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(published).containsExactly("fresh");
    }

    @Test
    void schedule_afterFailedComputation_stillWorks() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        scheduler.<String>schedule(() -> {
            throw new IllegalStateException("boom");
        }, published::add);
        Thread.sleep(250);

        scheduler.schedule(() -> "recovered", value -> {
            published.add(value);
            done.countDown();
        });

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(published).containsExactly("recovered");
    }

    private void awaitState(RecomputeScheduler.State expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (scheduler.getState() != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertThat(scheduler.getState()).isEqualTo(expected);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
