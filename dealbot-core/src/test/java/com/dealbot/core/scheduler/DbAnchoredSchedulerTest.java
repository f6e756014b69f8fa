package com.dealbot.core.scheduler;

import com.dealbot.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class DbAnchoredSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private ScheduledFuture<?> future;
    private final List<Runnable> tasks = new ArrayList<>();
    private final List<Long> delaysMs = new ArrayList<>();
    private DbAnchoredScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        future = mock(ScheduledFuture.class);
        ScheduledExecutorService executor = mock(ScheduledExecutorService.class);
        doAnswer(inv -> {
            tasks.add(inv.getArgument(0));
            delaysMs.add(TimeUnit.MILLISECONDS.convert(inv.getArgument(1, Long.class), inv.getArgument(2)));
            return future;
        }).when(executor).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        scheduler = new DbAnchoredScheduler(executor, clock);
    }

    private Runnable lastTask() {
        return tasks.get(tasks.size() - 1);
    }

    private long lastDelaySeconds() {
        return TimeUnit.MILLISECONDS.toSeconds(delaysMs.get(delaysMs.size() - 1));
    }

    @Test
    @DisplayName("A run five minutes ago with a 600s interval fires in 300s")
    void anchorsToLastRun() {
        scheduler.scheduleInitialRun("deal:f01", 600, 0,
            () -> Optional.of(NOW.minus(Duration.ofMinutes(5))), () -> { });

        assertThat(lastDelaySeconds()).isEqualTo(300);
        assertThat(scheduler.getState("deal:f01")).isEqualTo(ChainState.ARMED);
        assertThat(scheduler.getNextRunAt("deal:f01")).contains(NOW.plusSeconds(300));
    }

    @Test
    @DisplayName("No prior run uses the start offset")
    void usesStartOffsetWithoutHistory() {
        scheduler.scheduleInitialRun("retrieval:f01", 600, 120, Optional::empty, () -> { });

        assertThat(lastDelaySeconds()).isEqualTo(120);
    }

    @Test
    @DisplayName("An overdue anchor fires immediately")
    void overdueFiresImmediately() {
        scheduler.scheduleInitialRun("deal:f01", 60, 0,
            () -> Optional.of(NOW.minus(Duration.ofHours(3))), () -> { });

        assertThat(delaysMs).containsExactly(0L);
    }

    @Test
    @DisplayName("A failing accessor falls back to the start offset")
    void accessorFailureUsesOffset() {
        scheduler.scheduleInitialRun("deal:f01", 600, 45, () -> {
            throw new IllegalStateException("db down");
        }, () -> { });

        assertThat(lastDelaySeconds()).isEqualTo(45);
    }

    @Test
    @DisplayName("Negative start offsets are clamped to zero")
    void negativeOffsetClamped() {
        scheduler.scheduleInitialRun("deal:f01", 600, -30, Optional::empty, () -> { });

        assertThat(delaysMs).containsExactly(0L);
    }

    @Test
    @DisplayName("After a run the recorded timestamp is the anchor when it is not older than the run")
    void postRunAnchorsToRecordedTimestamp() {
        AtomicReference<Instant> lastRun = new AtomicReference<>();
        Instant runStart = NOW.plusSeconds(120);
        scheduler.scheduleInitialRun("deal:f01", 600, 120, () -> Optional.ofNullable(lastRun.get()), () -> {
            lastRun.set(runStart);
            clock.advance(Duration.ofSeconds(90));
        });

        clock.set(runStart);
        lastTask().run();

        // completed at runStart + 90s; anchor is runStart, so the next run is 510s away
        assertThat(lastDelaySeconds()).isEqualTo(510);
        assertThat(scheduler.getNextRunAt("deal:f01")).contains(runStart.plusSeconds(600));
    }

    @Test
    @DisplayName("A stale recorded timestamp falls back to the completion time")
    void postRunIgnoresStaleTimestamp() {
        Instant stale = NOW.minus(Duration.ofDays(1));
        scheduler.scheduleInitialRun("deal:f01", 600, 0, () -> Optional.of(stale),
            () -> clock.advance(Duration.ofSeconds(30)));
        assertThat(delaysMs).containsExactly(0L);

        lastTask().run();

        assertThat(lastDelaySeconds()).isEqualTo(600);
        assertThat(scheduler.getNextRunAt("deal:f01")).contains(NOW.plusSeconds(630));
    }

    @Test
    @DisplayName("A failing run is logged and rescheduled on the normal cadence")
    void failingRunIsRescheduled() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.scheduleInitialRun("deal:f01", 300, 0, Optional::empty, () -> {
            runs.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        lastTask().run();

        assertThat(runs).hasValue(1);
        assertThat(tasks).hasSize(2);
        assertThat(lastDelaySeconds()).isEqualTo(300);
        assertThat(scheduler.getState("deal:f01")).isEqualTo(ChainState.ARMED);
    }

    @Test
    @DisplayName("Cancelling an armed chain makes it idle and cancels the pending fire")
    void cancelArmedChain() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.scheduleInitialRun("deal:f01", 300, 10, Optional::empty, runs::incrementAndGet);
        Runnable pending = lastTask();

        assertThat(scheduler.cancel("deal:f01")).isTrue();
        pending.run();

        verify(future).cancel(false);
        assertThat(runs).hasValue(0);
        assertThat(scheduler.getState("deal:f01")).isEqualTo(ChainState.IDLE);
        assertThat(scheduler.getJobNames()).isEmpty();
    }

    @Test
    @DisplayName("A chain cancelled while running goes idle after the run")
    void cancelWhileRunning() {
        AtomicReference<ChainState> stateDuringRun = new AtomicReference<>();
        scheduler.scheduleInitialRun("deal:f01", 300, 0, Optional::empty, () -> {
            stateDuringRun.set(scheduler.getState("deal:f01"));
            scheduler.cancel("deal:f01");
        });

        lastTask().run();

        assertThat(stateDuringRun).hasValue(ChainState.RUNNING);
        assertThat(tasks).hasSize(1);
        assertThat(scheduler.getState("deal:f01")).isEqualTo(ChainState.IDLE);
    }

    @Test
    @DisplayName("A second initial run for an active chain is ignored")
    void duplicateChainIgnored() {
        assertThat(scheduler.scheduleInitialRun("deal:f01", 300, 0, Optional::empty, () -> { })).isTrue();
        assertThat(scheduler.scheduleInitialRun("deal:f01", 300, 0, Optional::empty, () -> { })).isFalse();
        assertThat(tasks).hasSize(1);
    }

    @Test
    @DisplayName("A run may move its chain's next fire to a later instant")
    void deferredRunArmsAtResumeTime() {
        Instant resumeAt = NOW.plus(Duration.ofMinutes(15));
        scheduler.scheduleInitialRun("deal:f01", 3600, 0, Optional::empty,
            () -> assertThat(scheduler.deferNextRun("deal:f01", resumeAt)).isTrue());

        lastTask().run();

        assertThat(lastDelaySeconds()).isEqualTo(900);
        assertThat(scheduler.getNextRunAt("deal:f01")).contains(resumeAt);

        lastTask().run();
        assertThat(lastDelaySeconds()).isEqualTo(3600);
    }

    @Test
    @DisplayName("Deferring a chain that is not running has no effect")
    void deferOutsideRunIgnored() {
        scheduler.scheduleInitialRun("deal:f01", 300, 10, Optional::empty, () -> { });

        assertThat(scheduler.deferNextRun("deal:f01", NOW.plusSeconds(9999))).isFalse();
        assertThat(scheduler.deferNextRun("deal:f99", NOW)).isFalse();
        assertThat(scheduler.getNextRunAt("deal:f01")).contains(NOW.plusSeconds(10));
    }

    @Test
    @DisplayName("Shutdown waits for a run in progress to return")
    void shutdownDrainsRunningWork() {
        DbAnchoredScheduler real = new DbAnchoredScheduler(1, Clock.systemUTC());
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean finished = new AtomicBoolean();
        real.scheduleInitialRun("deal:f01", 600, 0, Optional::empty, () -> {
            started.countDown();
            try {
                Thread.sleep(200);
                finished.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        await().atMost(5, TimeUnit.SECONDS).until(() -> started.getCount() == 0);

        assertThat(real.shutdown(Duration.ofSeconds(5))).isTrue();

        assertThat(finished).isTrue();
        assertThat(real.getJobNames()).isEmpty();
    }

    @Test
    @DisplayName("Shutdown interrupts runs that outlast the grace period")
    void shutdownInterruptsAfterGrace() {
        DbAnchoredScheduler real = new DbAnchoredScheduler(1, Clock.systemUTC());
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        real.scheduleInitialRun("deal:f01", 600, 0, Optional::empty, () -> {
            started.countDown();
            try {
                new CountDownLatch(1).await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        await().atMost(5, TimeUnit.SECONDS).until(() -> started.getCount() == 0);

        assertThat(real.shutdown(Duration.ofMillis(100))).isFalse();

        await().atMost(5, TimeUnit.SECONDS).untilTrue(interrupted);
    }
}
