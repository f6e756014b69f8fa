package com.dealbot.core.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs named job chains whose timing is anchored to timestamps kept in the database rather than to
 * the wall clock of this replica. A restart therefore resumes the existing cadence instead of
 * starting a fresh one.
 *
 * Every fire is a one-shot {@link ScheduledExecutorService#schedule} call; the next one is armed
 * only after the previous run has finished, so a chain never overlaps itself.
 */
@Component
@Slf4j
public class DbAnchoredScheduler {

    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final Map<String, Chain> chains = new ConcurrentHashMap<>();

    @Autowired
    public DbAnchoredScheduler(@Value("${dealbot.scheduling.worker-threads:4}") int workerThreads, Clock clock) {
        this(newExecutor(workerThreads), clock);
    }

    DbAnchoredScheduler(ScheduledExecutorService executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    private static ScheduledExecutorService newExecutor(int workerThreads) {
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(Math.max(1, workerThreads));
        pool.setRemoveOnCancelPolicy(true);
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return pool;
    }

    /**
     * Arms the first run of a chain.
     *
     * @return false if a chain with this name is already armed or running
     */
    public boolean scheduleInitialRun(String jobName, long intervalSeconds, long startOffsetSeconds,
                                      LastRunAccessor lastRunAccessor, Runnable run) {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be positive for job " + jobName);
        }
        Chain chain = new Chain(jobName, intervalSeconds, lastRunAccessor, run);
        if (chains.putIfAbsent(jobName, chain) != null) {
            log.debug("[SCHEDULER] Chain already active | job={}", jobName);
            return false;
        }

        Instant now = clock.instant();
        Instant nextRunAt = now.plusSeconds(Math.max(0, startOffsetSeconds));
        try {
            Optional<Instant> lastRunAt = lastRunAccessor.lastRunAt();
            if (lastRunAt.isPresent()) {
                nextRunAt = lastRunAt.get().plusSeconds(intervalSeconds);
            }
        } catch (Exception e) {
            log.warn("[SCHEDULER] Failed to read last run, using start offset | job={} | offsetSeconds={} | error={}",
                jobName, startOffsetSeconds, e.getMessage());
        }

        synchronized (chain) {
            arm(chain, now, nextRunAt, "initial");
        }
        return true;
    }

    /**
     * Stops a chain. An armed chain goes idle at once; a running chain goes idle after its run.
     *
     * @return false if no chain with this name exists
     */
    public boolean cancel(String jobName) {
        Chain chain = chains.get(jobName);
        if (chain == null) {
            return false;
        }
        synchronized (chain) {
            chain.cancelled = true;
            if (chain.state == ChainState.ARMED) {
                if (chain.future != null) {
                    chain.future.cancel(false);
                }
                chain.state = ChainState.IDLE;
                chains.remove(jobName, chain);
                log.info("[SCHEDULER] Chain cancelled | job={}", jobName);
            } else if (chain.state == ChainState.RUNNING) {
                log.info("[SCHEDULER] Chain cancelled, stopping after current run | job={}", jobName);
            }
        }
        return true;
    }

    public ChainState getState(String jobName) {
        Chain chain = chains.get(jobName);
        return chain != null ? chain.state : ChainState.IDLE;
    }

    public Optional<Instant> getNextRunAt(String jobName) {
        Chain chain = chains.get(jobName);
        return chain != null ? Optional.ofNullable(chain.nextRunAt) : Optional.empty();
    }

    public Set<String> getJobNames() {
        return new TreeSet<>(chains.keySet());
    }

    /**
     * Moves the next run of a chain that is currently running to {@code resumeAt}, in place of the
     * usual anchor plus interval. Called from inside the run itself.
     *
     * @return false if the chain is not running
     */
    public boolean deferNextRun(String jobName, Instant resumeAt) {
        Chain chain = chains.get(jobName);
        if (chain == null) {
            return false;
        }
        synchronized (chain) {
            if (chain.state != ChainState.RUNNING) {
                return false;
            }
            chain.deferredUntil = resumeAt;
        }
        return true;
    }

    /**
     * Cancels every chain, then waits up to {@code grace} for runs in progress to return before
     * interrupting them. Safe to call more than once.
     *
     * @return true if all runs finished within the grace period
     */
    public boolean shutdown(Duration grace) {
        log.info("[SCHEDULER] Shutting down | chains={} | graceSeconds={}", chains.size(), grace.toSeconds());
        for (String jobName : getJobNames()) {
            cancel(jobName);
        }
        executor.shutdown();
        try {
            if (executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("[SCHEDULER] Runs still active after grace period, interrupting | graceSeconds={}",
                grace.toSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor.shutdownNow();
        return false;
    }

    private void fire(Chain chain) {
        synchronized (chain) {
            if (chain.cancelled || chain.state != ChainState.ARMED) {
                return;
            }
            chain.state = ChainState.RUNNING;
        }

        Instant startedAt = clock.instant();
        log.debug("[SCHEDULER] Run started | job={} | startedAt={}", chain.jobName, startedAt);
        try {
            chain.run.run();
        } catch (RuntimeException e) {
            log.error("[SCHEDULER] Run failed | job={} | error={}", chain.jobName, e.getMessage(), e);
        }
        Instant completedAt = clock.instant();

        Instant anchor = completedAt;
        try {
            Optional<Instant> lastRunAt = chain.lastRunAccessor.lastRunAt();
            if (lastRunAt.isPresent() && !lastRunAt.get().isBefore(startedAt)) {
                anchor = lastRunAt.get();
            }
        } catch (Exception e) {
            log.warn("[SCHEDULER] Failed to read last run, anchoring to completion | job={} | error={}",
                chain.jobName, e.getMessage());
        }

        synchronized (chain) {
            if (chain.cancelled) {
                chain.state = ChainState.IDLE;
                chains.remove(chain.jobName, chain);
                log.info("[SCHEDULER] Chain stopped after run | job={}", chain.jobName);
                return;
            }
            Instant deferredUntil = chain.deferredUntil;
            chain.deferredUntil = null;
            if (deferredUntil != null) {
                arm(chain, clock.instant(), deferredUntil, "deferred");
            } else {
                arm(chain, clock.instant(), anchor.plusSeconds(chain.intervalSeconds), "post-run");
            }
        }
    }

    private void arm(Chain chain, Instant now, Instant nextRunAt, String reason) {
        Duration delay = delayUntil(now, nextRunAt);
        chain.nextRunAt = now.plus(delay);
        chain.state = ChainState.ARMED;
        log.info("[SCHEDULER] Next run armed | job={} | reason={} | delaySeconds={} | nextRunAt={}",
            chain.jobName, reason, delay.toSeconds(), chain.nextRunAt);
        if (executor.isShutdown()) {
            chain.state = ChainState.IDLE;
            chains.remove(chain.jobName, chain);
            return;
        }
        chain.future = executor.schedule(() -> fire(chain), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Time until {@code nextRunAt}, or zero when it has already passed. */
    static Duration delayUntil(Instant now, Instant nextRunAt) {
        Duration delay = Duration.between(now, nextRunAt);
        return delay.isNegative() ? Duration.ZERO : delay;
    }

    private static final class Chain {
        private final String jobName;
        private final long intervalSeconds;
        private final LastRunAccessor lastRunAccessor;
        private final Runnable run;
        private volatile ChainState state = ChainState.IDLE;
        private volatile Instant nextRunAt;
        private Instant deferredUntil;
        private ScheduledFuture<?> future;
        private boolean cancelled;

        private Chain(String jobName, long intervalSeconds, LastRunAccessor lastRunAccessor, Runnable run) {
            this.jobName = jobName;
            this.intervalSeconds = intervalSeconds;
            this.lastRunAccessor = lastRunAccessor;
            this.run = run;
        }
    }
}
