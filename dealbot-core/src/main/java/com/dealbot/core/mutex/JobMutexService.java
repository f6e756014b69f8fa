package com.dealbot.core.mutex;

import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.JobType;
import com.dealbot.common.util.LogFormat;
import com.dealbot.data.repository.JobMutexRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Cross-replica mutual exclusion per storage provider, backed by the {@code job_mutex} table.
 *
 * A lease is live while its row has been renewed within the liveness timeout. Holders renew on a
 * heartbeat; a holder that dies stops renewing and its row becomes claimable by the next acquire.
 */
@Service
@Slf4j
public class JobMutexService {

    private final JobMutexRepository repository;
    private final Clock clock;
    private final Duration livenessTimeout;
    private final Duration renewInterval;
    private final String hostname;
    private final ScheduledExecutorService heartbeatExecutor;

    @Autowired
    public JobMutexService(
            JobMutexRepository repository,
            Clock clock,
            @Value("${dealbot.mutex.timeout-seconds:900}") long timeoutSeconds,
            @Value("${dealbot.mutex.renew-interval-seconds:300}") long renewIntervalSeconds,
            @Value("${dealbot.mutex.hostname:}") String hostname) {
        this(repository, clock, Duration.ofSeconds(timeoutSeconds), Duration.ofSeconds(renewIntervalSeconds),
            hostname, Executors.newSingleThreadScheduledExecutor());
    }

    JobMutexService(JobMutexRepository repository, Clock clock, Duration livenessTimeout, Duration renewInterval,
                    String hostname, ScheduledExecutorService heartbeatExecutor) {
        if (livenessTimeout.isZero() || livenessTimeout.isNegative() || renewInterval.isZero() || renewInterval.isNegative()) {
            throw new IllegalStateException("dealbot.mutex timeout and renew interval must be positive");
        }
        if (renewInterval.compareTo(livenessTimeout) >= 0) {
            throw new IllegalStateException("dealbot.mutex.renew-interval-seconds (" + renewInterval.toSeconds()
                + ") must be shorter than dealbot.mutex.timeout-seconds (" + livenessTimeout.toSeconds() + ")");
        }
        this.repository = repository;
        this.clock = clock;
        this.livenessTimeout = livenessTimeout;
        this.renewInterval = renewInterval;
        this.hostname = hostname == null || hostname.isBlank() ? resolveHostname() : hostname;
        this.heartbeatExecutor = heartbeatExecutor;
        log.info("[MUTEX] Initialized | hostname={} | timeoutSeconds={} | renewIntervalSeconds={}",
            this.hostname, livenessTimeout.toSeconds(), renewInterval.toSeconds());
    }

    /**
     * Claims the provider in one atomic statement.
     *
     * @return the lease, or empty if another live holder owns the provider
     */
    public Optional<MutexLease> tryAcquire(JobType jobType, String spAddress) {
        UUID jobId = UUID.randomUUID();
        int updated = repository.tryAcquire(jobType.name(), spAddress, jobId, hostname, livenessTimeout.toSeconds());
        if (updated == 0) {
            log.debug("[MUTEX] Provider busy | jobType={} | spAddress={}", jobType.getValue(), LogFormat.abbreviate(spAddress));
            return Optional.empty();
        }
        MutexLease lease = new MutexLease(jobType, spAddress, jobId, hostname, clock.instant());
        log.debug("[MUTEX] Acquired | jobType={} | spAddress={} | jobId={}",
            jobType.getValue(), LogFormat.abbreviate(spAddress), jobId);
        return Optional.of(lease);
    }

    /**
     * Deletes the row only if it still carries this lease's job id.
     */
    public boolean release(MutexLease lease) {
        boolean released = repository.release(lease.jobId()) > 0;
        if (!released) {
            log.warn("[MUTEX] Lease already reclaimed on release | jobType={} | spAddress={} | jobId={}",
                lease.jobType().getValue(), LogFormat.abbreviate(lease.spAddress()), lease.jobId());
        }
        return released;
    }

    /**
     * @return false if the lease was reclaimed by another holder
     */
    public boolean renew(MutexLease lease) {
        return repository.renew(lease.jobId()) > 0;
    }

    /**
     * Runs {@code work} while holding the provider's lease. The signal handed to the work fires when
     * the parent fires or when a heartbeat finds the lease gone.
     *
     * @return false if the provider was busy and the work did not run
     */
    public boolean runExclusively(JobType jobType, String spAddress, CancellationSignal parent,
                                  Consumer<CancellationSignal> work) {
        Optional<MutexLease> acquired = tryAcquire(jobType, spAddress);
        if (acquired.isEmpty()) {
            log.info("[MUTEX] Skipping run, provider locked by another job | jobType={} | spAddress={}",
                jobType.getValue(), LogFormat.abbreviate(spAddress));
            return false;
        }

        MutexLease lease = acquired.get();
        CancellationSignal signal = parent.child();
        ScheduledFuture<?> heartbeat = heartbeatExecutor.scheduleAtFixedRate(
            () -> heartbeat(lease, signal),
            renewInterval.toMillis(), renewInterval.toMillis(), TimeUnit.MILLISECONDS);
        try {
            work.accept(signal);
            return true;
        } finally {
            heartbeat.cancel(false);
            signal.close();
            try {
                release(lease);
            } catch (RuntimeException e) {
                log.error("[MUTEX] Release failed, row expires after timeout | jobId={} | error={}",
                    lease.jobId(), e.getMessage());
            }
        }
    }

    /**
     * One heartbeat tick. A lost lease cancels the work; a failed renew is retried on the next tick.
     */
    void heartbeat(MutexLease lease, CancellationSignal signal) {
        try {
            if (!renew(lease)) {
                log.warn("[MUTEX] Lease lost | jobType={} | spAddress={} | jobId={}",
                    lease.jobType().getValue(), LogFormat.abbreviate(lease.spAddress()), lease.jobId());
                signal.cancel("mutex lease lost");
            }
        } catch (RuntimeException e) {
            log.warn("[MUTEX] Renew failed | jobId={} | error={}", lease.jobId(), e.getMessage());
        }
    }

    public String getHostname() {
        return hostname;
    }

    /** Stops lease renewal. Runs after the scheduler has drained, see {@code ProbeOrchestrator#stop}. */
    public void shutdown() {
        heartbeatExecutor.shutdownNow();
    }

    private static String resolveHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fromEnv = System.getenv("HOSTNAME");
            log.warn("[MUTEX] Could not resolve local hostname | fallback={} | error={}", fromEnv, e.getMessage());
            return fromEnv != null && !fromEnv.isBlank() ? fromEnv : "unknown-host";
        }
    }
}
