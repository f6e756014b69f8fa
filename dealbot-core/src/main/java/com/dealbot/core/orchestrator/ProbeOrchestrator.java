package com.dealbot.core.orchestrator;

import com.dealbot.client.provider.ProviderInfo;
import com.dealbot.client.wallet.WalletAllowanceService;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.cancel.CancelledException;
import com.dealbot.common.constants.JobType;
import com.dealbot.common.util.LogFormat;
import com.dealbot.core.deal.DealService;
import com.dealbot.core.jobs.JobScheduleService;
import com.dealbot.core.jobs.ProviderSyncResult;
import com.dealbot.core.mutex.JobMutexService;
import com.dealbot.core.retrieval.RetrievalService;
import com.dealbot.core.scheduler.DbAnchoredScheduler;
import com.dealbot.core.scheduler.MaintenanceWindow;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the probe loop together: one scheduler chain per (job type, provider), each fire running a
 * deal or retrieval probe under the provider's job mutex.
 */
@Service
@Slf4j
public class ProbeOrchestrator {

    static final Duration MIN_RETRIEVAL_TIMEOUT = Duration.ofSeconds(10);
    static final Duration MIN_DEAL_JOB_TIMEOUT = Duration.ofSeconds(120);

    private final WalletAllowanceService walletAllowanceService;
    private final JobScheduleService jobScheduleService;
    private final DbAnchoredScheduler scheduler;
    private final JobMutexService jobMutexService;
    private final DealService dealService;
    private final RetrievalService retrievalService;
    private final MaintenanceWindow maintenanceWindow;
    private final Clock clock;
    private final Duration retrievalTimeout;
    private final Duration dealJobTimeout;
    private final Duration shutdownGrace;
    private final CancellationSignal rootSignal = CancellationSignal.create();
    private final AtomicBoolean started = new AtomicBoolean();

    public ProbeOrchestrator(
            WalletAllowanceService walletAllowanceService,
            JobScheduleService jobScheduleService,
            DbAnchoredScheduler scheduler,
            JobMutexService jobMutexService,
            DealService dealService,
            RetrievalService retrievalService,
            MaintenanceWindow maintenanceWindow,
            Clock clock,
            @Value("${dealbot.http.retrieval-timeout-buffer-ms:60000}") long retrievalTimeoutBufferMs,
            @Value("${dealbot.scheduling.deal-job-timeout-seconds:360}") long dealJobTimeoutSeconds,
            @Value("${dealbot.scheduling.shutdown-grace-seconds:30}") long shutdownGraceSeconds) {
        this.walletAllowanceService = walletAllowanceService;
        this.jobScheduleService = jobScheduleService;
        this.scheduler = scheduler;
        this.jobMutexService = jobMutexService;
        this.dealService = dealService;
        this.retrievalService = retrievalService;
        this.maintenanceWindow = maintenanceWindow;
        this.clock = clock;
        this.retrievalTimeout = retrievalTimeout(jobScheduleService.getIntervalSeconds(JobType.RETRIEVAL), retrievalTimeoutBufferMs);
        this.dealJobTimeout = dealJobTimeout(dealJobTimeoutSeconds);
        this.shutdownGrace = Duration.ofSeconds(Math.max(0, shutdownGraceSeconds));
    }

    /** Deal runs get at least two minutes. */
    static Duration dealJobTimeout(long configuredSeconds) {
        Duration timeout = Duration.ofSeconds(configuredSeconds);
        return timeout.compareTo(MIN_DEAL_JOB_TIMEOUT) < 0 ? MIN_DEAL_JOB_TIMEOUT : timeout;
    }

    /**
     * Retrieval batches stop a buffer before the next run is due, but never get less than ten seconds.
     */
    static Duration retrievalTimeout(long retrievalIntervalSeconds, long bufferMs) {
        Duration timeout = Duration.ofSeconds(retrievalIntervalSeconds).minusMillis(bufferMs);
        return timeout.compareTo(MIN_RETRIEVAL_TIMEOUT) < 0 ? MIN_RETRIEVAL_TIMEOUT : timeout;
    }

    static String jobName(JobType jobType, String spAddress) {
        return jobType.getValue() + ":" + spAddress;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("[ORCH] Starting probe orchestrator | retrievalTimeoutMs={} | dealJobTimeoutMs={} | maintenanceWindows={}",
            retrievalTimeout.toMillis(), dealJobTimeout.toMillis(), maintenanceWindow.getStarts().size());
        walletAllowanceService.ensureAllowance();
        syncAndArm();
    }

    @Scheduled(
        fixedDelayString = "${dealbot.scheduling.provider-sync-interval-ms:300000}",
        initialDelayString = "${dealbot.scheduling.provider-sync-interval-ms:300000}")
    public void syncProviders() {
        if (!started.get() || rootSignal.isCancelled()) {
            return;
        }
        try {
            syncAndArm();
        } catch (RuntimeException e) {
            log.error("[PROVIDER_SYNC] Provider sync failed | error={}", e.getMessage(), e);
        }
    }

    @Scheduled(
        fixedDelayString = "${dealbot.wallet.top-up-interval-ms:3600000}",
        initialDelayString = "${dealbot.wallet.top-up-interval-ms:3600000}")
    public void topUpWallet() {
        if (!started.get() || rootSignal.isCancelled()) {
            return;
        }
        try {
            walletAllowanceService.topUpIfBelowThreshold();
        } catch (RuntimeException e) {
            log.error("[ORCH] Wallet top-up failed | error={}", e.getMessage(), e);
        }
    }

    /**
     * Brings the schedule rows and the armed chains in line with the active roster.
     */
    void syncAndArm() {
        ProviderSyncResult result = jobScheduleService.syncProviders();

        Set<String> wanted = new HashSet<>();
        int armed = 0;
        for (ProviderInfo provider : result.getActiveProviders()) {
            for (JobType jobType : List.of(JobType.DEAL, JobType.RETRIEVAL)) {
                String name = jobName(jobType, provider.getAddress());
                wanted.add(name);
                boolean newChain = scheduler.scheduleInitialRun(
                    name,
                    jobScheduleService.getIntervalSeconds(jobType),
                    jobScheduleService.getStartOffsetSeconds(jobType),
                    () -> jobScheduleService.findLastRunAt(jobType, provider.getAddress()),
                    () -> runJob(jobType, provider));
                if (newChain) {
                    armed++;
                }
            }
        }

        int cancelled = 0;
        for (String name : scheduler.getJobNames()) {
            if (!wanted.contains(name) && scheduler.cancel(name)) {
                cancelled++;
            }
        }

        if (result.getPausedCount() > 0) {
            log.info("[PROVIDER_SYNC] Paused schedules present | paused={}", result.getPausedCount());
        }
        log.info("[PROVIDER_SYNC] Chains reconciled | armed={} | cancelled={} | active={}",
            armed, cancelled, wanted.size());
    }

    /**
     * One scheduler fire. Nothing thrown here escapes to the scheduler.
     */
    void runJob(JobType jobType, ProviderInfo provider) {
        String spAddress = provider.getAddress();
        if (rootSignal.isCancelled()) {
            return;
        }
        try {
            Optional<MaintenanceWindow.Active> maintenance = maintenanceWindow.activeAt(clock.instant());
            if (maintenance.isPresent()) {
                deferForMaintenance(jobType, spAddress, maintenance.get());
                return;
            }
            if (jobScheduleService.isPaused(jobType, spAddress)) {
                log.info("[ORCH] Schedule paused, skipping | jobType={} | spAddress={}",
                    jobType.getValue(), LogFormat.abbreviate(spAddress));
                return;
            }

            Instant startedAt = clock.instant();
            AtomicBoolean acquired = new AtomicBoolean();
            try {
                jobMutexService.runExclusively(jobType, spAddress, rootSignal, signal -> {
                    acquired.set(true);
                    probe(jobType, provider, signal);
                });
            } finally {
                // failed probes are recorded as runs too
                if (acquired.get()) {
                    jobScheduleService.recordRun(jobType, spAddress, startedAt);
                }
            }
        } catch (CancelledException e) {
            log.warn("[ORCH] Job cancelled | jobType={} | spAddress={} | reason={}",
                jobType.getValue(), LogFormat.abbreviate(spAddress), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[ORCH] Job failed | jobType={} | spAddress={} | error={}",
                jobType.getValue(), LogFormat.abbreviate(spAddress), e.getMessage(), e);
        }
    }

    /**
     * Skips the fire without recording a run and moves the chain's next fire to the end of the window.
     */
    private void deferForMaintenance(JobType jobType, String spAddress, MaintenanceWindow.Active maintenance) {
        log.info("[ORCH] Maintenance window active ({} UTC, {}m); deferring {} job | spAddress={} | resumeAt={}",
            maintenance.window().label(), maintenance.durationMinutes(), jobType.getValue(),
            LogFormat.abbreviate(spAddress), maintenance.resumeAt());
        scheduler.deferNextRun(jobName(jobType, spAddress), maintenance.resumeAt());
    }

    private void probe(JobType jobType, ProviderInfo provider, CancellationSignal signal) {
        if (jobType == JobType.DEAL) {
            try (CancellationSignal bounded = signal.childWithTimeout(dealJobTimeout)) {
                dealService.createDeal(provider, bounded);
            }
        } else if (jobType == JobType.RETRIEVAL) {
            retrievalService.performRetrievals(provider, retrievalTimeout, signal);
        } else {
            throw new IllegalArgumentException("Unsupported job type " + jobType);
        }
    }

    public Duration getRetrievalTimeout() {
        return retrievalTimeout;
    }

    public Duration getDealJobTimeout() {
        return dealJobTimeout;
    }

    /**
     * Shutdown order for the whole job loop:
     * <ol>
     *   <li>cancel the root signal so running deals and retrievals unwind,</li>
     *   <li>stop the scheduler and wait up to the grace period for its runs to return,</li>
     *   <li>stop lease renewal, after every run has released its mutex.</li>
     * </ol>
     * The per-service executors (deal batches, IPNI tracking, block fetches) belong to beans this one
     * depends on, so the container closes them after this method returns.
     */
    @PreDestroy
    public void stop() {
        log.info("[ORCH] Stopping probe orchestrator | graceSeconds={}", shutdownGrace.toSeconds());
        rootSignal.cancel("shutdown");
        if (!scheduler.shutdown(shutdownGrace)) {
            log.warn("[ORCH] Scheduler did not drain within the grace period");
        }
        jobMutexService.shutdown();
    }
}
