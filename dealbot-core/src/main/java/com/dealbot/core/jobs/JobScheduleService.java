package com.dealbot.core.jobs;

import com.dealbot.client.provider.ProviderInfo;
import com.dealbot.client.provider.ProviderRegistry;
import com.dealbot.common.constants.JobType;
import com.dealbot.common.util.LogFormat;
import com.dealbot.data.entity.JobScheduleState;
import com.dealbot.data.repository.JobScheduleStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Owns the {@code job_schedule_state} rows: one per (job type, provider), holding the cadence and
 * the timestamps the scheduler anchors to.
 */
@Service
@Slf4j
public class JobScheduleService {

    private final JobScheduleStateRepository repository;
    private final ProviderRegistry providerRegistry;
    private final Clock clock;
    private final int dealIntervalSeconds;
    private final int retrievalIntervalSeconds;
    private final long dealStartOffsetSeconds;
    private final long retrievalStartOffsetSeconds;

    public JobScheduleService(
            JobScheduleStateRepository repository,
            ProviderRegistry providerRegistry,
            Clock clock,
            @Value("${dealbot.scheduling.deals-per-sp-per-hour:2}") double dealsPerSpPerHour,
            @Value("${dealbot.scheduling.retrievals-per-sp-per-hour:6}") double retrievalsPerSpPerHour,
            @Value("${dealbot.scheduling.deal-start-offset-seconds:0}") long dealStartOffsetSeconds,
            @Value("${dealbot.scheduling.retrieval-start-offset-seconds:600}") long retrievalStartOffsetSeconds) {
        this.repository = repository;
        this.providerRegistry = providerRegistry;
        this.clock = clock;
        this.dealIntervalSeconds = intervalSeconds(dealsPerSpPerHour);
        this.retrievalIntervalSeconds = intervalSeconds(retrievalsPerSpPerHour);
        this.dealStartOffsetSeconds = Math.max(0, dealStartOffsetSeconds);
        this.retrievalStartOffsetSeconds = Math.max(0, retrievalStartOffsetSeconds);
    }

    /**
     * Seconds between runs for a per-hour rate, never below one second.
     */
    public static int intervalSeconds(double runsPerHour) {
        if (runsPerHour <= 0 || Double.isNaN(runsPerHour)) {
            throw new IllegalStateException("Runs per hour must be positive, got " + runsPerHour);
        }
        return (int) Math.max(1, Math.round(3600 / runsPerHour));
    }

    public int getIntervalSeconds(JobType jobType) {
        if (jobType == JobType.DEAL) {
            return dealIntervalSeconds;
        }
        if (jobType == JobType.RETRIEVAL) {
            return retrievalIntervalSeconds;
        }
        throw new IllegalArgumentException("No per-provider interval for " + jobType);
    }

    public long getStartOffsetSeconds(JobType jobType) {
        return jobType == JobType.RETRIEVAL ? retrievalStartOffsetSeconds : dealStartOffsetSeconds;
    }

    /**
     * Upserts deal and retrieval rows for every active provider and deletes rows of providers that
     * left the roster. Existing next-run timestamps and pause flags are preserved.
     */
    public ProviderSyncResult syncProviders() {
        List<ProviderInfo> active = providerRegistry.getActiveProviders();
        Instant now = clock.instant();

        for (ProviderInfo provider : active) {
            repository.upsertSchedule(JobType.DEAL.name(), provider.getAddress(), dealIntervalSeconds,
                now.plusSeconds(dealStartOffsetSeconds));
            repository.upsertSchedule(JobType.RETRIEVAL.name(), provider.getAddress(), retrievalIntervalSeconds,
                now.plusSeconds(retrievalStartOffsetSeconds));
        }

        List<String> removed = repository.deleteSchedulesForInactiveProviders(
            active.stream().map(ProviderInfo::getAddress).toList());
        long paused = repository.countByPausedTrue();

        log.info("[PROVIDER_SYNC] Schedules synced | active={} | removed={} | paused={} | dealIntervalSeconds={} | retrievalIntervalSeconds={}",
            active.size(), removed.size(), paused, dealIntervalSeconds, retrievalIntervalSeconds);
        if (!removed.isEmpty()) {
            log.info("[PROVIDER_SYNC] Removed schedules | addresses={}",
                removed.stream().map(LogFormat::abbreviate).toList());
        }

        return ProviderSyncResult.builder()
            .activeProviders(active)
            .removedAddresses(removed)
            .pausedCount(paused)
            .build();
    }

    public Optional<Instant> findLastRunAt(JobType jobType, String spAddress) {
        return repository.findByJobTypeAndSpAddress(jobType, spAddress)
            .map(JobScheduleState::getLastRunAt);
    }

    public boolean isPaused(JobType jobType, String spAddress) {
        return repository.findByJobTypeAndSpAddress(jobType, spAddress)
            .map(state -> Boolean.TRUE.equals(state.getPaused()))
            .orElse(false);
    }

    /**
     * Records a run that started at {@code startedAt}. The next run is due one interval later.
     */
    public void recordRun(JobType jobType, String spAddress, Instant startedAt) {
        Instant nextRunAt = startedAt.plusSeconds(getIntervalSeconds(jobType));
        int updated = repository.updateScheduleAfterRun(jobType.name(), spAddress, startedAt, nextRunAt);
        if (updated == 0) {
            log.warn("[SCHEDULER] No schedule row to update | jobType={} | spAddress={}",
                jobType.getValue(), LogFormat.abbreviate(spAddress));
        }
    }

    public void setPaused(JobType jobType, String spAddress, boolean paused) {
        int updated = repository.setPaused(jobType.name(), spAddress, paused);
        if (updated == 0) {
            throw new IllegalArgumentException("No schedule for " + jobType.getValue() + " / " + spAddress);
        }
        log.info("[SCHEDULER] Schedule {} | jobType={} | spAddress={}",
            paused ? "paused" : "resumed", jobType.getValue(), LogFormat.abbreviate(spAddress));
    }

    public List<JobScheduleState> listSchedules() {
        return repository.findAllByOrderByJobTypeAscSpAddressAsc();
    }

    /** Unpaused rows whose next run is already due. */
    public List<JobScheduleState> listDueSchedules() {
        return repository.findDueSchedules(clock.instant());
    }
}
