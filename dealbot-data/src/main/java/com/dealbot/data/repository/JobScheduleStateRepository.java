package com.dealbot.data.repository;

import com.dealbot.common.constants.JobType;
import com.dealbot.data.entity.JobScheduleState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface JobScheduleStateRepository extends JpaRepository<JobScheduleState, Long>, JobScheduleStateRepositoryCustom {

    Optional<JobScheduleState> findByJobTypeAndSpAddress(JobType jobType, String spAddress);

    List<JobScheduleState> findAllByOrderByJobTypeAscSpAddressAsc();

    long countByPausedTrue();

    /**
     * Inserts the row or refreshes its interval. An existing next_run_at and paused flag are kept.
     */
    @Modifying
    @Transactional
    @Query(value = """
        INSERT INTO job_schedule_state (job_type, sp_address, interval_seconds, next_run_at, paused, created_at, updated_at)
        VALUES (:jobType, :spAddress, :intervalSeconds, :nextRunAt, false, now(), now())
        ON CONFLICT (job_type, sp_address)
        DO UPDATE SET interval_seconds = EXCLUDED.interval_seconds,
                      updated_at = now()
        """, nativeQuery = true)
    int upsertSchedule(
        @Param("jobType") String jobType,
        @Param("spAddress") String spAddress,
        @Param("intervalSeconds") int intervalSeconds,
        @Param("nextRunAt") Instant nextRunAt
    );

    @Query(value = """
        SELECT * FROM job_schedule_state
        WHERE paused = false
          AND next_run_at <= :now
        ORDER BY next_run_at
        """, nativeQuery = true)
    List<JobScheduleState> findDueSchedules(@Param("now") Instant now);

    @Modifying
    @Transactional
    @Query(value = """
        UPDATE job_schedule_state
        SET last_run_at = :lastRunAt,
            next_run_at = :nextRunAt,
            updated_at = now()
        WHERE job_type = :jobType
          AND sp_address = :spAddress
        """, nativeQuery = true)
    int updateScheduleAfterRun(
        @Param("jobType") String jobType,
        @Param("spAddress") String spAddress,
        @Param("lastRunAt") Instant lastRunAt,
        @Param("nextRunAt") Instant nextRunAt
    );

    @Modifying
    @Transactional
    @Query(value = """
        UPDATE job_schedule_state
        SET paused = :paused,
            updated_at = now()
        WHERE job_type = :jobType
          AND sp_address = :spAddress
        """, nativeQuery = true)
    int setPaused(
        @Param("jobType") String jobType,
        @Param("spAddress") String spAddress,
        @Param("paused") boolean paused
    );
}
