package com.dealbot.data.repository;

import com.dealbot.data.entity.JobMutex;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Repository
public interface JobMutexRepository extends JpaRepository<JobMutex, String> {

    /**
     * Claims the lease for {@code spAddress} in a single statement. Succeeds (returns 1) when no row
     * exists, or when the existing row has not been renewed within {@code timeoutSeconds}.
     */
    @Modifying
    @Transactional
    @Query(value = """
        INSERT INTO job_mutex (sp_address, job_type, job_id, hostname, acquired_at, updated_at)
        VALUES (:spAddress, :jobType, :jobId, :hostname, now(), now())
        ON CONFLICT (sp_address)
        DO UPDATE SET job_type = EXCLUDED.job_type,
                      job_id = EXCLUDED.job_id,
                      hostname = EXCLUDED.hostname,
                      acquired_at = EXCLUDED.acquired_at,
                      updated_at = EXCLUDED.updated_at
        WHERE job_mutex.updated_at < now() - (:timeoutSeconds * interval '1 second')
        """, nativeQuery = true)
    int tryAcquire(
        @Param("jobType") String jobType,
        @Param("spAddress") String spAddress,
        @Param("jobId") UUID jobId,
        @Param("hostname") String hostname,
        @Param("timeoutSeconds") long timeoutSeconds
    );

    @Modifying
    @Transactional
    @Query(value = "DELETE FROM job_mutex WHERE job_id = :jobId", nativeQuery = true)
    int release(@Param("jobId") UUID jobId);

    @Modifying
    @Transactional
    @Query(value = "UPDATE job_mutex SET updated_at = now() WHERE job_id = :jobId", nativeQuery = true)
    int renew(@Param("jobId") UUID jobId);
}
