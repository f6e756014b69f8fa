package com.dealbot.data.entity;

import com.dealbot.common.constants.JobType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Lease row guarding one storage provider. Written only through the native statements in
 * {@link com.dealbot.data.repository.JobMutexRepository}.
 */
@Entity
@Table(
    name = "job_mutex",
    indexes = {
        @Index(name = "job_mutex_job_type_idx", columnList = "job_type"),
        @Index(name = "job_mutex_hostname_idx", columnList = "hostname")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobMutex {

    @Id
    @Column(name = "sp_address", nullable = false)
    private String spAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false)
    private JobType jobType;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "hostname", nullable = false)
    private String hostname;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
