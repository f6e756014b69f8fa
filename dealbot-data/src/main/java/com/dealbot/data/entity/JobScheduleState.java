package com.dealbot.data.entity;

import com.dealbot.common.constants.JobType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(
    name = "job_schedule_state",
    uniqueConstraints = @UniqueConstraint(name = "job_schedule_state_job_type_sp_unique", columnNames = {"job_type", "sp_address"}),
    indexes = @Index(name = "job_schedule_state_next_run_idx", columnList = "next_run_at")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobScheduleState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false)
    private JobType jobType;

    /** Empty for global jobs. */
    @Column(name = "sp_address", nullable = false)
    @Builder.Default
    private String spAddress = "";

    @Column(name = "interval_seconds", nullable = false)
    private Integer intervalSeconds;

    @Column(name = "next_run_at", nullable = false)
    private Instant nextRunAt;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "paused", nullable = false)
    @Builder.Default
    private Boolean paused = false;

    @CreationTimestamp
    @Column(name = "created_at")
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
