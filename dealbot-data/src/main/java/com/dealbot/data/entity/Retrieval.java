package com.dealbot.data.entity;

import com.dealbot.common.constants.RetrievalStatus;
import com.dealbot.common.constants.ServiceType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "retrievals")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Retrieval {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "deal_id", nullable = false)
    private Deal deal;

    @Enumerated(EnumType.STRING)
    @Column(name = "service_type", nullable = false)
    @Builder.Default
    private ServiceType serviceType = ServiceType.DIRECT_SP;

    @Column(name = "retrieval_endpoint", nullable = false, columnDefinition = "TEXT")
    private String retrievalEndpoint;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    @Builder.Default
    private RetrievalStatus status = RetrievalStatus.PENDING;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "latency_ms")
    private Long latencyMs;

    @Column(name = "ttfb_ms")
    private Long ttfbMs;

    @Column(name = "throughput_bps")
    private Long throughputBps;

    @Column(name = "bytes_retrieved")
    private Long bytesRetrieved;

    @Column(name = "response_code")
    private Integer responseCode;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "retry_count")
    @Builder.Default
    private Integer retryCount = 0;

    @CreationTimestamp
    @Column(name = "created_at")
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
