package com.dealbot.data.entity;

import com.dealbot.common.constants.DealStatus;
import com.dealbot.common.constants.IpniStatus;
import com.dealbot.common.constants.ServiceType;
import com.dealbot.data.model.DealMetadata;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "deals")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Deal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "sp_address", nullable = false)
    private String spAddress;

    @Column(name = "wallet_address")
    private String walletAddress;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "piece_cid")
    private String pieceCid;

    @Column(name = "data_set_id")
    private Long dataSetId;

    @Column(name = "piece_id")
    private Long pieceId;

    @Column(name = "piece_size")
    private Long pieceSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    @Builder.Default
    private DealStatus status = DealStatus.PENDING;

    @Column(name = "transaction_hash")
    private String transactionHash;

    @Column(name = "metadata", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private DealMetadata metadata = new DealMetadata();

    @Column(name = "service_types", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<ServiceType> serviceTypes = new ArrayList<>();

    @Column(name = "upload_start_time")
    private Instant uploadStartTime;

    @Column(name = "upload_end_time")
    private Instant uploadEndTime;

    @Column(name = "piece_added_time")
    private Instant pieceAddedTime;

    @Column(name = "piece_confirmed_time")
    private Instant pieceConfirmedTime;

    @Column(name = "deal_confirmed_time")
    private Instant dealConfirmedTime;

    @Column(name = "ingest_latency_ms")
    private Long ingestLatencyMs;

    @Column(name = "chain_latency_ms")
    private Long chainLatencyMs;

    @Column(name = "deal_latency_ms")
    private Long dealLatencyMs;

    @Column(name = "ingest_throughput_bps")
    private Long ingestThroughputBps;

    // IPNI tracking
    @Enumerated(EnumType.STRING)
    @Column(name = "ipni_status")
    private IpniStatus ipniStatus;

    @Column(name = "ipni_indexed_at")
    private Instant ipniIndexedAt;

    @Column(name = "ipni_advertised_at")
    private Instant ipniAdvertisedAt;

    @Column(name = "ipni_verified_at")
    private Instant ipniVerifiedAt;

    @Column(name = "ipni_time_to_index_ms")
    private Long ipniTimeToIndexMs;

    @Column(name = "ipni_time_to_advertise_ms")
    private Long ipniTimeToAdvertiseMs;

    @Column(name = "ipni_time_to_verify_ms")
    private Long ipniTimeToVerifyMs;

    @Column(name = "ipni_verified_cids_count")
    private Integer ipniVerifiedCidsCount;

    @Column(name = "ipni_unverified_cids_count")
    private Integer ipniUnverifiedCidsCount;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "error_code")
    private String errorCode;

    @Column(name = "retry_count")
    @Builder.Default
    private Integer retryCount = 0;

    @CreationTimestamp
    @Column(name = "created_at")
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Moves the deal forward. Backward moves and moves out of a terminal status are rejected.
     */
    public void advanceTo(DealStatus next) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal deal status transition " + status + " -> " + next + " for deal " + id);
        }
        this.status = next;
    }

    public void markFailed(String message) {
        if (!status.isTerminal()) {
            this.status = DealStatus.FAILED;
        }
        this.errorMessage = message;
    }
}
