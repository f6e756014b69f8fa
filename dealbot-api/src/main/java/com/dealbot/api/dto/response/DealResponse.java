package com.dealbot.api.dto.response;

import com.dealbot.common.constants.ServiceType;
import com.dealbot.data.entity.Deal;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DealResponse {
    private UUID id;
    private String spAddress;
    private String status;
    private String fileName;
    private Long fileSize;
    private String pieceCid;
    private Long dataSetId;
    private Long pieceId;
    private String transactionHash;
    private List<ServiceType> serviceTypes;
    private Long ingestLatencyMs;
    private Long chainLatencyMs;
    private Long dealLatencyMs;
    private Long ingestThroughputBps;
    private String ipniStatus;
    private Long ipniTimeToVerifyMs;
    private String errorMessage;
    private Instant createdAt;

    public static DealResponse from(Deal deal) {
        return DealResponse.builder()
            .id(deal.getId())
            .spAddress(deal.getSpAddress())
            .status(deal.getStatus().getValue())
            .fileName(deal.getFileName())
            .fileSize(deal.getFileSize())
            .pieceCid(deal.getPieceCid())
            .dataSetId(deal.getDataSetId())
            .pieceId(deal.getPieceId())
            .transactionHash(deal.getTransactionHash())
            .serviceTypes(deal.getServiceTypes())
            .ingestLatencyMs(deal.getIngestLatencyMs())
            .chainLatencyMs(deal.getChainLatencyMs())
            .dealLatencyMs(deal.getDealLatencyMs())
            .ingestThroughputBps(deal.getIngestThroughputBps())
            .ipniStatus(deal.getIpniStatus() != null ? deal.getIpniStatus().getValue() : null)
            .ipniTimeToVerifyMs(deal.getIpniTimeToVerifyMs())
            .errorMessage(deal.getErrorMessage())
            .createdAt(deal.getCreatedAt())
            .build();
    }
}
