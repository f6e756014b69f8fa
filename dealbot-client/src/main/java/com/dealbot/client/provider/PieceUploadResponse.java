package com.dealbot.client.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PieceUploadResponse {
    private String pieceCid;
    private Long pieceId;
    private Long dataSetId;
    private String transactionHash;
}
