package com.dealbot.core.storage;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata sent to the provider with the upload.
 */
@Data
@Builder
public class ProviderConfig {

    @Builder.Default
    private Map<String, String> dataSetMetadata = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> pieceMetadata = new LinkedHashMap<>();

    public static ProviderConfig empty() {
        return ProviderConfig.builder().build();
    }

    public ProviderConfig merge(ProviderConfig other) {
        Map<String, String> dataSet = new LinkedHashMap<>(dataSetMetadata);
        Map<String, String> piece = new LinkedHashMap<>(pieceMetadata);
        if (other != null) {
            dataSet.putAll(other.getDataSetMetadata());
            piece.putAll(other.getPieceMetadata());
        }
        return ProviderConfig.builder().dataSetMetadata(dataSet).pieceMetadata(piece).build();
    }
}
