package com.dealbot.core.storage;

import com.dealbot.data.model.StrategyMetadata;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PreprocessingResult {

    private byte[] data;
    private StrategyMetadata metadata;
    private long size;
}
