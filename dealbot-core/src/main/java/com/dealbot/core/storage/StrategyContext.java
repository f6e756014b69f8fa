package com.dealbot.core.storage;

import com.dealbot.core.packager.DataFile;
import com.dealbot.data.model.DealMetadata;
import lombok.Builder;
import lombok.Data;

/**
 * State threaded through the storage strategies: each one sees the payload as left by the previous.
 */
@Data
@Builder(toBuilder = true)
public class StrategyContext {

    private DataFile currentData;
    private DealConfiguration configuration;
    private DealMetadata metadata;
}
