package com.dealbot.core.storage;

import com.dealbot.common.constants.ServiceType;
import com.dealbot.core.packager.DataFile;
import com.dealbot.data.model.DealMetadata;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DealPreprocessingResult {

    private DataFile processedData;
    private DealMetadata metadata;
    private ProviderConfig providerConfig;
    private List<ServiceType> appliedServiceTypes;
}
