package com.dealbot.core.storage;

import com.dealbot.common.constants.ServiceType;
import com.dealbot.core.packager.DataFile;
import com.dealbot.core.strategy.StrategyPriority;
import com.dealbot.core.strategy.StrategyValidationException;
import com.dealbot.data.model.DealMetadata;
import com.dealbot.data.model.DirectMetadata;
import org.springframework.stereotype.Component;

/**
 * Uploads the payload unchanged for direct piece retrieval.
 */
@Component
public class DirectStorageStrategy implements StorageStrategy {

    @Override
    public ServiceType getServiceType() {
        return ServiceType.DIRECT_SP;
    }

    @Override
    public StrategyPriority getPriority() {
        return StrategyPriority.LOW;
    }

    @Override
    public boolean isApplicable(DealConfiguration configuration) {
        return true;
    }

    @Override
    public PreprocessingResult preprocessData(StrategyContext context) {
        DataFile data = context.getCurrentData();
        return PreprocessingResult.builder()
            .data(data.getData())
            .size(data.getSize())
            .metadata(DirectMetadata.builder().build())
            .build();
    }

    @Override
    public ProviderConfig getProviderConfig(DealMetadata metadata) {
        return ProviderConfig.empty();
    }

    @Override
    public boolean validate(PreprocessingResult result) {
        if (result.getData() == null || result.getData().length == 0) {
            throw new StrategyValidationException(getServiceType(), "data is empty");
        }
        if (result.getData().length != result.getSize()) {
            throw new StrategyValidationException(getServiceType(),
                "size mismatch (declared " + result.getSize() + ", actual " + result.getData().length + ")");
        }
        return true;
    }
}
