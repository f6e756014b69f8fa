package com.dealbot.core.storage;

import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.ServiceType;
import com.dealbot.core.strategy.StrategyPriority;
import com.dealbot.data.entity.Deal;
import com.dealbot.data.model.DealMetadata;

/**
 * One way of preparing a payload before it is uploaded to a provider.
 */
public interface StorageStrategy {

    ServiceType getServiceType();

    StrategyPriority getPriority();

    boolean isApplicable(DealConfiguration configuration);

    PreprocessingResult preprocessData(StrategyContext context);

    ProviderConfig getProviderConfig(DealMetadata metadata);

    /**
     * Runs once the upload has completed.
     */
    default void postProcess(Deal deal, DealConfiguration configuration, CancellationSignal signal) {
    }

    /**
     * @throws com.dealbot.core.strategy.StrategyValidationException with the failure detail
     */
    default boolean validate(PreprocessingResult result) {
        return true;
    }
}
