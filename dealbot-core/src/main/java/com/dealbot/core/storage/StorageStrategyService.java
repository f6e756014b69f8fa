package com.dealbot.core.storage;

import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.ServiceType;
import com.dealbot.core.packager.DataFile;
import com.dealbot.core.strategy.StrategyValidationException;
import com.dealbot.data.entity.Deal;
import com.dealbot.data.model.DealMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the applicable storage strategies in priority order, each transforming the output of the
 * previous one, and merges what they contribute.
 */
@Service
@Slf4j
public class StorageStrategyService {

    private final List<StorageStrategy> strategies;

    public StorageStrategyService(List<StorageStrategy> strategies) {
        this.strategies = strategies.stream()
            .sorted(Comparator.comparingInt(s -> s.getPriority().getValue()))
            .toList();
        log.info("[STORAGE] Strategies registered | order={}",
            this.strategies.stream().map(s -> s.getServiceType().getValue()).toList());
    }

    public List<StorageStrategy> getApplicableStrategies(DealConfiguration configuration) {
        return strategies.stream().filter(s -> s.isApplicable(configuration)).toList();
    }

    public DealPreprocessingResult preprocessDeal(DealConfiguration configuration, DataFile dataFile) {
        List<StorageStrategy> applicable = getApplicableStrategies(configuration);
        if (applicable.isEmpty()) {
            throw new IllegalStateException("No storage strategy applies to this deal configuration");
        }

        DataFile current = dataFile;
        DealMetadata metadata = new DealMetadata();
        ProviderConfig providerConfig = ProviderConfig.empty();
        List<ServiceType> applied = new ArrayList<>();

        for (StorageStrategy strategy : applicable) {
            long startTime = System.currentTimeMillis();
            StrategyContext context = StrategyContext.builder()
                .currentData(current)
                .configuration(configuration)
                .metadata(metadata)
                .build();

            PreprocessingResult result = strategy.preprocessData(context);
            if (!strategy.validate(result)) {
                throw new StrategyValidationException(strategy.getServiceType(), "result rejected");
            }

            metadata = metadata.merge(result.getMetadata());
            providerConfig = providerConfig.merge(strategy.getProviderConfig(metadata));
            current = current.toBuilder().data(result.getData()).size(result.getSize()).build();
            applied.add(strategy.getServiceType());

            log.debug("[STORAGE] Strategy applied | serviceType={} | size={} | durationMs={}",
                strategy.getServiceType().getValue(), result.getSize(), System.currentTimeMillis() - startTime);
        }

        return DealPreprocessingResult.builder()
            .processedData(current)
            .metadata(metadata)
            .providerConfig(providerConfig)
            .appliedServiceTypes(applied)
            .build();
    }

    /**
     * Post-upload hooks. One strategy failing does not stop the others.
     */
    public void postProcessDeal(Deal deal, DealConfiguration configuration, CancellationSignal signal) {
        for (StorageStrategy strategy : getApplicableStrategies(configuration)) {
            if (!deal.getServiceTypes().contains(strategy.getServiceType())) {
                continue;
            }
            try {
                strategy.postProcess(deal, configuration, signal);
            } catch (Exception e) {
                log.error("[STORAGE] Post-processing failed | serviceType={} | dealId={} | error={}",
                    strategy.getServiceType().getValue(), deal.getId(), e.getMessage(), e);
            }
        }
    }
}
