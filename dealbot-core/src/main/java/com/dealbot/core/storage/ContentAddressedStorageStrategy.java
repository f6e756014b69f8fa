package com.dealbot.core.storage;

import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.ServiceType;
import com.dealbot.common.util.LogFormat;
import com.dealbot.core.ipni.IpniTracker;
import com.dealbot.core.packager.ContentPackage;
import com.dealbot.core.packager.ContentPackager;
import com.dealbot.core.packager.PackagingException;
import com.dealbot.core.strategy.StrategyPriority;
import com.dealbot.core.strategy.StrategyValidationException;
import com.dealbot.data.entity.Deal;
import com.dealbot.data.model.ContentAddressedMetadata;
import com.dealbot.data.model.DealMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Packages the payload as a UnixFS CAR so the provider can index it for IPFS retrieval,
 * then tracks the IPNI advertisement once the upload is done.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentAddressedStorageStrategy implements StorageStrategy {

    public static final String WITH_IPFS_INDEXING = "withIPFSIndexing";
    public static final String IPFS_ROOT_CID = "ipfsRootCID";

    private final ContentPackager contentPackager;
    private final IpniTracker ipniTracker;

    @Override
    public ServiceType getServiceType() {
        return ServiceType.IPFS_PIN;
    }

    @Override
    public StrategyPriority getPriority() {
        return StrategyPriority.HIGH;
    }

    @Override
    public boolean isApplicable(DealConfiguration configuration) {
        return configuration.isEnableIpni();
    }

    @Override
    public PreprocessingResult preprocessData(StrategyContext context) {
        ContentPackage pkg;
        try {
            pkg = contentPackager.build(context.getCurrentData());
        } catch (PackagingException e) {
            log.error("[STORAGE] CAR conversion failed | name={} | error={}",
                context.getCurrentData().getName(), e.getMessage());
            throw new PackagingException("IPNI preprocessing failed: " + e.getMessage(), e);
        }

        log.info("[STORAGE] CAR conversion | blocks={} | carKb={}", pkg.getBlockCount(), pkg.getCarSize() / 1024);

        ContentAddressedMetadata metadata = ContentAddressedMetadata.builder()
            .enabled(true)
            .rootCid(pkg.getRootCid())
            .blockCids(pkg.getBlockCids())
            .blockCount(pkg.getBlockCount())
            .carSize(pkg.getCarSize())
            .originalSize(context.getCurrentData().getSize())
            .totalBlockSize(pkg.getTotalBlockSize())
            .build();

        return PreprocessingResult.builder()
            .data(pkg.getCarBytes())
            .size(pkg.getCarSize())
            .metadata(metadata)
            .build();
    }

    @Override
    public ProviderConfig getProviderConfig(DealMetadata metadata) {
        if (metadata == null) {
            return ProviderConfig.empty();
        }
        return metadata.contentAddressed()
            .map(ContentAddressedMetadata::getRootCid)
            .filter(root -> !root.isBlank())
            .map(root -> ProviderConfig.builder()
                .dataSetMetadata(Map.of(WITH_IPFS_INDEXING, ""))
                .pieceMetadata(Map.of(IPFS_ROOT_CID, root))
                .build())
            .orElseGet(ProviderConfig::empty);
    }

    @Override
    public void postProcess(Deal deal, DealConfiguration configuration, CancellationSignal signal) {
        if (configuration.getProvider() == null) {
            log.warn("[STORAGE] No provider for IPNI tracking | dealId={}", deal.getId());
            return;
        }
        ContentAddressedMetadata metadata = deal.getMetadata() != null
            ? deal.getMetadata().contentAddressed().orElse(null)
            : null;
        if (metadata == null) {
            log.warn("[STORAGE] Deal carries no CAR metadata, skipping IPNI tracking | dealId={}", deal.getId());
            return;
        }
        log.info("[STORAGE] IPNI tracking started | pieceCid={}", LogFormat.abbreviate(deal.getPieceCid()));
        ipniTracker.startTracking(deal, metadata, configuration.getProvider(), signal);
    }

    @Override
    public boolean validate(PreprocessingResult result) {
        if (!(result.getMetadata() instanceof ContentAddressedMetadata metadata)) {
            throw new StrategyValidationException(getServiceType(), "metadata missing");
        }
        if (!metadata.isEnabled()) {
            throw new StrategyValidationException(getServiceType(), "enabled flag not set");
        }
        if (metadata.getRootCid() == null || metadata.getRootCid().isBlank()) {
            throw new StrategyValidationException(getServiceType(), "rootCID not generated");
        }
        if (metadata.getBlockCids() == null || metadata.getBlockCids().isEmpty()) {
            throw new StrategyValidationException(getServiceType(), "no block CIDs generated");
        }
        if (metadata.getBlockCount() != metadata.getBlockCids().size()) {
            throw new StrategyValidationException(getServiceType(), "block count mismatch (expected "
                + metadata.getBlockCount() + ", got " + metadata.getBlockCids().size() + ")");
        }
        if (result.getData() == null || result.getSize() == 0) {
            throw new StrategyValidationException(getServiceType(), "CAR data is empty");
        }
        return true;
    }
}
