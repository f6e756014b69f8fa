package com.dealbot.core.retrieval;

import com.dealbot.client.http.HttpVersion;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.ProbeDefaults;
import com.dealbot.common.constants.ServiceType;
import com.dealbot.core.packager.CarValidationResult;
import com.dealbot.core.packager.ContentPackager;
import com.dealbot.core.strategy.StrategyPriority;
import com.dealbot.data.model.ContentAddressedMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Fetches the whole DAG as one CAR from the provider's IPFS gateway and proves it by unpacking and
 * rebuilding it to the recorded root.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CarGatewayRetrievalStrategy implements RetrievalStrategy {

    static final String NAME = "ipfs_car";
    static final String CAR_SIZE = "car-size";
    static final String CAR_VALIDATION = "car-validation";

    private final ContentPackager contentPackager;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ServiceType getServiceType() {
        return ServiceType.IPFS_PIN;
    }

    @Override
    public StrategyPriority getPriority() {
        return StrategyPriority.LOW;
    }

    @Override
    public boolean canHandle(RetrievalConfig config) {
        if (config.getProvider() == null || !config.getProvider().isIpfsEnabled()
                || config.getProvider().getServiceUrl() == null) {
            return false;
        }
        Optional<ContentAddressedMetadata> metadata = metadata(config);
        return metadata.isPresent() && metadata.get().isEnabled()
            && metadata.get().getRootCid() != null && !metadata.get().getRootCid().isBlank();
    }

    @Override
    public RetrievalUrl constructUrl(RetrievalConfig config) {
        String rootCid = metadata(config)
            .map(ContentAddressedMetadata::getRootCid)
            .filter(root -> !root.isBlank())
            .orElseThrow(() -> new IllegalArgumentException("Deal " + config.getDeal().getId() + " has no IPFS root CID"));
        return RetrievalUrl.builder()
            .url(config.getProvider().normalizedServiceUrl() + "/ipfs/" + rootCid)
            .headers(Map.of("Accept", ProbeDefaults.CAR_CONTENT_TYPE))
            .httpVersion(HttpVersion.HTTP_2)
            .build();
    }

    /**
     * A CAR of the wrong length is rejected before unpacking. Otherwise every failed check of the
     * packager is reported by its reason code.
     */
    @Override
    public ValidationResult validateData(byte[] data, RetrievalConfig config, CancellationSignal signal) {
        ContentAddressedMetadata metadata = metadata(config).orElse(null);
        if (metadata == null || metadata.getRootCid() == null || metadata.getRootCid().isBlank()) {
            return ValidationResult.failed(IpfsBlockRetrievalStrategy.METADATA_MISSING,
                "Cannot validate: rootCID metadata is missing");
        }
        long expectedSize = metadata.getCarSize();
        if (expectedSize > 0 && data.length != expectedSize) {
            return ValidationResult.builder()
                .valid(false)
                .method(CAR_SIZE)
                .details("CAR size " + data.length + " does not match expected " + expectedSize)
                .bytesRead(data.length)
                .build();
        }

        signal.throwIfCancelled();
        CarValidationResult result = contentPackager.validate(data, metadata.getRootCid());
        if (!result.isValid()) {
            log.warn("[RETRIEVAL] CAR validation failed | dealId={} | reasons={}",
                config.getDeal().getId(), result.reasonCodes());
        }
        return ValidationResult.builder()
            .valid(result.isValid())
            .method(CAR_VALIDATION)
            .details(result.isValid()
                ? "CAR rebuilt to " + metadata.getRootCid() + " from " + result.getExtractedFiles() + " file(s)"
                : String.join(",", result.reasonCodes()) + ": " + String.join("; ", result.getDetails()))
            .bytesRead(data.length)
            .build();
    }

    private static Optional<ContentAddressedMetadata> metadata(RetrievalConfig config) {
        if (config.getDeal() == null || config.getDeal().getMetadata() == null) {
            return Optional.empty();
        }
        return config.getDeal().getMetadata().contentAddressed();
    }

    /** Gateway fetches always go direct. */
    @Override
    public boolean useProxy() {
        return false;
    }
}
