package com.dealbot.core.retrieval;

import com.dealbot.client.http.HttpVersion;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.ServiceType;
import com.dealbot.core.strategy.StrategyPriority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Downloads the whole piece from the provider's {@code /piece} endpoint.
 */
@Component
@Slf4j
public class DirectPieceRetrievalStrategy implements RetrievalStrategy {

    static final String SIZE_CHECK = "size-check";

    private static final RetryConfig RETRY = new RetryConfig(2, Duration.ofSeconds(1));

    @Override
    public String getName() {
        return ServiceType.DIRECT_SP.getValue();
    }

    @Override
    public ServiceType getServiceType() {
        return ServiceType.DIRECT_SP;
    }

    @Override
    public StrategyPriority getPriority() {
        return StrategyPriority.LOW;
    }

    @Override
    public boolean canHandle(RetrievalConfig config) {
        return config.getProvider() != null
            && config.getProvider().getServiceUrl() != null
            && !config.getProvider().getServiceUrl().isBlank()
            && config.getDeal().getPieceCid() != null
            && !config.getDeal().getPieceCid().isBlank();
    }

    @Override
    public RetrievalUrl constructUrl(RetrievalConfig config) {
        if (!canHandle(config)) {
            throw new IllegalArgumentException("Deal " + config.getDeal().getId() + " has no piece CID or provider URL");
        }
        return RetrievalUrl.builder()
            .url(config.getProvider().normalizedServiceUrl() + "/piece/" + config.getDeal().getPieceCid())
            .httpVersion(HttpVersion.HTTP_1_1)
            .build();
    }

    @Override
    public ValidationResult validateData(byte[] data, RetrievalConfig config, CancellationSignal signal) {
        Long expected = config.getDeal().getFileSize();
        if (expected == null) {
            return ValidationResult.ok(SIZE_CHECK, "No expected size recorded; received " + data.length + " bytes");
        }
        if (data.length != expected) {
            return ValidationResult.failed(SIZE_CHECK, "Size mismatch: expected " + expected + ", got " + data.length);
        }
        return ValidationResult.ok(SIZE_CHECK, "Size matches (" + data.length + " bytes)");
    }

    @Override
    public RetryConfig getRetryConfig() {
        return RETRY;
    }
}
