package com.dealbot.core.retrieval;

import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.ServiceType;
import com.dealbot.core.strategy.StrategyPriority;

/**
 * One way of fetching a deal's content back from its provider.
 */
public interface RetrievalStrategy {

    String getName();

    ServiceType getServiceType();

    StrategyPriority getPriority();

    boolean canHandle(RetrievalConfig config);

    RetrievalUrl constructUrl(RetrievalConfig config);

    /**
     * Checks the bytes a successful fetch returned. Returning null means the strategy does not validate.
     */
    default ValidationResult validateData(byte[] data, RetrievalConfig config, CancellationSignal signal) {
        return null;
    }

    default RetryConfig getRetryConfig() {
        return RetryConfig.SINGLE;
    }

    /** Whether attempts may be routed through the proxy pool. */
    default boolean useProxy() {
        return true;
    }
}
