package com.dealbot.core.strategy;

import com.dealbot.common.constants.ServiceType;
import lombok.Getter;

/**
 * A strategy produced output that failed its own validation. Never retried.
 */
@Getter
public class StrategyValidationException extends RuntimeException {

    private final ServiceType serviceType;

    public StrategyValidationException(ServiceType serviceType, String message) {
        super(serviceType.getValue() + " validation failed: " + message);
        this.serviceType = serviceType;
    }
}
