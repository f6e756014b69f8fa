package com.dealbot.core.retrieval;

import java.time.Duration;

public record RetryConfig(int attempts, Duration delay) {

    public static final RetryConfig SINGLE = new RetryConfig(1, Duration.ZERO);

    public RetryConfig {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative");
        }
    }
}
