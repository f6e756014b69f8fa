package com.dealbot.core.retrieval;

import com.dealbot.common.constants.ServiceType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Outcome of one strategy: its best successful attempt, or the last failed one.
 */
@Data
@Builder(toBuilder = true)
public class RetrievalExecutionResult {

    private String strategyName;
    private ServiceType serviceType;
    private String url;
    private boolean success;
    private boolean timedOut;

    /** Set on transport failures worth another attempt. */
    private boolean retryable;
    private long latencyMs;
    private long ttfbMs;
    private long throughputBps;
    private int statusCode;
    private long responseSize;
    private String errorMessage;
    private Integer retryCount;
    private ValidationResult validation;
    private String proxyUrl;
    private String httpVersion;
    private Instant startedAt;
    private Instant completedAt;
}
