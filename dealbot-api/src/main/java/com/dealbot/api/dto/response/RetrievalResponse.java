package com.dealbot.api.dto.response;

import com.dealbot.core.retrieval.RetrievalExecutionResult;
import com.dealbot.core.retrieval.RetrievalTestResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One retrieval probe of a deal: a row per method plus the summary.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrievalResponse {
    private UUID dealId;
    private boolean aborted;
    private int totalMethods;
    private int successfulMethods;
    private int failedMethods;
    private String fastestMethod;
    private Long fastestLatencyMs;
    private Instant testedAt;
    private List<Method> methods;

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Method {
        private String strategy;
        private String serviceType;
        private String url;
        private boolean success;
        private boolean timedOut;
        private Long latencyMs;
        private Long ttfbMs;
        private Long throughputBps;
        private Integer statusCode;
        private Integer retryCount;
        private String validation;
        private String errorMessage;
    }

    public static RetrievalResponse from(RetrievalTestResult result) {
        RetrievalTestResult.Summary summary = result.getSummary();
        return RetrievalResponse.builder()
            .dealId(result.getDealId())
            .aborted(result.isAborted())
            .totalMethods(summary.getTotalMethods())
            .successfulMethods(summary.getSuccessfulMethods())
            .failedMethods(summary.getFailedMethods())
            .fastestMethod(summary.getFastestMethod())
            .fastestLatencyMs(summary.getFastestLatency())
            .testedAt(result.getTestedAt())
            .methods(result.getResults().stream().map(RetrievalResponse::method).toList())
            .build();
    }

    private static Method method(RetrievalExecutionResult execution) {
        boolean success = execution.isSuccess();
        return Method.builder()
            .strategy(execution.getStrategyName())
            .serviceType(execution.getServiceType() != null ? execution.getServiceType().getValue() : null)
            .url(execution.getUrl())
            .success(success)
            .timedOut(execution.isTimedOut())
            .latencyMs(success ? execution.getLatencyMs() : null)
            .ttfbMs(success ? execution.getTtfbMs() : null)
            .throughputBps(success ? execution.getThroughputBps() : null)
            .statusCode(execution.getStatusCode() > 0 ? execution.getStatusCode() : null)
            .retryCount(execution.getRetryCount())
            .validation(execution.getValidation() != null ? execution.getValidation().getDetails() : null)
            .errorMessage(execution.getErrorMessage())
            .build();
    }
}
