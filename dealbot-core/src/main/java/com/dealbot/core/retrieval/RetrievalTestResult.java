package com.dealbot.core.retrieval;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class RetrievalTestResult {

    private UUID dealId;
    private List<RetrievalExecutionResult> results;
    private Summary summary;
    private Instant testedAt;

    /** True when the run was cancelled before every strategy finished. */
    private boolean aborted;

    @Data
    @Builder
    public static class Summary {
        private int totalMethods;
        private int successfulMethods;
        private int failedMethods;
        private String fastestMethod;
        private Long fastestLatency;
    }
}
