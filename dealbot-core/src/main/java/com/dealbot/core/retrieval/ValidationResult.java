package com.dealbot.core.retrieval;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ValidationResult {

    private boolean valid;

    /** Which check ran, e.g. {@code size-check} or {@code block-fetch}. */
    private String method;
    private String details;
    private long bytesRead;

    public static ValidationResult ok(String method, String details) {
        return ValidationResult.builder().valid(true).method(method).details(details).build();
    }

    public static ValidationResult failed(String method, String details) {
        return ValidationResult.builder().valid(false).method(method).details(details).build();
    }
}
