package com.dealbot.core.packager;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Getter
@Builder
public class CarValidationResult {

    private final boolean valid;

    @Singular
    private final List<CarValidationReason> reasons;

    /** Human readable detail per failure, in the same order as {@link #reasons}. */
    @Singular
    private final List<String> details;

    private final String declaredRootCid;
    private final String rebuiltRootCid;
    private final int extractedFiles;

    public boolean hasReason(CarValidationReason reason) {
        return reasons.contains(reason);
    }

    public List<String> reasonCodes() {
        return reasons.stream().map(CarValidationReason::getCode).toList();
    }
}
