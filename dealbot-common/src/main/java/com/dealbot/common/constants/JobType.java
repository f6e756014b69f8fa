package com.dealbot.common.constants;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum JobType {
    DEAL("deal", true),
    RETRIEVAL("retrieval", true),
    METRICS("metrics", false);

    private final String value;
    private final boolean perProvider;

    public static JobType fromString(String value) {
        for (JobType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + value);
    }
}
