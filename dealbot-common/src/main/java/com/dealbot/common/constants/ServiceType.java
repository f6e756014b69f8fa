package com.dealbot.common.constants;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ServiceType {
    DIRECT_SP("direct_sp"),
    IPFS_PIN("ipfs_pin");

    private final String value;

    public static ServiceType fromString(String value) {
        for (ServiceType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown service type: " + value);
    }
}
