package com.dealbot.data.model;

import com.dealbot.common.constants.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class DirectMetadata implements StrategyMetadata {

    @Builder.Default
    private String type = "direct";

    @Override
    public ServiceType serviceType() {
        return ServiceType.DIRECT_SP;
    }
}
