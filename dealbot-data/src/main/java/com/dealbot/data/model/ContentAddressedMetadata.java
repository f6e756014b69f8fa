package com.dealbot.data.model;

import com.dealbot.common.constants.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * CID metadata produced when a payload is packaged as a CAR for IPFS indexing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class ContentAddressedMetadata implements StrategyMetadata {

    private boolean enabled;
    private String rootCid;

    @Builder.Default
    private List<String> blockCids = new ArrayList<>();

    private int blockCount;

    /** Size of the serialized CAR. */
    private long carSize;

    /** Payload size before packaging. */
    private long originalSize;

    private long totalBlockSize;

    @Override
    public ServiceType serviceType() {
        return ServiceType.IPFS_PIN;
    }
}
