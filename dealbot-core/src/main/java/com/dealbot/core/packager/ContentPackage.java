package com.dealbot.core.packager;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class ContentPackage {

    private final String rootCid;
    private final List<String> blockCids;
    private final int blockCount;
    private final long totalBlockSize;
    private final long originalSize;
    private final byte[] carBytes;

    public long getCarSize() {
        return carBytes.length;
    }
}
