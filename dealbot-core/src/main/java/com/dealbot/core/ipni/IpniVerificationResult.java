package com.dealbot.core.ipni;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class IpniVerificationResult {

    private int verified;
    private int unverified;
    private int total;
    private boolean rootCidVerified;
    private long durationMs;
    private List<FailedCid> failedCids;
    private Instant verifiedAt;

    public record FailedCid(String cid, String reason, List<String> addrs) {}
}
