package com.dealbot.core.ipni;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Outcome of polling a provider's piece status endpoint.
 */
@Data
@Builder
public class PieceMonitoringResult {

    /** True once the provider reported the piece as advertised. */
    private boolean success;
    private String lastStatus;
    private boolean indexed;
    private boolean advertised;
    private Instant indexedAt;
    private Instant advertisedAt;
    private int checks;
    private long durationMs;
}
