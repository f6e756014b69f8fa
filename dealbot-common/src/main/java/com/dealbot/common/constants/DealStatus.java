package com.dealbot.common.constants;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Phases a deal moves through. Progress is forward-only; FAILED is reachable from any phase.
 */
@Getter
@RequiredArgsConstructor
public enum DealStatus {
    PENDING("pending", 0),
    UPLOADED("uploaded", 1),
    PIECE_ADDED("piece_added", 2),
    PIECE_CONFIRMED("piece_confirmed", 3),
    DEAL_CREATED("deal_created", 4),
    FAILED("failed", Integer.MAX_VALUE);

    private final String value;
    private final int stage;

    public boolean isTerminal() {
        return this == DEAL_CREATED || this == FAILED;
    }

    public boolean canAdvanceTo(DealStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return next == FAILED || next.stage > this.stage;
    }
}
