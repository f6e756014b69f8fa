package com.dealbot.common.constants;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Indexing progress of a content-addressed deal:
 * PENDING -> SP_INDEXED -> SP_ADVERTISED -> VERIFIED, FAILED from any non-terminal state.
 */
@Getter
@RequiredArgsConstructor
public enum IpniStatus {
    PENDING("pending", 0),
    SP_INDEXED("sp_indexed", 1),
    SP_ADVERTISED("sp_advertised", 2),
    VERIFIED("verified", 3),
    FAILED("failed", -1);

    private final String value;
    private final int stage;

    public boolean isTerminal() {
        return this == VERIFIED || this == FAILED;
    }

    public boolean canTransitionTo(IpniStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.stage > this.stage;
    }
}
