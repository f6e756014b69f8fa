package com.dealbot.core.strategy;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lower values run first.
 */
@Getter
@RequiredArgsConstructor
public enum StrategyPriority {
    HIGH(1),
    MEDIUM(5),
    LOW(10);

    private final int value;
}
