package com.dealbot.core.scheduler;

public enum ChainState {
    IDLE,
    ARMED,
    RUNNING
}
