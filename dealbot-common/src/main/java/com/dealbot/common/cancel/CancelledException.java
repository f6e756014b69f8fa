package com.dealbot.common.cancel;

public class CancelledException extends RuntimeException {

    public CancelledException(String reason) {
        super("Operation cancelled: " + reason);
    }
}
