package com.dealbot.core.packager;

/**
 * Content could not be packed into, or read back out of, a CAR.
 */
public class PackagingException extends RuntimeException {

    public PackagingException(String message) {
        super(message);
    }

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
