package com.dealbot.client.http;

/**
 * Failure talking to a provider or indexer. {@code statusCode} is 0 when no response arrived.
 */
public class HttpRequestException extends RuntimeException {

    private final int statusCode;
    private final boolean retryable;

    public HttpRequestException(String message, int statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public HttpRequestException(String message, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public static HttpRequestException fromStatus(int statusCode, String url) {
        // 408, 429 and 5xx are worth another attempt; other 4xx will fail the same way again
        boolean retryable = statusCode == 408 || statusCode == 429 || statusCode >= 500;
        return new HttpRequestException("HTTP " + statusCode + " from " + url, statusCode, retryable);
    }

    public boolean isRetryable() { return retryable; }
    public int getStatusCode() { return statusCode; }
    public boolean isTimeout() { return statusCode == 0 && getMessage() != null && getMessage().contains("timed out"); }
}
