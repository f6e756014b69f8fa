package com.dealbot.client.http;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class HttpMetrics {
    private long ttfbMs;
    private long totalTimeMs;
    private long downloadTimeMs;
    private String proxyUrl;
    private int statusCode;
    private long responseSize;
    private Instant timestamp;
    private String httpVersion;
}
