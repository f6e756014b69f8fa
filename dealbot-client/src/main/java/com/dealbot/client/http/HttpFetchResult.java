package com.dealbot.client.http;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class HttpFetchResult {
    private byte[] data;
    private HttpMetrics metrics;
}
