package com.dealbot.client.http;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
public class HttpFetchRequest {

    private String url;

    @Builder.Default
    private String method = "GET";

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    @Builder.Default
    private HttpVersion httpVersion = HttpVersion.HTTP_1_1;

    /** Upstream proxy for this attempt; null means a direct connection. */
    private String proxyUrl;
}
