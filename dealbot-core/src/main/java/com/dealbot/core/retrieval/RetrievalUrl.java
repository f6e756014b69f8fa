package com.dealbot.core.retrieval;

import com.dealbot.client.http.HttpVersion;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class RetrievalUrl {

    private String url;

    @Builder.Default
    private String method = "GET";

    @Builder.Default
    private Map<String, String> headers = Map.of();

    @Builder.Default
    private HttpVersion httpVersion = HttpVersion.HTTP_1_1;
}
