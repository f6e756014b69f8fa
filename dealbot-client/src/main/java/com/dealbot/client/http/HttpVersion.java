package com.dealbot.client.http;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum HttpVersion {
    HTTP_1_1("1.1"),
    HTTP_2("2");

    private final String label;
}
