package com.dealbot.common.util;

public final class LogFormat {

    private LogFormat() {}

    /** {@code 0x1234abcd...} style shortening for addresses and CIDs in log lines. */
    public static String abbreviate(String value) {
        return abbreviate(value, 12);
    }

    public static String abbreviate(String value, int keep) {
        if (value == null) {
            return "null";
        }
        if (value.length() <= keep) {
            return value;
        }
        return value.substring(0, keep) + "...";
    }

    public static String maskProxy(String proxyUrl) {
        if (proxyUrl == null || proxyUrl.isBlank()) {
            return "direct";
        }
        int at = proxyUrl.lastIndexOf('@');
        int scheme = proxyUrl.indexOf("://");
        if (at > 0 && scheme > 0 && at > scheme) {
            return proxyUrl.substring(0, scheme + 3) + "***@" + proxyUrl.substring(at + 1);
        }
        return proxyUrl;
    }
}
