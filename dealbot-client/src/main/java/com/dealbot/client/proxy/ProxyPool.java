package com.dealbot.client.proxy;

import java.util.Optional;

/**
 * Supplies an upstream proxy per retrieval attempt. Callers ask again on every attempt.
 */
public interface ProxyPool {

    Optional<String> nextProxy();

    int size();
}
