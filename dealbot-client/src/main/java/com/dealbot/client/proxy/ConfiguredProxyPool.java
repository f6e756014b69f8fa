package com.dealbot.client.proxy;

import com.dealbot.common.util.LogFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Picks a random proxy from {@code dealbot.proxy.list} (comma separated). An empty list means direct connections.
 */
@Component
@Slf4j
public class ConfiguredProxyPool implements ProxyPool {

    private final List<String> proxies;

    public ConfiguredProxyPool(@Value("${dealbot.proxy.list:}") String proxyList) {
        this.proxies = Arrays.stream(proxyList.split(","))
            .map(String::trim)
            .filter(p -> !p.isEmpty())
            .toList();
        log.info("[PROXY] Proxy pool initialized | size={} | proxies={}", proxies.size(),
            proxies.stream().map(LogFormat::maskProxy).toList());
    }

    @Override
    public Optional<String> nextProxy() {
        if (proxies.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(proxies.get(ThreadLocalRandom.current().nextInt(proxies.size())));
    }

    @Override
    public int size() {
        return proxies.size();
    }
}
