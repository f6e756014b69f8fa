package com.dealbot.client.provider;

import com.dealbot.common.util.LogFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderRegistry {

    private final ProviderProperties properties;

    public List<ProviderInfo> getActiveProviders() {
        return properties.getProviders().stream()
            .filter(ProviderInfo::isActive)
            .filter(p -> p.getAddress() != null && !p.getAddress().isBlank())
            .toList();
    }

    public List<ProviderInfo> getAllProviders() {
        return List.copyOf(properties.getProviders());
    }

    public Optional<ProviderInfo> findByAddress(String address) {
        if (address == null) {
            return Optional.empty();
        }
        Optional<ProviderInfo> match = properties.getProviders().stream()
            .filter(p -> address.equalsIgnoreCase(p.getAddress()))
            .findFirst();
        if (match.isEmpty()) {
            log.debug("[PROVIDER] Unknown provider | address={}", LogFormat.abbreviate(address));
        }
        return match;
    }
}
