package com.dealbot.client.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderInfo {

    private String address;
    private String name;

    /** Base URL of the provider's PDP service. */
    private String serviceUrl;

    /** Multiaddr the provider is expected to advertise to IPNI. */
    private String multiaddr;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private boolean ipfsEnabled = true;

    public String normalizedServiceUrl() {
        if (serviceUrl == null) {
            return null;
        }
        return serviceUrl.endsWith("/") ? serviceUrl.substring(0, serviceUrl.length() - 1) : serviceUrl;
    }
}
