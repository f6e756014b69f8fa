package com.dealbot.client.provider;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider roster bound from {@code dealbot.providers}.
 */
@Component
@ConfigurationProperties(prefix = "dealbot")
@Getter
@Setter
public class ProviderProperties {

    private List<ProviderInfo> providers = new ArrayList<>();
}
