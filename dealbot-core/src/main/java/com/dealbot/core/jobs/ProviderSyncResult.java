package com.dealbot.core.jobs;

import com.dealbot.client.provider.ProviderInfo;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Getter
@Builder
public class ProviderSyncResult {

    @Singular("activeProvider")
    private final List<ProviderInfo> activeProviders;

    @Singular("removedAddress")
    private final List<String> removedAddresses;

    private final long pausedCount;
}
