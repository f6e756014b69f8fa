package com.dealbot.core.storage;

import com.dealbot.client.provider.ProviderInfo;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DealConfiguration {

    private ProviderInfo provider;
    private String walletAddress;

    /** Package the payload as a CAR and track IPNI indexing. */
    private boolean enableIpni;
}
