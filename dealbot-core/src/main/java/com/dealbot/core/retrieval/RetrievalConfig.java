package com.dealbot.core.retrieval;

import com.dealbot.client.provider.ProviderInfo;
import com.dealbot.data.entity.Deal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RetrievalConfig {

    private Deal deal;
    private ProviderInfo provider;
}
