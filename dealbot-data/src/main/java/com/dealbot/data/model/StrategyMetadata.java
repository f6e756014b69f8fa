package com.dealbot.data.model;

import com.dealbot.common.constants.ServiceType;

/**
 * Metadata contributed by one storage strategy. The set of variants is closed: one per service type.
 */
public sealed interface StrategyMetadata permits DirectMetadata, ContentAddressedMetadata {

    ServiceType serviceType();
}
