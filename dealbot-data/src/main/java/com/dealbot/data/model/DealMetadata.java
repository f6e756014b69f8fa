package com.dealbot.data.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * Per-deal strategy metadata keyed by service type, stored in the {@code deals.metadata} JSONB column.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DealMetadata {

    @JsonProperty("direct_sp")
    private DirectMetadata direct;

    @JsonProperty("ipfs_pin")
    private ContentAddressedMetadata contentAddressed;

    /**
     * Returns a copy with {@code contribution} stored under its service type, replacing any earlier value.
     */
    public DealMetadata merge(StrategyMetadata contribution) {
        DealMetadata merged = new DealMetadata(direct, contentAddressed);
        if (contribution instanceof DirectMetadata directMetadata) {
            merged.setDirect(directMetadata);
        } else if (contribution instanceof ContentAddressedMetadata contentMetadata) {
            merged.setContentAddressed(contentMetadata);
        }
        return merged;
    }

    @JsonIgnore
    public Optional<ContentAddressedMetadata> contentAddressed() {
        return Optional.ofNullable(contentAddressed);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return direct == null && contentAddressed == null;
    }
}
