package com.whereq.governor.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Map;

/**
 * A lazily loaded object tracked by the asset cache
 */
@Value
@With
@Builder
public class AssetEntry {
    String assetId;

    /**
     * Resident size in MB
     */
    double sizeMb;

    Instant registeredAt;

    Instant lastUsedAt;

    /**
     * Registration order, breaks ties between equal {@code lastUsedAt} values
     */
    long sequence;

    /**
     * Set when an unload attempt failed and the entry was retained
     */
    boolean stale;

    Map<String, Object> metadata;
}
