package com.whereq.governor.cache;

import com.whereq.governor.model.AssetEntry;

/**
 * Performs the external cleanup of an evicted asset
 */
@FunctionalInterface
public interface AssetUnloader {

    /**
     * Unload an asset
     *
     * @param entry the entry being evicted
     * @return true when the asset was released
     */
    boolean unload(AssetEntry entry);

    /**
     * Unloader for assets that need no external cleanup
     */
    static AssetUnloader noop() {
        return entry -> true;
    }
}
