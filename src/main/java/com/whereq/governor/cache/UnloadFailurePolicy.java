package com.whereq.governor.cache;

/**
 * What eviction does with an entry whose unload failed
 */
public enum UnloadFailurePolicy {
    /**
     * Remove the entry from accounting anyway and log the failure
     */
    REMOVE,

    /**
     * Keep the entry resident, mark it stale and skip it for the rest of the sweep.
     * A later sweep retries it.
     */
    RETAIN_STALE
}
