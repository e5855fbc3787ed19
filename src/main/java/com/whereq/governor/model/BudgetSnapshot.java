package com.whereq.governor.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the governor: limits, last metrics, job ids per state and cache footprint
 */
@Value
@Builder
public class BudgetSnapshot {
    BudgetLimits limits;
    MetricsSnapshot metrics;

    /**
     * Job ids in submission order for every state, including terminal ones
     */
    Map<JobState, List<String>> jobIds;

    double cacheFootprintMb;

    List<AssetEntry> assets;

    public List<String> idsIn(JobState state) {
        return jobIds.getOrDefault(state, List.of());
    }
}
