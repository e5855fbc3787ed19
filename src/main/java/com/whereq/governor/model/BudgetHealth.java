package com.whereq.governor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Lightweight health summary without the per-job detail
 */
@Value
@Builder
public class BudgetHealth {
    BudgetLimits limits;
    int queued;
    int delayed;
    int running;
    int seenJobs;
    int registeredAssets;
    double cacheFootprintMb;
    Instant lastEvaluation;
    MetricsSnapshot metrics;
}
