package com.whereq.governor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of {@code BudgetManager.registerJob}
 */
@Value
@Builder
public class AdmissionResult {
    String jobId;

    /**
     * Either {@link JobState#QUEUED} or {@link JobState#DELAYED}
     */
    JobState queueState;

    /**
     * Limit that blocked admission, null when queued
     */
    String reason;

    MetricsSnapshot metrics;

    BudgetLimits limits;

    public boolean isQueued() {
        return queueState == JobState.QUEUED;
    }
}
