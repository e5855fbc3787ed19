package com.whereq.governor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time reading of system load. Replaced wholesale on every poll.
 */
@Value
@Builder
public class MetricsSnapshot {
    /**
     * Placeholder used before the first successful poll
     */
    public static final MetricsSnapshot UNKNOWN = new MetricsSnapshot(0.0, 0.0, 0.0, Instant.EPOCH);

    double cpuPercent;
    double memMb;
    double accelMemMb;
    Instant observedAt;

    public boolean isUnknown() {
        return Instant.EPOCH.equals(observedAt);
    }
}
