package com.whereq.governor.profiler;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Accumulated figures for one span name within its category
 */
@Value
@Builder
public class AggregateStats {
    String name;
    String category;
    long count;
    double totalMs;
    double maxMs;
    double totalMemoryMb;
    double maxMemoryMb;
    Instant lastTimestamp;

    public double getAvgMs() {
        return count == 0 ? 0.0 : totalMs / count;
    }

    public double getAvgMemoryMb() {
        return count == 0 ? 0.0 : totalMemoryMb / count;
    }
}
