package com.whereq.governor.profiler;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated view over the profiler log
 */
@Value
@Builder
public class ProfilerDashboard {
    /**
     * Span names with the highest total duration
     */
    List<AggregateStats> topTime;

    /**
     * Span names with the highest total memory growth
     */
    List<AggregateStats> topMemory;

    Map<String, CategoryStats> categories;

    List<ProfileMark> recentMarks;

    List<ProfileSpan> recentSpans;

    Instant generatedAt;
}
