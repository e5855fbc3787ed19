package com.whereq.governor.profiler;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A timed interval of instrumented work. Immutable once recorded.
 */
@Value
@Builder
public class ProfileSpan {
    String name;
    String category;
    Instant startTs;
    Instant endTs;
    double durationMs;

    /**
     * Growth of the memory reading between start and end, never negative
     */
    double memoryDeltaMb;

    Map<String, Object> metadata;
}
