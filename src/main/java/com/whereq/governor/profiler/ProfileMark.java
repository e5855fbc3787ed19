package com.whereq.governor.profiler;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * An instantaneous, timestamped instrumentation event
 */
@Value
public class ProfileMark {
    String name;
    String category;
    Instant ts;
    Map<String, Object> metadata;
}
