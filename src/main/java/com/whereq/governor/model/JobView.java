package com.whereq.governor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only copy of a job record
 */
@Value
@Builder
public class JobView {
    String jobId;
    String kind;
    ResourceRequirement requirement;
    JobState state;
    Instant submittedAt;
    Instant startedAt;
    Instant finishedAt;
    Instant lastTransitionAt;
    String reason;
    Map<String, Object> metadata;
}
