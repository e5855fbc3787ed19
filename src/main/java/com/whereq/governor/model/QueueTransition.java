package com.whereq.governor.model;

import lombok.Value;

import java.time.Instant;

/**
 * A state change produced by a queue refresh
 */
@Value
public class QueueTransition {
    String jobId;
    JobState from;
    JobState to;
    Instant at;
}
