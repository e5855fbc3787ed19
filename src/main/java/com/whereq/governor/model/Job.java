package com.whereq.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Mutable job record owned by the governor.
 * Only touched while the governor lock is held; callers receive {@link JobView} copies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    /**
     * Caller-assigned identifier, unique for the lifetime of the process
     */
    private String jobId;

    /**
     * Opaque job type
     */
    private String kind;

    /**
     * Declared cost, reserved while the job is queued or running
     */
    private ResourceRequirement requirement;

    /**
     * Submission order, used for FIFO promotion of delayed jobs
     */
    private long sequence;

    private JobState state;

    private Instant submittedAt;

    private Instant startedAt;

    private Instant finishedAt;

    private Instant lastTransitionAt;

    /**
     * Why the job is delayed, or the reason given when it finished
     */
    private String reason;

    /**
     * Caller-specific extension data
     */
    @Builder.Default
    private Map<String, Object> metadata = Map.of();

    public JobView toView() {
        return JobView.builder()
            .jobId(jobId)
            .kind(kind)
            .requirement(requirement)
            .state(state)
            .submittedAt(submittedAt)
            .startedAt(startedAt)
            .finishedAt(finishedAt)
            .lastTransitionAt(lastTransitionAt)
            .reason(reason)
            .metadata(metadata)
            .build();
    }
}
