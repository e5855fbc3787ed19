package com.whereq.governor.service;

import com.whereq.governor.exception.UnknownJobException;
import com.whereq.governor.model.Job;
import com.whereq.governor.model.JobState;
import com.whereq.governor.model.ResourceRequirement;
import com.whereq.governor.model.ResourceUsage;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Track job records and their state in memory.
 *
 * Not thread-safe: only used by {@link BudgetManager} while it holds the governor lock.
 * Terminal jobs are retained so their ids can never be reused.
 */
@Slf4j
class JobStatusTracker {

    private final Clock clock;
    private final Map<String, Job> jobs = new HashMap<>();
    private final Map<JobState, Set<String>> idsByState = new EnumMap<>(JobState.class);
    private long nextSequence;

    JobStatusTracker(Clock clock) {
        this.clock = clock;
        for (JobState state : JobState.values()) {
            idsByState.put(state, new LinkedHashSet<>());
        }
    }

    boolean contains(String jobId) {
        return jobs.containsKey(jobId);
    }

    /**
     * Get a job record
     *
     * @throws UnknownJobException when the id was never registered
     */
    Job require(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new UnknownJobException(jobId);
        }
        return job;
    }

    Optional<Job> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Create a job record in its initial state
     */
    Job create(String jobId, String kind, ResourceRequirement requirement, Map<String, Object> metadata,
               JobState state, String reason) {
        Instant now = clock.instant();
        Job job = Job.builder()
            .jobId(jobId)
            .kind(kind)
            .requirement(requirement)
            .sequence(nextSequence++)
            .state(state)
            .submittedAt(now)
            .lastTransitionAt(now)
            .reason(reason)
            .metadata(metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
            .build();
        jobs.put(jobId, job);
        idsByState.get(state).add(jobId);
        return job;
    }

    /**
     * Move a job to a new state and stamp the matching timestamp
     */
    void updateStatus(Job job, JobState status, String reason) {
        Instant now = clock.instant();
        JobState previous = job.getState();

        idsByState.get(previous).remove(job.getJobId());
        idsByState.get(status).add(job.getJobId());

        job.setState(status);
        job.setReason(reason);
        job.setLastTransitionAt(now);

        // Update timestamps based on status
        switch (status) {
            case RUNNING -> job.setStartedAt(now);
            case COMPLETE, ERROR, CANCELED -> job.setFinishedAt(now);
            default -> { }
        }

        log.debug("Job {} status updated: {} → {}", job.getJobId(), previous, status);
    }

    /**
     * Delayed jobs in submission order
     */
    List<Job> delayedInOrder() {
        List<Job> delayed = new ArrayList<>();
        for (String jobId : idsByState.get(JobState.DELAYED)) {
            delayed.add(jobs.get(jobId));
        }
        delayed.sort((a, b) -> Long.compare(a.getSequence(), b.getSequence()));
        return delayed;
    }

    /**
     * Declared cost of every job holding capacity
     */
    ResourceUsage reserved() {
        ResourceUsage total = ResourceUsage.ZERO;
        for (JobState state : List.of(JobState.QUEUED, JobState.RUNNING)) {
            for (String jobId : idsByState.get(state)) {
                total = total.add(jobs.get(jobId).getRequirement().toUsage());
            }
        }
        return total;
    }

    int holdingCount() {
        return count(JobState.QUEUED) + count(JobState.RUNNING);
    }

    int count(JobState state) {
        return idsByState.get(state).size();
    }

    int size() {
        return jobs.size();
    }

    /**
     * Job ids per state, in the order they entered the state
     */
    Map<JobState, List<String>> idsByState() {
        Map<JobState, List<String>> copy = new EnumMap<>(JobState.class);
        idsByState.forEach((state, ids) -> copy.put(state, List.copyOf(ids)));
        return copy;
    }
}
