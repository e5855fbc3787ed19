package com.whereq.governor.exception;

/**
 * Exception thrown when a job cannot be admitted and the delayed queue is full.
 * No job state is created.
 */
public class QueueFullException extends GovernorException {
    private final String jobId;

    public QueueFullException(String jobId, int maxQueueDepth) {
        super("Job " + jobId + " rejected: delayed queue is full (depth >= " + maxQueueDepth + ")");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
