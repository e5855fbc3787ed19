package com.whereq.governor.exception;

/**
 * Exception thrown when a job id is registered twice
 */
public class DuplicateJobException extends GovernorException {
    public DuplicateJobException(String jobId) {
        super("Job already registered: " + jobId);
    }
}
