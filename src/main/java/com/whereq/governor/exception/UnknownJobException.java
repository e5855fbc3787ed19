package com.whereq.governor.exception;

public class UnknownJobException extends GovernorException {
    public UnknownJobException(String jobId) {
        super("Job not found: " + jobId);
    }
}
