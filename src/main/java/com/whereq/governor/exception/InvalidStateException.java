package com.whereq.governor.exception;

import com.whereq.governor.model.JobState;

/**
 * Exception thrown when an operation is not legal from the job's current state,
 * e.g. starting a delayed job or finishing a terminal one
 */
public class InvalidStateException extends GovernorException {
    private final JobState currentState;

    public InvalidStateException(String jobId, JobState currentState, String operation) {
        super("Cannot " + operation + " job " + jobId + " in state " + currentState);
        this.currentState = currentState;
    }

    public JobState getCurrentState() {
        return currentState;
    }
}
