package com.whereq.governor.model;

/**
 * Outcome reported by the caller when a job finishes
 */
public enum JobOutcome {
    COMPLETE(JobState.COMPLETE),
    ERROR(JobState.ERROR),
    CANCELED(JobState.CANCELED);

    private final JobState terminalState;

    JobOutcome(JobState terminalState) {
        this.terminalState = terminalState;
    }

    public JobState terminalState() {
        return terminalState;
    }
}
