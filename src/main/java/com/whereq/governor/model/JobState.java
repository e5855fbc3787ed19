package com.whereq.governor.model;

import java.util.Locale;

/**
 * Job lifecycle states
 *
 * State transitions:
 * QUEUED → RUNNING → {COMPLETE, ERROR, CANCELED}
 * DELAYED → QUEUED (on refresh, once capacity frees)
 * DELAYED → CANCELED (finished before it was ever admitted)
 */
public enum JobState {
    /**
     * Admitted, capacity reserved, not started by the caller yet
     */
    QUEUED,

    /**
     * Could not be admitted at submission time, no capacity reserved
     */
    DELAYED,

    /**
     * Caller reported the job as started
     */
    RUNNING,

    /**
     * Completed successfully
     */
    COMPLETE,

    /**
     * Terminated with error
     */
    ERROR,

    /**
     * Caller no longer wants the job counted
     */
    CANCELED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR || this == CANCELED;
    }

    /**
     * Check if jobs in this state count against the budget
     */
    public boolean holdsCapacity() {
        return this == QUEUED || this == RUNNING;
    }

    /**
     * Lower-case name used in event payloads
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
