package com.whereq.governor.event;

/**
 * Names of the events the governor emits
 */
public final class EventNames {
    public static final String JOB_REGISTERED = "job.registered";
    public static final String JOB_STARTED = "job.started";
    public static final String JOB_FINISHED = "job.finished";
    public static final String JOB_PROMOTED = "job.delayed->queued";
    public static final String LIMITS_UPDATED = "limits.updated";
    public static final String ASSET_REGISTERED = "asset.registered";
    public static final String ASSET_EVICTED = "asset.evicted";
    public static final String PROFILER_SNAPSHOT = "profiler.snapshot";
    public static final String PROFILER_RESET = "profiler.reset";

    private EventNames() {
    }
}
