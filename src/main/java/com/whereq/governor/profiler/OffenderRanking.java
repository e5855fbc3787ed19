package com.whereq.governor.profiler;

/**
 * Ranking used by {@code Profiler.topOffenders}
 */
public enum OffenderRanking {
    /**
     * Slowest single span
     */
    TIME,

    /**
     * Largest single memory growth
     */
    MEMORY
}
