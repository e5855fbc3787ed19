package com.whereq.governor.resource;

import com.whereq.governor.model.MetricsSnapshot;

import java.util.OptionalDouble;

/**
 * Supplies point-in-time system load readings.
 * The governor polls it and treats it as synchronous; it does not own or average the data.
 */
@FunctionalInterface
public interface MetricsSource {

    /**
     * Take a reading
     *
     * @return the current snapshot
     * @throws RuntimeException when the reading cannot be taken
     */
    MetricsSnapshot poll();

    /**
     * Cheap memory reading used by the profiler around spans.
     * Empty when the source does not expose memory outside of {@link #poll()}.
     */
    default OptionalDouble currentMemoryMb() {
        return OptionalDouble.empty();
    }
}
