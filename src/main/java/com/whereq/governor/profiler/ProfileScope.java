package com.whereq.governor.profiler;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for an open span. Use with try-with-resources:
 * <pre>
 * try (ProfileScope scope = profiler.span("decode", "io", Map.of())) {
 *     ...
 * }
 * </pre>
 * The span is recorded once, on the first {@link #close()}.
 */
public class ProfileScope implements AutoCloseable {

    private final Profiler profiler;
    private final String name;
    private final String category;
    private final Map<String, Object> metadata;
    private final Instant start;
    private final OptionalDouble startMemoryMb;
    private final AtomicBoolean closed = new AtomicBoolean();

    ProfileScope(Profiler profiler, String name, String category, Map<String, Object> metadata,
                 Instant start, OptionalDouble startMemoryMb) {
        this.profiler = profiler;
        this.name = name;
        this.category = category;
        this.metadata = new LinkedHashMap<>(metadata);
        this.start = start;
        this.startMemoryMb = startMemoryMb;
    }

    /**
     * Attach the failure that ended the span; recorded as the {@code exception} metadata entry
     */
    public ProfileScope fail(Throwable error) {
        synchronized (metadata) {
            metadata.put("exception", error.getClass().getName() + ": " + error.getMessage());
        }
        return this;
    }

    public Instant getStart() {
        return start;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Map<String, Object> recorded;
        synchronized (metadata) {
            recorded = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }
        profiler.complete(name, category, recorded, start, startMemoryMb);
    }
}
