package com.whereq.governor.event;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbound event queue in front of an {@link EventSink}.
 * Events are buffered in a Reactor sink and delivered on the given scheduler,
 * so the emitting thread never runs sink code while holding governor locks.
 */
@Slf4j
public class EventPublisher implements AutoCloseable {

    private static final Duration EMIT_CONTENTION_WINDOW = Duration.ofMillis(50);

    private final Sinks.Many<GovernorEvent> outbound = Sinks.many().unicast().onBackpressureBuffer();
    private final Clock clock;
    private final AtomicLong dropped = new AtomicLong();

    public EventPublisher(EventSink sink, Scheduler scheduler, Clock clock) {
        this.clock = clock;
        outbound.asFlux()
            .publishOn(scheduler)
            .subscribe(event -> deliver(sink, event),
                error -> log.error("Event dispatch stopped", error));
    }

    /**
     * Queue an event for delivery
     *
     * @param name event name, see {@link EventNames}
     * @param payload event payload, copied
     */
    public void publish(String name, Map<String, Object> payload) {
        GovernorEvent event = new GovernorEvent(name, clock.instant(), Collections.unmodifiableMap(new LinkedHashMap<>(payload)));
        try {
            outbound.emitNext(event, Sinks.EmitFailureHandler.busyLooping(EMIT_CONTENTION_WINDOW));
        } catch (Sinks.EmissionException e) {
            dropped.incrementAndGet();
            log.warn("Dropped event {}: {}", name, e.getMessage());
        }
    }

    /**
     * Number of events that could not be queued
     */
    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public void close() {
        // Pending events are still drained after completion
        outbound.tryEmitComplete();
        log.debug("Event publisher closed ({} dropped)", dropped.get());
    }

    private void deliver(EventSink sink, GovernorEvent event) {
        try {
            sink.accept(event);
        } catch (RuntimeException e) {
            // Don't let a failing sink stop the dispatch loop
            dropped.incrementAndGet();
            log.error("Failed to deliver event {}: {}", event.getName(), e.getMessage());
        }
    }

    /**
     * Build an ordered payload from alternating keys and values; null values are kept
     */
    public static Map<String, Object> payload(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Payload needs key/value pairs");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            payload.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return payload;
    }
}
