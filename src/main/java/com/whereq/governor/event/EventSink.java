package com.whereq.governor.event;

/**
 * Receives one record per governor transition.
 * Delivery is at-most-once; implementations must not block for long.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Accept an event
     *
     * @param event the event record
     */
    void accept(GovernorEvent event);

    /**
     * Sink that drops everything
     */
    static EventSink noop() {
        return event -> { };
    }
}
