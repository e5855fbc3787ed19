package com.whereq.governor.support;

import com.whereq.governor.event.EventSink;
import com.whereq.governor.event.GovernorEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every delivered event for assertions
 */
public class RecordingEventSink implements EventSink {

    private final List<GovernorEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void accept(GovernorEvent event) {
        events.add(event);
    }

    public List<GovernorEvent> events() {
        return List.copyOf(events);
    }

    public List<String> names() {
        return events.stream().map(GovernorEvent::getName).toList();
    }

    public List<GovernorEvent> named(String name) {
        return events.stream().filter(e -> e.getName().equals(name)).toList();
    }

    public void clear() {
        events.clear();
    }
}
