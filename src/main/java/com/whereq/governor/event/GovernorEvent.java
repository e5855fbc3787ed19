package com.whereq.governor.event;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Structured record handed to the {@link EventSink}
 */
@Value
public class GovernorEvent {
    String name;
    Instant timestamp;
    Map<String, Object> payload;
}
