package com.whereq.governor.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: one JSON line per event on the {@code governor.events} logger
 */
@Slf4j
public class LoggingEventSink implements EventSink {

    private static final Logger EVENTS = LoggerFactory.getLogger("governor.events");

    private final ObjectMapper objectMapper;

    public LoggingEventSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void accept(GovernorEvent event) {
        if (!EVENTS.isInfoEnabled()) {
            return;
        }
        try {
            EVENTS.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event {}", event.getName(), e);
        }
    }
}
