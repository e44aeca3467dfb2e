package com.funnelforge.collaborator;

import com.funnelforge.core.events.EventBus;
import com.funnelforge.core.events.FunnelEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Writes automation log records to SLF4J and republishes them as {@code log.<type>} events.
 */
public class EventBusLogSink implements LogSink {

    private static final Logger log = LoggerFactory.getLogger("com.funnelforge.automation");

    private final EventBus eventBus;
    private final Clock clock;

    public EventBusLogSink(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public void record(String type, String message, String status, Map<String, Object> metadata) {
        switch (status != null ? status : "info") {
            case "error" -> log.error("[{}] {} {}", type, message, metadata);
            case "warning" -> log.warn("[{}] {} {}", type, message, metadata);
            default -> log.info("[{}] {} {}", type, message, metadata);
        }

        var payload = new HashMap<String, Object>();
        if (metadata != null) {
            payload.putAll(metadata);
        }
        payload.put("message", message);
        payload.put("status", status);
        eventBus.publish(new FunnelEvent("log." + type, null, payload, Instant.now(clock)));
    }
}
