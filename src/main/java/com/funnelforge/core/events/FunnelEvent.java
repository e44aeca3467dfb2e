package com.funnelforge.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the decision engine, consumed by the log sink, SSE clients and tests.
 *
 * @param eventType event type (e.g. "task.completed", "spend.pending", "arm.pruned")
 * @param subjectId the task, decision or arm the event is about (nullable for engine-wide events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record FunnelEvent(
    String eventType,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
