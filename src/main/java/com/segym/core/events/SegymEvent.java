package com.segym.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while the repair loop runs, used for CLI progress output.
 *
 * @param eventType  event type (e.g. "loop.started", "generation.evaluated")
 * @param runId      the run this event belongs to
 * @param generation population generation the event relates to, -1 for run-level events
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record SegymEvent(
    String eventType,
    String runId,
    int generation,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
