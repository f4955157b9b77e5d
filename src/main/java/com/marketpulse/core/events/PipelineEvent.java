package com.marketpulse.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during session execution, used for SSE streaming and CLI progress output.
 *
 * @param eventType event type (e.g. "session.started", "stage.completed", "quality_gate.rejected")
 * @param sessionId the session this event belongs to
 * @param stage     the stage this event relates to (nullable for session-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String sessionId,
    String stage,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String SESSION_STARTED = "session.started";
    public static final String SESSION_COMPLETED = "session.completed";
    public static final String SESSION_FAILED = "session.failed";
    public static final String STAGE_STARTED = "stage.started";
    public static final String STAGE_COMPLETED = "stage.completed";
    public static final String STAGE_FAILED = "stage.failed";
    public static final String GATE_PASSED = "quality_gate.passed";
    public static final String GATE_REJECTED = "quality_gate.rejected";

    /** Whether no further events follow for this session. */
    public boolean isTerminal() {
        return SESSION_COMPLETED.equals(eventType) || SESSION_FAILED.equals(eventType);
    }
}
