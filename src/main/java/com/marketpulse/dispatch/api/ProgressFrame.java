package com.marketpulse.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketpulse.core.events.PipelineEvent;

import java.time.Instant;
import java.util.Map;

/**
 * Data of one SSE frame on {@code /api/v1/analyses/{id}/events}.
 *
 * @param sequence position of the frame within its stream, starting at 1; frames
 *                 for events published before the client attached come first
 * @param terminal whether this is the last frame of the stream
 */
public record ProgressFrame(
    @JsonProperty("session_id") String sessionId,
    long sequence,
    String type,
    String stage,
    Map<String, Object> detail,
    Instant timestamp,
    boolean terminal
) {

    static ProgressFrame of(PipelineEvent event, long sequence) {
        return new ProgressFrame(event.sessionId(), sequence, event.eventType(), event.stage(),
                event.payload() == null ? Map.of() : event.payload(), event.timestamp(),
                event.isTerminal());
    }
}
