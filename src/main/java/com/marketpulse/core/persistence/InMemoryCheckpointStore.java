package com.marketpulse.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.core.model.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link CheckpointStore}. State is lost on restart.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCheckpointStore.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Checkpoint>> bySession = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InMemoryCheckpointStore(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Checkpoint append(String sessionId, String category, String label, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new CheckpointWriteException(
                    "Failed to serialize checkpoint '" + label + "' for session " + sessionId, e);
        }
        var checkpoint = new Checkpoint(sessionId, sequence.incrementAndGet(), label, category, json, clock.instant());
        bySession.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(checkpoint);
        log.debug("Appended checkpoint #{} '{}' ({}) for session {}", checkpoint.sequence(), label, category, sessionId);
        return checkpoint;
    }

    @Override
    public List<Checkpoint> readSession(String sessionId) {
        List<Checkpoint> checkpoints = bySession.get(sessionId);
        return checkpoints == null ? List.of() : List.copyOf(checkpoints);
    }

    @Override
    public List<String> listSessions() {
        var ids = new ArrayList<>(bySession.keySet());
        ids.sort(null);
        return ids;
    }

    @Override
    public String describe() {
        return "in-memory";
    }
}
