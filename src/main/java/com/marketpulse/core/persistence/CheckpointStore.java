package com.marketpulse.core.persistence;

import com.marketpulse.core.model.Checkpoint;

import java.util.List;

/**
 * Append-only store of session checkpoints. Implementations never overwrite
 * or delete a record.
 */
public interface CheckpointStore {

    /**
     * Appends one immutable checkpoint.
     *
     * @param sessionId session the record belongs to
     * @param category  category tag
     * @param label     stage label
     * @param payload   value serialized to JSON
     * @return the stored checkpoint
     * @throws CheckpointWriteException if the payload cannot be serialized or stored
     */
    Checkpoint append(String sessionId, String category, String label, Object payload);

    /**
     * Returns every checkpoint of a session in append order; empty when the session is unknown.
     */
    List<Checkpoint> readSession(String sessionId);

    /** All session ids that have at least one checkpoint. */
    List<String> listSessions();

    /** Short description of the backing storage, for health and CLI output. */
    String describe();
}
