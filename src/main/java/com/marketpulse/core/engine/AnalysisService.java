package com.marketpulse.core.engine;

import com.marketpulse.core.model.AnalysisRequest;
import com.marketpulse.core.model.Checkpoint;
import com.marketpulse.core.model.FinalReport;
import com.marketpulse.core.persistence.CheckpointStore;
import com.marketpulse.core.session.AnalysisSession;
import com.marketpulse.core.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for running analyses: validates the request, opens and registers
 * the session, and hands it to the {@link StageSequencer} with the configured stages.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);
    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final AnalysisRequestValidator validator;
    private final StageSequencer sequencer;
    private final StageCatalog catalog;
    private final SessionRegistry registry;
    private final CheckpointStore checkpointStore;
    private final Clock clock;

    public AnalysisService(AnalysisRequestValidator validator, StageSequencer sequencer, StageCatalog catalog,
                           SessionRegistry registry, CheckpointStore checkpointStore, Clock clock) {
        this.validator = validator;
        this.sequencer = sequencer;
        this.catalog = catalog;
        this.registry = registry;
        this.checkpointStore = checkpointStore;
        this.clock = clock;
    }

    /**
     * Validates the request and opens a registered session without running it.
     *
     * @throws InputValidationException when the request is rejected
     */
    public AnalysisSession open(AnalysisRequest request) {
        validator.validate(request);
        String sessionId = request.sessionId() == null || request.sessionId().isBlank()
                ? generateSessionId()
                : request.sessionId().trim();
        var session = new AnalysisSession(sessionId, request.withSessionId(sessionId), clock.instant());
        try {
            registry.register(session);
        } catch (IllegalStateException e) {
            throw new InputValidationException(List.of("session_id " + sessionId + " is already in use"), e);
        }
        log.info("Opened session {} for segment '{}'", sessionId, request.segment());
        return session;
    }

    /**
     * Runs an opened session through every configured stage. The session is archived
     * afterwards, whatever the outcome; its checkpoints stay in the store.
     */
    public FinalReport run(AnalysisSession session) {
        try {
            return sequencer.execute(session, catalog.stages());
        } finally {
            registry.archive(session);
        }
    }

    /** Opens and runs a session in one call. */
    public FinalReport analyze(AnalysisRequest request) {
        return run(open(request));
    }

    public Optional<AnalysisSession> find(String sessionId) {
        return registry.find(sessionId);
    }

    public boolean cancel(String sessionId) {
        return registry.cancel(sessionId);
    }

    public List<Checkpoint> checkpoints(String sessionId) {
        return checkpointStore.readSession(sessionId);
    }

    /**
     * Generates a session ID in the format MP-yyyyMMdd-xxxxxxxx.
     */
    public String generateSessionId() {
        String hex = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "MP-" + ID_DATE.format(clock.instant()) + "-" + hex;
    }
}
