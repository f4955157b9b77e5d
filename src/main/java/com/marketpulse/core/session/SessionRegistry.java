package com.marketpulse.core.session;

import com.marketpulse.core.events.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide index of live and archived sessions, used by the boundary for
 * status reporting and cancellation.
 * <p>
 * A finished session is archived: its stage payloads are dropped and only status,
 * verdicts and warnings stay. Archived sessions are evicted once older than the
 * retention window, and the oldest go first when more than {@code maxArchived}
 * are kept. Live sessions are never evicted. Eviction also drops the session's
 * event history.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, AnalysisSession> sessions = new ConcurrentHashMap<>();
    private final SessionProperties properties;
    private final EventBus eventBus;
    private final Clock clock;

    public SessionRegistry(SessionProperties properties, EventBus eventBus, Clock clock) {
        this.properties = properties;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Registers a new session.
     *
     * @throws IllegalStateException if a session with the same id is already registered
     */
    public void register(AnalysisSession session) {
        AnalysisSession existing = sessions.putIfAbsent(session.getId(), session);
        if (existing != null) {
            throw new IllegalStateException("Session already exists: " + session.getId());
        }
        log.debug("Registered session {}", session.getId());
        evictExpired();
    }

    public Optional<AnalysisSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Requests cancellation. The running stage finishes; no further stage starts.
     *
     * @return true if the session was active and is now flagged as cancelled
     */
    public boolean cancel(String sessionId) {
        AnalysisSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        boolean cancelled = session.cancel();
        if (cancelled) {
            log.info("Cancellation requested for session {}", sessionId);
        }
        return cancelled;
    }

    /** Archives a finished session and evicts whatever retention no longer allows. */
    public void archive(AnalysisSession session) {
        if (session.archive(clock.instant())) {
            log.debug("Archived session {} ({})", session.getId(), session.getStatus());
        }
        evictExpired();
    }

    /**
     * Evicts archived sessions past the retention window, then the oldest ones
     * beyond the size limit.
     *
     * @return number of sessions evicted
     */
    public synchronized int evictExpired() {
        Instant cutoff = clock.instant().minus(properties.getRetention());
        List<AnalysisSession> archived = sessions.values().stream()
                .filter(AnalysisSession::isArchived)
                .sorted(Comparator.comparing(AnalysisSession::getArchivedAt))
                .toList();
        int excess = archived.size() - Math.max(0, properties.getMaxArchived());
        int evicted = 0;
        for (AnalysisSession session : archived) {
            if (evicted < excess || session.getArchivedAt().isBefore(cutoff)) {
                evict(session);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} archived session(s), {} session(s) kept", evicted, sessions.size());
        }
        return evicted;
    }

    public Collection<AnalysisSession> all() {
        return List.copyOf(sessions.values());
    }

    private void evict(AnalysisSession session) {
        if (sessions.remove(session.getId(), session)) {
            eventBus.forget(session.getId());
            log.debug("Evicted session {}", session.getId());
        }
    }
}
