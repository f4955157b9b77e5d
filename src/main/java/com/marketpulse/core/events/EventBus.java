package com.marketpulse.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Per-session progress channels.
 * <p>
 * Each session gets a channel holding its listeners and a bounded history of the
 * most recent events. A new listener first receives that history, then live
 * events, so a client attaching after the session started still sees where it is.
 * Events are delivered under the channel's lock, which keeps replay and live
 * delivery in publish order for every listener.
 * <p>
 * Delivery is best effort: a failing listener is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int DEFAULT_HISTORY = 64;

    private final ConcurrentHashMap<String, SessionChannel> channels = new ConcurrentHashMap<>();
    private final int historySize;

    @Autowired
    public EventBus() {
        this(DEFAULT_HISTORY);
    }

    public EventBus(int historySize) {
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be >= 1");
        }
        this.historySize = historySize;
    }

    public void publish(PipelineEvent event) {
        log.debug("Session {} event {}", event.sessionId(), event.eventType());
        SessionChannel channel = channel(event.sessionId());
        while (!channel.publish(event)) {
            channels.remove(event.sessionId(), channel);
            channel = channel(event.sessionId());
        }
    }

    /**
     * Attaches a listener to one session, replaying the retained history first.
     *
     * @return a handle that detaches the listener
     */
    public Subscription subscribe(String sessionId, Consumer<PipelineEvent> listener) {
        SessionChannel channel = channel(sessionId);
        int replayed;
        while ((replayed = channel.attach(listener)) < 0) {
            channels.remove(sessionId, channel);
            channel = channel(sessionId);
        }
        log.debug("Listener attached to session {} ({} event(s) replayed)", sessionId, replayed);
        SessionChannel attached = channel;
        return () -> {
            if (attached.detach(listener)) {
                channels.remove(sessionId, attached);
            }
        };
    }

    /** The retained events of a session, oldest first. */
    public List<PipelineEvent> history(String sessionId) {
        SessionChannel channel = channels.get(sessionId);
        return channel == null ? List.of() : channel.snapshot();
    }

    /** Drops a session's channel and history. Listeners still attached stop receiving events. */
    public void forget(String sessionId) {
        if (channels.remove(sessionId) != null) {
            log.debug("Dropped event history for session {}", sessionId);
        }
    }

    int channelCount() {
        return channels.size();
    }

    private SessionChannel channel(String sessionId) {
        return channels.computeIfAbsent(sessionId, id -> new SessionChannel(historySize));
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    /**
     * A channel that is left with no listeners and no history closes itself, as for a
     * stream opened on an id that never ran. Callers holding a closed channel replace it.
     */
    private static final class SessionChannel {

        private final int capacity;
        private final ArrayDeque<PipelineEvent> history;
        private final List<Consumer<PipelineEvent>> listeners = new ArrayList<>();
        private boolean closed;

        SessionChannel(int capacity) {
            this.capacity = capacity;
            this.history = new ArrayDeque<>(capacity);
        }

        /** @return false if the channel is closed and the event was not taken */
        synchronized boolean publish(PipelineEvent event) {
            if (closed) {
                return false;
            }
            if (history.size() == capacity) {
                history.removeFirst();
            }
            history.addLast(event);
            for (Consumer<PipelineEvent> listener : List.copyOf(listeners)) {
                deliver(listener, event);
            }
            return true;
        }

        /** @return the number of events replayed, or -1 if the channel is closed */
        synchronized int attach(Consumer<PipelineEvent> listener) {
            if (closed) {
                return -1;
            }
            for (PipelineEvent event : history) {
                deliver(listener, event);
            }
            listeners.add(listener);
            return history.size();
        }

        /** @return true if the channel closed because it became idle */
        synchronized boolean detach(Consumer<PipelineEvent> listener) {
            listeners.remove(listener);
            closed = listeners.isEmpty() && history.isEmpty();
            return closed;
        }

        synchronized List<PipelineEvent> snapshot() {
            return List.copyOf(history);
        }

        private static void deliver(Consumer<PipelineEvent> listener, PipelineEvent event) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for session {}: {}", event.eventType(), event.sessionId(),
                        e.getMessage(), e);
            }
        }
    }
}
