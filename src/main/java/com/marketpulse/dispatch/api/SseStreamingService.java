package com.marketpulse.dispatch.api;

import com.marketpulse.core.events.EventBus;
import com.marketpulse.core.events.PipelineEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streams a session's progress as SSE frames.
 * <p>
 * Each stream subscribes to the session's {@link EventBus} channel, so it first
 * receives the events the session already published and then live ones. Every
 * event becomes one {@link ProgressFrame} named after the event type. The stream
 * ends on the session's terminal event, immediately if that event was already in
 * the replay. Idle streams get a keep-alive comment while a long stage runs.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Research plus six AI stages fit well inside this. */
    static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);
    static final Duration KEEP_ALIVE = Duration.ofSeconds(30);

    private final EventBus eventBus;
    private final long timeoutMs;
    private final Set<ProgressStream> open = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService keepAlive = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-keep-alive");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT.toMillis());
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
        long period = KEEP_ALIVE.toSeconds();
        keepAlive.scheduleAtFixedRate(() -> open.forEach(ProgressStream::ping), period, period, TimeUnit.SECONDS);
    }

    @PreDestroy
    void shutdown() {
        keepAlive.shutdownNow();
        open.forEach(ProgressStream::close);
    }

    public SseEmitter createEmitter(String sessionId) {
        var stream = new ProgressStream(sessionId, new SseEmitter(timeoutMs));
        open.add(stream);
        stream.attach();
        log.info("SSE stream opened for session {} ({} open)", sessionId, open.size());
        return stream.emitter;
    }

    public int activeEmitterCount() {
        return open.size();
    }

    private final class ProgressStream {

        private final String sessionId;
        private final SseEmitter emitter;
        private final AtomicBoolean closed = new AtomicBoolean();
        private long sequence;
        private EventBus.Subscription subscription;

        ProgressStream(String sessionId, SseEmitter emitter) {
            this.sessionId = sessionId;
            this.emitter = emitter;
            emitter.onCompletion(this::close);
            emitter.onTimeout(this::close);
            emitter.onError(e -> close());
        }

        void attach() {
            EventBus.Subscription s = eventBus.subscribe(sessionId, this::forward);
            synchronized (this) {
                subscription = s;
            }
            if (closed.get()) {
                s.unsubscribe();
            }
        }

        /** Runs on the publishing thread, or on the attaching thread for replayed events. */
        private synchronized void forward(PipelineEvent event) {
            if (closed.get()) {
                return;
            }
            ProgressFrame frame = ProgressFrame.of(event, ++sequence);
            try {
                emitter.send(SseEmitter.event()
                        .id(Long.toString(frame.sequence()))
                        .name(frame.type())
                        .data(frame, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                log.debug("SSE send failed for session {}: {}", sessionId, e.getMessage());
                close();
                return;
            }
            if (frame.terminal()) {
                emitter.complete();
                close();
            }
        }

        void ping() {
            boolean sent;
            synchronized (this) {
                sent = closed.get() || keepAliveSent();
            }
            if (!sent) {
                close();
            }
        }

        private boolean keepAliveSent() {
            try {
                emitter.send(SseEmitter.event().comment("keep-alive"));
                return true;
            } catch (IOException | IllegalStateException e) {
                log.debug("SSE keep-alive failed for session {}: {}", sessionId, e.getMessage());
                return false;
            }
        }

        void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            open.remove(this);
            EventBus.Subscription s;
            synchronized (this) {
                s = subscription;
            }
            if (s != null) {
                s.unsubscribe();
            }
            log.debug("SSE stream closed for session {}", sessionId);
        }
    }
}
