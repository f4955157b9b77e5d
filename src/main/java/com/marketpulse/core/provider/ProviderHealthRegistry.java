package com.marketpulse.core.provider;

import com.marketpulse.core.model.ProviderCategory;
import com.marketpulse.core.model.ProviderRecord;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide provider health table shared by all sessions.
 * <p>
 * Each provider is backed by a resilience4j {@link CircuitBreaker} whose count-based
 * window equals the failure threshold and whose failure-rate threshold is 100%, so
 * it opens after {@code failureThreshold} consecutive failures. The cooldown is
 * measured against the injected {@link Clock}: once it has elapsed the breaker moves
 * to half-open, where a single failure opens it again and a single success closes it.
 * <p>
 * Every read-modify-write of an entry happens under that entry's monitor, so
 * concurrent sessions hitting the same failing provider never lose a failure
 * increment. Entries for different providers never contend.
 */
@Component
public class ProviderHealthRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthRegistry.class);

    private final ConcurrentHashMap<String, ProviderHealth> entries = new ConcurrentHashMap<>();
    private final CircuitBreakerRegistry breakers;
    private final Clock clock;
    private final int failureThreshold;
    private final Duration cooldown;

    @Autowired
    public ProviderHealthRegistry(ProviderProperties properties, Clock clock) {
        this(properties.getFailureThreshold(), properties.getCooldown(), clock);
    }

    public ProviderHealthRegistry(int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
        this.breakers = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(Duration.ofMillis(Math.max(1, cooldown.toMillis())))
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .writableStackTraceEnabled(false)
                .build());
    }

    /** Makes a provider visible in {@link #snapshot()} before its first call. */
    public void register(ProviderCategory category, String name) {
        entry(category, name);
    }

    /** Whether the provider's breaker is open and inside its cooldown window. */
    public boolean isDisabled(ProviderCategory category, String name) {
        ProviderHealth health = entries.get(key(category, name));
        return health != null && health.isDisabled(clock.instant());
    }

    public void recordSuccess(ProviderCategory category, String name) {
        entry(category, name).recordSuccess();
    }

    /**
     * Counts one failure.
     *
     * @return true if this failure opened the breaker and disabled the provider
     */
    public boolean recordFailure(ProviderCategory category, String name, String error) {
        Instant now = clock.instant();
        boolean disabled = entry(category, name).recordFailure(error, now, cooldown);
        if (disabled) {
            log.warn("Provider {}:{} disabled until {} after {} consecutive failures (last error: {})",
                    category.key(), name, now.plus(cooldown), failureThreshold, error);
        }
        return disabled;
    }

    /**
     * Clears failure counters and closes the breaker. Calls already in flight are
     * not affected; only subsequent selection sees the reset.
     *
     * @param nameOrAll a provider name, or {@code all} for every provider of the category
     * @return number of entries reset
     */
    public int reset(ProviderCategory category, String nameOrAll) {
        int count = 0;
        boolean all = nameOrAll == null || "all".equalsIgnoreCase(nameOrAll);
        for (ProviderHealth health : entries.values()) {
            if (health.category == category && (all || health.name.equals(nameOrAll))) {
                health.reset();
                count++;
            }
        }
        log.info("Reset {} {} provider(s) ({})", count, category.key(), all ? "all" : nameOrAll);
        return count;
    }

    public Optional<ProviderRecord> find(ProviderCategory category, String name) {
        ProviderHealth health = entries.get(key(category, name));
        return health == null ? Optional.empty() : Optional.of(health.toRecord(clock.instant()));
    }

    /** Every known provider, ordered by category then name. */
    public List<ProviderRecord> snapshot() {
        Instant now = clock.instant();
        return entries.values().stream()
                .map(h -> h.toRecord(now))
                .sorted(Comparator.comparing(ProviderRecord::category).thenComparing(ProviderRecord::name))
                .toList();
    }

    /** Current breaker state, for diagnostics. */
    public Optional<CircuitBreaker.State> breakerState(ProviderCategory category, String name) {
        ProviderHealth health = entries.get(key(category, name));
        return health == null ? Optional.empty() : Optional.of(health.state(clock.instant()));
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private ProviderHealth entry(ProviderCategory category, String name) {
        return entries.computeIfAbsent(key(category, name), k -> {
            CircuitBreaker breaker = breakers.circuitBreaker(k);
            breaker.getEventPublisher().onStateTransition(event ->
                    log.debug("Provider {} breaker {}", k, event.getStateTransition()));
            return new ProviderHealth(category, name, breaker);
        });
    }

    private static String key(ProviderCategory category, String name) {
        return category.key() + ":" + name;
    }

    private static final class ProviderHealth {

        private final ProviderCategory category;
        private final String name;
        private final CircuitBreaker breaker;

        private int consecutiveFailures;
        private Instant disabledUntil;
        private String lastError;

        private ProviderHealth(ProviderCategory category, String name, CircuitBreaker breaker) {
            this.category = category;
            this.name = name;
            this.breaker = breaker;
        }

        synchronized boolean isDisabled(Instant now) {
            return state(now) == CircuitBreaker.State.OPEN;
        }

        /** Moves an open breaker to half-open once the cooldown has elapsed. */
        synchronized CircuitBreaker.State state(Instant now) {
            if (breaker.getState() == CircuitBreaker.State.OPEN
                    && (disabledUntil == null || !now.isBefore(disabledUntil))) {
                breaker.transitionToHalfOpenState();
                disabledUntil = null;
            }
            return breaker.getState();
        }

        synchronized void recordSuccess() {
            breaker.onSuccess(0, TimeUnit.NANOSECONDS);
            if (breaker.getState() != CircuitBreaker.State.CLOSED) {
                breaker.transitionToClosedState();
            }
            consecutiveFailures = 0;
            disabledUntil = null;
        }

        synchronized boolean recordFailure(String error, Instant now, Duration cooldown) {
            CircuitBreaker.State before = state(now);
            consecutiveFailures++;
            lastError = error;
            breaker.onError(0, TimeUnit.NANOSECONDS, new ProviderFailure(error));
            if (before != CircuitBreaker.State.OPEN && breaker.getState() == CircuitBreaker.State.OPEN) {
                disabledUntil = now.plus(cooldown);
                return true;
            }
            return false;
        }

        synchronized void reset() {
            breaker.reset();
            consecutiveFailures = 0;
            disabledUntil = null;
        }

        synchronized ProviderRecord toRecord(Instant now) {
            boolean disabled = isDisabled(now);
            return new ProviderRecord(name, category, consecutiveFailures, disabledUntil, lastError, !disabled);
        }
    }

    /** Failure handed to the breaker; the message is all it carries. */
    private static final class ProviderFailure extends RuntimeException {

        ProviderFailure(String message) {
            super(message, null, false, false);
        }
    }
}
