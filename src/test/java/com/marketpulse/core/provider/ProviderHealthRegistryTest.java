package com.marketpulse.core.provider;

import com.marketpulse.core.model.ProviderCategory;
import com.marketpulse.core.model.ProviderRecord;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.marketpulse.core.model.ProviderCategory.AI;
import static com.marketpulse.core.model.ProviderCategory.RESEARCH;
import static org.junit.jupiter.api.Assertions.*;

class ProviderHealthRegistryTest {

    private MutableClock clock;
    private ProviderHealthRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        registry = new ProviderHealthRegistry(3, Duration.ofMinutes(5), clock);
    }

    private ProviderRecord record(ProviderCategory category, String name) {
        return registry.find(category, name).orElseThrow();
    }

    @Nested
    @DisplayName("failure threshold")
    class Threshold {

        @Test
        @DisplayName("provider stays enabled below the threshold")
        void belowThreshold() {
            assertFalse(registry.recordFailure(AI, "gemini", "boom"));
            assertFalse(registry.recordFailure(AI, "gemini", "boom"));

            assertFalse(registry.isDisabled(AI, "gemini"));
            assertEquals(2, record(AI, "gemini").consecutiveFailures());
        }

        @Test
        @DisplayName("reaching the threshold disables the provider for the cooldown")
        void reachingThresholdDisables() {
            registry.recordFailure(AI, "gemini", "e1");
            registry.recordFailure(AI, "gemini", "e2");
            assertTrue(registry.recordFailure(AI, "gemini", "e3"));

            assertTrue(registry.isDisabled(AI, "gemini"));
            var record = record(AI, "gemini");
            assertFalse(record.available());
            assertEquals(Instant.parse("2026-03-01T10:05:00Z"), record.disabledUntil());
            assertEquals("e3", record.lastError());
        }

        @Test
        @DisplayName("further failures while disabled do not report a new disablement")
        void failuresWhileDisabled() {
            for (int i = 0; i < 3; i++) {
                registry.recordFailure(AI, "gemini", "boom");
            }
            assertFalse(registry.recordFailure(AI, "gemini", "late"));
            assertEquals(4, record(AI, "gemini").consecutiveFailures());
        }

        @Test
        @DisplayName("a success resets the counter")
        void successResets() {
            registry.recordFailure(AI, "gemini", "boom");
            registry.recordFailure(AI, "gemini", "boom");
            registry.recordSuccess(AI, "gemini");
            registry.recordFailure(AI, "gemini", "boom");

            assertEquals(1, record(AI, "gemini").consecutiveFailures());
            assertFalse(registry.isDisabled(AI, "gemini"));
        }

        @Test
        @DisplayName("threshold below one is rejected")
        void invalidThreshold() {
            assertThrows(IllegalArgumentException.class,
                    () -> new ProviderHealthRegistry(0, Duration.ofMinutes(1), clock));
        }
    }

    @Nested
    @DisplayName("cooldown")
    class Cooldown {

        @Test
        @DisplayName("provider becomes selectable again once the cooldown elapses")
        void reEnabledAfterCooldown() {
            for (int i = 0; i < 3; i++) {
                registry.recordFailure(RESEARCH, "brave", "429");
            }
            clock.advance(Duration.ofMinutes(4));
            assertTrue(registry.isDisabled(RESEARCH, "brave"));

            clock.advance(Duration.ofMinutes(1));
            assertFalse(registry.isDisabled(RESEARCH, "brave"));
        }

        @Test
        @DisplayName("one failure after the cooldown disables again while the counter is still at the threshold")
        void failureAfterCooldown() {
            for (int i = 0; i < 3; i++) {
                registry.recordFailure(RESEARCH, "brave", "429");
            }
            clock.advance(Duration.ofMinutes(6));

            assertTrue(registry.recordFailure(RESEARCH, "brave", "429"));
            assertTrue(registry.isDisabled(RESEARCH, "brave"));
        }
    }

    @Nested
    @DisplayName("reset and snapshot")
    class ResetAndSnapshot {

        @Test
        @DisplayName("reset by name clears only that provider")
        void resetByName() {
            for (int i = 0; i < 3; i++) {
                registry.recordFailure(AI, "gemini", "boom");
                registry.recordFailure(AI, "groq", "boom");
            }

            assertEquals(1, registry.reset(AI, "gemini"));

            assertFalse(registry.isDisabled(AI, "gemini"));
            assertTrue(registry.isDisabled(AI, "groq"));
        }

        @Test
        @DisplayName("reset all clears every provider of the category and leaves others")
        void resetAll() {
            for (int i = 0; i < 3; i++) {
                registry.recordFailure(AI, "gemini", "boom");
                registry.recordFailure(AI, "groq", "boom");
                registry.recordFailure(RESEARCH, "brave", "boom");
            }

            assertEquals(2, registry.reset(AI, "all"));

            assertFalse(registry.isDisabled(AI, "gemini"));
            assertFalse(registry.isDisabled(AI, "groq"));
            assertTrue(registry.isDisabled(RESEARCH, "brave"));
        }

        @Test
        @DisplayName("snapshot lists registered providers ordered by category and name")
        void snapshotOrdering() {
            registry.register(AI, "groq");
            registry.register(RESEARCH, "brave");
            registry.register(AI, "gemini");

            var names = registry.snapshot().stream().map(r -> r.category().key() + ":" + r.name()).toList();

            assertEquals(java.util.List.of("research:brave", "ai:gemini", "ai:groq"), names);
            assertTrue(registry.snapshot().stream().allMatch(ProviderRecord::available));
        }

        @Test
        @DisplayName("unknown providers are never disabled")
        void unknownProvider() {
            assertFalse(registry.isDisabled(AI, "nobody"));
            assertTrue(registry.find(AI, "nobody").isEmpty());
        }
    }

    @Nested
    @DisplayName("circuit breaker")
    class Breaker {

        private void fail(int times) {
            for (int i = 0; i < times; i++) {
                registry.recordFailure(AI, "gemini", "boom");
            }
        }

        @Test
        @DisplayName("the breaker opens at the threshold and half-opens after the cooldown")
        void openThenHalfOpen() {
            fail(2);
            assertEquals(Optional.of(CircuitBreaker.State.CLOSED), registry.breakerState(AI, "gemini"));

            fail(1);
            assertEquals(Optional.of(CircuitBreaker.State.OPEN), registry.breakerState(AI, "gemini"));

            clock.advance(Duration.ofMinutes(5));
            assertEquals(Optional.of(CircuitBreaker.State.HALF_OPEN), registry.breakerState(AI, "gemini"));
            assertTrue(record(AI, "gemini").available());
        }

        @Test
        @DisplayName("one success while half-open closes the breaker")
        void halfOpenSuccessCloses() {
            fail(3);
            clock.advance(Duration.ofMinutes(5));

            registry.recordSuccess(AI, "gemini");

            assertEquals(Optional.of(CircuitBreaker.State.CLOSED), registry.breakerState(AI, "gemini"));
            assertEquals(0, record(AI, "gemini").consecutiveFailures());
            fail(2);
            assertFalse(registry.isDisabled(AI, "gemini"));
        }

        @Test
        @DisplayName("failures separated by a success never open the breaker")
        void interleavedSuccess() {
            fail(2);
            registry.recordSuccess(AI, "gemini");
            fail(2);

            assertEquals(Optional.of(CircuitBreaker.State.CLOSED), registry.breakerState(AI, "gemini"));
            assertEquals(2, record(AI, "gemini").consecutiveFailures());
        }

        @Test
        @DisplayName("operator reset closes an open breaker")
        void resetCloses() {
            fail(3);

            registry.reset(AI, "gemini");

            assertEquals(Optional.of(CircuitBreaker.State.CLOSED), registry.breakerState(AI, "gemini"));
            assertNull(record(AI, "gemini").disabledUntil());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("concurrent failures are all counted and disable the provider exactly once")
        void concurrentFailures() throws Exception {
            var shared = new ProviderHealthRegistry(50, Duration.ofMinutes(5), clock);
            int threads = 8;
            int perThread = 25;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger disablements = new AtomicInteger();

            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        if (shared.recordFailure(AI, "gemini", "boom")) {
                            disablements.incrementAndGet();
                        }
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

            assertEquals(threads * perThread, shared.find(AI, "gemini").orElseThrow().consecutiveFailures());
            assertEquals(1, disablements.get());
            assertTrue(shared.isDisabled(AI, "gemini"));
        }
    }
}
