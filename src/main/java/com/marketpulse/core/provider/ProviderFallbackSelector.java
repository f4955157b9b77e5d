package com.marketpulse.core.provider;

import com.marketpulse.core.metrics.PipelineMetrics;
import com.marketpulse.core.model.ProviderAttempt;
import com.marketpulse.core.model.ProviderCategory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls ranked providers of one category until one succeeds.
 * <p>
 * For each call:
 * <ul>
 *   <li>providers in cooldown are skipped</li>
 *   <li>each attempt runs with a timeout; a timeout counts as a failure</li>
 *   <li>the first success resets that provider's counter and is returned at once</li>
 *   <li>when every provider failed or was skipped, {@link AllProvidersFailedException}
 *       carries the ordered attempt history</li>
 * </ul>
 * A timed-out call is not interrupted: it runs to completion in the background so
 * the provider's own client state stays consistent. Its late result is discarded.
 */
@Service
public class ProviderFallbackSelector {

    private static final Logger log = LoggerFactory.getLogger(ProviderFallbackSelector.class);

    private final ProviderHealthRegistry registry;
    private final PipelineMetrics metrics;
    private final Duration callTimeout;
    private final ExecutorService executor;

    @Autowired
    public ProviderFallbackSelector(ProviderHealthRegistry registry, PipelineMetrics metrics,
                                    ProviderProperties properties) {
        this(registry, metrics, properties.getCallTimeout());
    }

    public ProviderFallbackSelector(ProviderHealthRegistry registry, PipelineMetrics metrics, Duration callTimeout) {
        this.registry = registry;
        this.metrics = metrics;
        this.callTimeout = callTimeout;
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "provider-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Invokes providers in priority order until one succeeds.
     *
     * @param category   category used for health tracking
     * @param providers  providers in priority order
     * @param invocation work to run against a single provider
     * @return the first successful result and the attempts that preceded it
     * @throws AllProvidersFailedException when no provider succeeded
     */
    public <P extends NamedProvider, T> ProviderCallResult<T> call(ProviderCategory category, List<P> providers,
                                                                   ProviderInvocation<P, T> invocation) {
        List<ProviderAttempt> attempts = new ArrayList<>();

        for (P provider : providers) {
            String name = provider.name();
            if (registry.isDisabled(category, name)) {
                log.debug("Skipping disabled {} provider {}", category.key(), name);
                attempts.add(ProviderAttempt.skipped(name));
                continue;
            }

            try {
                T value = invokeWithTimeout(provider, invocation);
                registry.recordSuccess(category, name);
                if (!attempts.isEmpty()) {
                    log.info("{} provider {} succeeded after {} failed/skipped attempt(s)",
                            category.key(), name, attempts.size());
                }
                return new ProviderCallResult<>(name, value, attempts);
            } catch (TimeoutException e) {
                recordFailure(category, name, "timed out after " + callTimeout.toMillis() + " ms", attempts);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                recordFailure(category, name, describe(cause), attempts);
                log.debug("{} provider {} failure detail", category.key(), name, cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                attempts.add(ProviderAttempt.failed(name, "interrupted"));
                throw new AllProvidersFailedException(category, attempts);
            }
        }

        metrics.recordProviderExhausted(category.key());
        log.error("All {} providers exhausted: {}", category.key(), attempts);
        throw new AllProvidersFailedException(category, attempts);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private <P, T> T invokeWithTimeout(P provider, ProviderInvocation<P, T> invocation)
            throws InterruptedException, ExecutionException, TimeoutException {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return invocation.invoke(provider);
            } finally {
                MDC.clear();
            }
        });
        return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void recordFailure(ProviderCategory category, String name, String error, List<ProviderAttempt> attempts) {
        log.warn("{} provider {} failed: {}", category.key(), name, error);
        attempts.add(ProviderAttempt.failed(name, error));
        metrics.recordProviderFailure(category.key(), name);
        if (registry.recordFailure(category, name, error)) {
            metrics.recordProviderDisabled(category.key(), name);
        }
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }
}
