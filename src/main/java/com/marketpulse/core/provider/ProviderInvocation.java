package com.marketpulse.core.provider;

/**
 * Work performed against one provider inside a fallback call.
 *
 * @param <P> provider type
 * @param <T> result type
 */
@FunctionalInterface
public interface ProviderInvocation<P, T> {

    T invoke(P provider) throws Exception;
}
