package com.marketpulse.core.provider;

/**
 * An external service implementation selectable by name.
 */
public interface NamedProvider {

    String name();
}
