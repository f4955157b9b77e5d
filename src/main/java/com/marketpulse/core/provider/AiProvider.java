package com.marketpulse.core.provider;

/**
 * Text generation backend.
 */
public interface AiProvider extends NamedProvider {

    /**
     * Generates a completion for the prompt.
     *
     * @throws RuntimeException on any transport or service failure
     */
    String generate(String prompt, int maxTokens);
}
