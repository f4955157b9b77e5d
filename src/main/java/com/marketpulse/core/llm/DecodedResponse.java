package com.marketpulse.core.llm;

/**
 * A decoded AI payload together with the text it came from.
 */
public record DecodedResponse<T>(T value, String rawText) {}
