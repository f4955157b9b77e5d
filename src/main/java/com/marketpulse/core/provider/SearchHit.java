package com.marketpulse.core.provider;

/**
 * One ranked web search result.
 */
public record SearchHit(String url, String title, String snippet) {}
