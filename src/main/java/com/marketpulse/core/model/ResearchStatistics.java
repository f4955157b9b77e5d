package com.marketpulse.core.model;

/**
 * Aggregate figures over one research run.
 *
 * @param qualifiedExtractions documents whose quality score reached the qualified level
 * @param avgQualityScore      mean document quality score, 0 when nothing was kept
 */
public record ResearchStatistics(
        int totalQueries,
        int totalResults,
        int successfulExtractions,
        long totalContentLength,
        int uniqueDomains,
        long avgContentLength,
        int qualifiedExtractions,
        double avgQualityScore
) {}
