package com.marketpulse.core.model;

import java.util.List;
import java.util.Map;

/**
 * Profile of the ideal buyer produced by synthesis.
 */
public record AvatarProfile(
        String name,
        Map<String, String> demographics,
        Map<String, String> psychographics,
        List<String> pains,
        List<String> desires,
        List<String> objections
) {}
