package com.marketpulse.core.model;

import java.util.List;

public record Competitor(
        String name,
        String positioning,
        List<String> strengths,
        List<String> weaknesses
) {}
