package com.marketpulse.core.stages;

import com.marketpulse.core.model.AnalysisRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

class ResearchQueryPlannerTest {

    private final ResearchQueryPlanner planner = new ResearchQueryPlanner();

    @Test
    @DisplayName("an explicit query runs first, followed by product-specific queries")
    void explicitQueryFirst() {
        var request = new AnalysisRequest("cafeterias especiais", "grãos torrados", null, null, null, null,
                "café especial assinatura", null);

        var queries = planner.plan(request, 15);

        assertEquals("café especial assinatura", queries.get(0));
        assertTrue(queries.get(1).contains("grãos torrados"));
        assertEquals(12, queries.size());
    }

    @Test
    void segmentOnlyQueries() {
        var queries = planner.plan(AnalysisRequest.forSegment("cafeterias especiais", null), 15);

        assertEquals(11, queries.size());
        assertTrue(queries.get(0).startsWith("mercado cafeterias especiais"));
        assertEquals(queries.size(), new HashSet<>(queries).size());
    }

    @Test
    void respectsMaximum() {
        assertEquals(3, planner.plan(AnalysisRequest.forSegment("cafeterias especiais", "grãos"), 3).size());
    }
}
