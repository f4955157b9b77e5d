package com.marketpulse.core.engine;

import com.marketpulse.core.model.AnalysisRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisRequestValidatorTest {

    private final AnalysisRequestValidator validator = new AnalysisRequestValidator();

    @Test
    @DisplayName("a specific segment with optional fields absent is accepted")
    void acceptsMinimalRequest() {
        assertDoesNotThrow(() -> validator.validate(AnalysisRequest.forSegment("pet shops de bairro", null)));
    }

    @Test
    @DisplayName("missing request body is rejected")
    void rejectsNull() {
        var ex = assertThrows(InputValidationException.class, () -> validator.validate(null));
        assertEquals(1, ex.getErrors().size());
    }

    @Test
    void rejectsBlankSegment() {
        var ex = assertThrows(InputValidationException.class,
                () -> validator.validate(AnalysisRequest.forSegment("   ", null)));
        assertEquals(List.of("segment is required"), ex.getErrors());
    }

    @Test
    void rejectsShortSegment() {
        var ex = assertThrows(InputValidationException.class,
                () -> validator.validate(AnalysisRequest.forSegment("spa", null)));
        assertTrue(ex.getErrors().get(0).contains("at least 5"));
    }

    @Test
    @DisplayName("generic placeholder segments are rejected regardless of case")
    void rejectsGenericSegment() {
        var ex = assertThrows(InputValidationException.class,
                () -> validator.validate(AnalysisRequest.forSegment("Mercado TESTE", null)));
        assertTrue(ex.getErrors().get(0).contains("'teste'"));
    }

    @Test
    @DisplayName("every negative amount is reported in one exception")
    void collectsAllErrors() {
        var request = new AnalysisRequest("escolas de idiomas", null, null, -1.0, -10.0, -5.0, null, null);

        var ex = assertThrows(InputValidationException.class, () -> validator.validate(request));

        assertEquals(3, ex.getErrors().size());
        assertTrue(ex.getErrors().contains("price must not be negative"));
        assertTrue(ex.getErrors().contains("revenue_goal must not be negative"));
        assertTrue(ex.getErrors().contains("marketing_budget must not be negative"));
    }

    @Test
    void zeroAmountsAreValid() {
        var request = new AnalysisRequest("escolas de idiomas", null, null, 0.0, 0.0, 0.0, null, null);
        assertDoesNotThrow(() -> validator.validate(request));
    }
}
