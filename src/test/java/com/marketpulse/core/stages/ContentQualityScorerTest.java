package com.marketpulse.core.stages;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContentQualityScorerTest {

    private final ContentQualityScorer scorer = new ContentQualityScorer();

    @Test
    void emptyContentScoresZero() {
        assertEquals(0, scorer.score(null));
        assertEquals(0, scorer.score("   "));
    }

    @Test
    @DisplayName("long pages with many sentences score full marks")
    void longArticle() {
        assertEquals(100, scorer.score("O mercado de barbearias cresceu no último ano. ".repeat(50)));
    }

    @Test
    @DisplayName("a short page with few sentences stays below the qualified level")
    void shortPage() {
        int score = scorer.score("Barbearia aberta aos sábados. Agende online.");

        assertEquals(16, score);
        assertTrue(score < ContentQualityScorer.QUALIFIED_SCORE);
    }

    @Test
    @DisplayName("error and cookie screens lose points")
    void noisePenalty() {
        String article = "O mercado de barbearias cresceu no último ano. ".repeat(50);

        assertEquals(80, scorer.score("Aceitar cookies para continuar. " + article));
    }
}
