package com.marketpulse.core.stages;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Heuristic quality score for an extracted page, from 0 to 100.
 * <p>
 * Length band weighs 60%, sentence count 40%. Pages that look like error,
 * paywall or cookie screens lose 20 points.
 */
@Component
public class ContentQualityScorer {

    /** Documents at or above this score count as qualified extractions. */
    public static final int QUALIFIED_SCORE = 70;

    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?\\n]+");
    private static final Pattern NOISE = Pattern.compile(
            "página não encontrada|page not found|access denied|acesso negado|enable javascript"
                    + "|ative o javascript|aceitar cookies|accept cookies|assine para continuar|subscribe to continue");

    public int score(String content) {
        if (content == null || content.isBlank()) {
            return 0;
        }
        int length = content.length();
        double lengthScore = length < 500 ? 0.2 : (length < 2000 ? 0.6 : 1.0);
        double sentenceScore = Math.min(1.0, sentences(content) / 20.0);
        boolean noisy = NOISE.matcher(content.toLowerCase(Locale.ROOT)).find();

        double raw = 0.6 * lengthScore + 0.4 * sentenceScore - (noisy ? 0.2 : 0.0);
        return (int) Math.round(Math.max(0.0, Math.min(1.0, raw)) * 100);
    }

    private static int sentences(String content) {
        int count = 0;
        for (String part : SENTENCE_BREAK.split(content)) {
            if (!part.isBlank()) {
                count++;
            }
        }
        return count;
    }
}
