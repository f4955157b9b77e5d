package com.marketpulse.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes structured output from free-form AI text.
 * <p>
 * Accepted grammar, after trimming:
 * <ul>
 *   <li>exactly one fenced block opened with {@code ```json} and closed with {@code ```},
 *       surrounded by any prose; or</li>
 *   <li>a bare JSON object: the whole text starts with '{' and ends with '}'</li>
 * </ul>
 * Anything else is rejected with {@link AiResponseFormatException}: no JSON, several
 * fenced blocks, an unterminated or untagged fence, malformed JSON, trailing tokens,
 * or JSON that does not bind to the target type. The decoder never guesses.
 */
@Component
public class AiResponseDecoder {

    private static final Logger log = LoggerFactory.getLogger(AiResponseDecoder.class);

    private static final String FENCE = "```";
    private static final Pattern JSON_BLOCK = Pattern.compile("```json\\s+(.*?)```", Pattern.DOTALL);

    private final ObjectMapper mapper;

    public AiResponseDecoder(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    public <T> T decode(String text, Class<T> type) {
        String json = extractJson(text);
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.debug("AI response does not bind to {}: {}", type.getSimpleName(), e.getOriginalMessage());
            throw new AiResponseFormatException(
                    "AI response does not bind to " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Returns the JSON text selected by the grammar.
     *
     * @throws AiResponseFormatException when the text matches neither form
     */
    String extractJson(String text) {
        if (text == null || text.isBlank()) {
            throw new AiResponseFormatException("AI response is empty");
        }
        String trimmed = text.trim();

        int fences = countFences(trimmed);
        if (fences > 0) {
            if (fences != 2) {
                throw new AiResponseFormatException(
                        "Expected exactly one fenced ```json block, found " + fences + " fence marker(s)");
            }
            Matcher m = JSON_BLOCK.matcher(trimmed);
            if (!m.find()) {
                throw new AiResponseFormatException("Fenced block is not tagged as json");
            }
            String body = m.group(1).trim();
            if (!body.startsWith("{") || !body.endsWith("}")) {
                throw new AiResponseFormatException("Fenced json block does not contain a JSON object");
            }
            return body;
        }

        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return trimmed;
        }
        throw new AiResponseFormatException("AI response contains no JSON object");
    }

    private static int countFences(String text) {
        int count = 0;
        int idx = text.indexOf(FENCE);
        while (idx >= 0) {
            count++;
            idx = text.indexOf(FENCE, idx + FENCE.length());
        }
        return count;
    }
}
