package com.marketpulse.core.qualitygate;

/**
 * Boilerplate or placeholder text that must not appear in a payload.
 */
public record ForbiddenPhrase(String phrase, Severity severity) {

    public enum Severity {
        HIGH(15),
        MEDIUM(10),
        LOW(5);

        private final int weight;

        Severity(int weight) {
            this.weight = weight;
        }

        public int weight() {
            return weight;
        }
    }
}
