package com.decisionfacts.outcome;

/**
 * Tie-break settings of the classifier.
 *
 * @param tieEpsilon         labels whose scores differ by at most this much are tied
 * @param preferPartialOnTie resolve a favorable/unfavorable tie as a partial outcome
 */
public record OutcomeSettings(double tieEpsilon, boolean preferPartialOnTie) {

    public static final double DEFAULT_TIE_EPSILON = 0.05;

    public OutcomeSettings {
        if (!(tieEpsilon >= 0 && tieEpsilon < 1.0)) {
            throw new IllegalArgumentException("tie epsilon must be in [0, 1), got " + tieEpsilon);
        }
    }

    public static OutcomeSettings defaults() {
        return new OutcomeSettings(DEFAULT_TIE_EPSILON, true);
    }
}
