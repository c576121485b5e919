package com.decisionfacts.summary;

/**
 * Weights of the sub-confidences in the overall confidence of a summary.
 * The overall confidence is their weighted mean. The outcome weighs more than
 * the parties and the references, which weigh the same. Monetary and request
 * extraction carry no weight.
 */
public record SummaryWeights(double outcome, double parties, double references) {

    private static final double TOLERANCE = 1e-9;

    public SummaryWeights {
        if (outcome < 0 || parties < 0 || references < 0) {
            throw new IllegalArgumentException("summary weights must not be negative");
        }
        if (outcome + parties + references <= 0) {
            throw new IllegalArgumentException("at least one summary weight must be positive");
        }
        if (Math.abs(parties - references) > TOLERANCE) {
            throw new IllegalArgumentException(
                "parties and references weights must be equal: " + parties + " != " + references);
        }
        if (outcome <= parties + TOLERANCE) {
            throw new IllegalArgumentException(
                "outcome weight must exceed the parties and references weights: " + outcome + " <= " + parties);
        }
    }

    public static SummaryWeights defaults() {
        return new SummaryWeights(0.5, 0.25, 0.25);
    }

    public double combine(double outcomeConfidence, double partiesConfidence, double referencesConfidence) {
        double weighted = outcome * outcomeConfidence + parties * partiesConfidence + references * referencesConfidence;
        double overall = weighted / (outcome + parties + references);
        return Math.max(0.0, Math.min(1.0, overall));
    }
}
