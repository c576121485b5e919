package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classified outcome of one decision with its audit trail.
 *
 * {@code scores} holds the raw aggregate of every voting label; {@code confidence}
 * is the normalized score of the chosen label.
 */
public record OutcomeClassification(
    Outcome outcome,
    double confidence,
    List<Evidence> evidence,
    List<MethodId> methodsUsed,
    Map<Outcome, Double> scores
) {

    public OutcomeClassification {
        evidence = List.copyOf(evidence);
        methodsUsed = List.copyOf(methodsUsed);
        Map<Outcome, Double> copy = new EnumMap<>(Outcome.class);
        copy.putAll(scores);
        scores = Collections.unmodifiableMap(copy);
    }

    /** The no-signal result: no evidence, confidence 0. */
    public static OutcomeClassification undetermined() {
        return new OutcomeClassification(Outcome.UNDETERMINED, 0.0, List.of(), List.of(), Map.of());
    }

    public boolean hasEvidence() {
        return !evidence.isEmpty();
    }
}
