package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;
import com.decisionfacts.taxonomy.Polarity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one method over one text: the hits in discovery order and the
 * capped local confidence of every polarity that received at least one hit.
 */
public record MethodVote(MethodId method, List<OutcomeMethod.Hit> hits, Map<Polarity, Double> localConfidence) {

    public MethodVote {
        hits = List.copyOf(hits);
        Map<Polarity, Double> copy = new EnumMap<>(Polarity.class);
        copy.putAll(localConfidence);
        localConfidence = Collections.unmodifiableMap(copy);
    }

    public static MethodVote empty(MethodId method) {
        return new MethodVote(method, List.of(), new EnumMap<>(Polarity.class));
    }

    public boolean hasHits() {
        return !hits.isEmpty();
    }

    public double local(Polarity polarity) {
        return localConfidence.getOrDefault(polarity, 0.0);
    }

    /** Sum of the pattern weights of every hit with the given polarity. */
    public double weightSum(Polarity polarity) {
        double sum = 0.0;
        for (OutcomeMethod.Hit hit : hits) {
            if (hit.polarity() == polarity) {
                sum += hit.weight();
            }
        }
        return sum;
    }
}
