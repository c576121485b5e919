package com.decisionfacts.taxonomy;

/**
 * Fixed trust settings of one classification method.
 *
 * @param method  the method these settings belong to
 * @param weight  multiplier applied to the method's local confidence when votes are combined
 * @param ceiling upper bound of the method's local confidence
 */
public record MethodProfile(MethodId method, double weight, double ceiling) {

    public double cap(double rawConfidence) {
        return Math.min(rawConfidence, ceiling);
    }

    /** Largest score this method can add to a single label. */
    public double maxContribution() {
        return weight * ceiling;
    }
}
