package com.decisionfacts.outcome;

/**
 * What the decision ruled on one labor right.
 *
 * @param right   display label, e.g. "horas extras"
 * @param snippet the lower-cased passage the verdict was read from
 */
public record RightOutcome(String right, RightVerdict verdict, String snippet, String patternId) {
}
