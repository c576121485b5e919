package com.decisionfacts.taxonomy;

import java.util.regex.Pattern;

/**
 * One compiled taxonomy entry. Rules are created by {@link PatternTaxonomy.Builder}
 * and never change afterwards.
 */
public record PatternRule(
    String id,
    PatternCategory category,
    Polarity polarity,
    double weight,
    Pattern pattern
) {

    public MethodId method() {
        return category.owner();
    }

    String fingerprintLine() {
        return id + "|" + category + "|" + polarity + "|" + weight + "|" + pattern.pattern();
    }
}
