package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;
import com.decisionfacts.taxonomy.PatternCategory;
import com.decisionfacts.taxonomy.PatternTaxonomy;

/**
 * Indirect signals: payment orders, obligations and deadlines imply a grant,
 * "não há que se falar" style phrasing implies a denial.
 */
public class InferenceMethod extends AbstractPatternMethod {

    public InferenceMethod(PatternTaxonomy taxonomy) {
        super(taxonomy, MethodId.INFERENCE);
    }

    @Override
    public MethodVote vote(String text) {
        return toVote(scan(taxonomy.rules(PatternCategory.INFERENTIAL), text));
    }
}
