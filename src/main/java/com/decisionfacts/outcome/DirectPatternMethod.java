package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;
import com.decisionfacts.taxonomy.PatternCategory;
import com.decisionfacts.taxonomy.PatternTaxonomy;

import java.util.ArrayList;
import java.util.List;

/** Favorable, unfavorable and partial lexicon anywhere in the text. */
public class DirectPatternMethod extends AbstractPatternMethod {

    public DirectPatternMethod(PatternTaxonomy taxonomy) {
        super(taxonomy, MethodId.DIRECT_PATTERN);
    }

    @Override
    public MethodVote vote(String text) {
        List<Hit> hits = new ArrayList<>();
        hits.addAll(scan(taxonomy.rules(PatternCategory.FAVORABLE), text));
        hits.addAll(scan(taxonomy.rules(PatternCategory.UNFAVORABLE), text));
        hits.addAll(scan(taxonomy.rules(PatternCategory.PARTIAL), text));
        return toVote(hits);
    }
}
