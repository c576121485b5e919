package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;
import com.decisionfacts.taxonomy.PatternCategory;
import com.decisionfacts.taxonomy.PatternTaxonomy;

public class LaborRightsMethod extends AbstractPatternMethod {

    public LaborRightsMethod(PatternTaxonomy taxonomy) {
        super(taxonomy, MethodId.LABOR_RIGHTS);
    }

    @Override
    public MethodVote vote(String text) {
        return toVote(scan(taxonomy.rules(PatternCategory.LABOR_RIGHT), text));
    }
}
