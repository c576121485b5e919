package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;
import com.decisionfacts.taxonomy.PatternCategory;
import com.decisionfacts.taxonomy.PatternTaxonomy;

/** Formal-register conclusions such as "restou comprovado" or "pelos fundamentos expostos". */
public class LegalLanguageMethod extends AbstractPatternMethod {

    public LegalLanguageMethod(PatternTaxonomy taxonomy) {
        super(taxonomy, MethodId.LEGAL_LANGUAGE);
    }

    @Override
    public MethodVote vote(String text) {
        return toVote(scan(taxonomy.rules(PatternCategory.LEGAL_LANGUAGE), text));
    }
}
