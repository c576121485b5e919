package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;
import com.decisionfacts.taxonomy.PatternCategory;
import com.decisionfacts.taxonomy.PatternRule;
import com.decisionfacts.taxonomy.PatternTaxonomy;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;

/**
 * Dispositive constructions ("julgo procedentes os pedidos", "nego provimento").
 * Once a dispositive header is found, constructions before it are weighted by
 * the taxonomy's pre-dispositive discount. Without a header nothing is discounted.
 */
public class DocumentStructureMethod extends AbstractPatternMethod {

    public DocumentStructureMethod(PatternTaxonomy taxonomy) {
        super(taxonomy, MethodId.DOCUMENT_STRUCTURE);
    }

    @Override
    public MethodVote vote(String text) {
        List<Hit> found = scan(taxonomy.rules(PatternCategory.STRUCTURAL), text);
        OptionalInt header = dispositiveStart(text);
        if (header.isEmpty()) {
            return toVote(found);
        }
        double discount = taxonomy.preDispositiveDiscount();
        List<Hit> hits = new ArrayList<>(found.size());
        for (Hit hit : found) {
            hits.add(hit.start() < header.getAsInt()
                ? new Hit(hit.patternId(), hit.polarity(), hit.snippet(), hit.weight() * discount, hit.start())
                : hit);
        }
        return toVote(hits);
    }

    /** Offset of the earliest dispositive header, if any. */
    OptionalInt dispositiveStart(String text) {
        int earliest = Integer.MAX_VALUE;
        for (PatternRule header : taxonomy.rules(PatternCategory.DISPOSITIVE_HEADER)) {
            Matcher matcher = header.pattern().matcher(text);
            if (matcher.find()) {
                earliest = Math.min(earliest, matcher.start());
            }
        }
        return earliest == Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of(earliest);
    }
}
