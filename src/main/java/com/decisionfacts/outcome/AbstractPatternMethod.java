package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;
import com.decisionfacts.taxonomy.MethodProfile;
import com.decisionfacts.taxonomy.PatternRule;
import com.decisionfacts.taxonomy.PatternTaxonomy;
import com.decisionfacts.taxonomy.Polarity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.regex.Matcher;

/**
 * Shared scanning and scoring for the taxonomy-driven methods.
 *
 * Local confidence of a polarity is {@code min(sum of hit weights / hit normalizer, ceiling)}.
 */
public abstract class AbstractPatternMethod implements OutcomeMethod {

    private static final BiPredicate<Integer, Integer> ANY_SPAN = (start, end) -> true;

    protected final PatternTaxonomy taxonomy;
    private final MethodProfile profile;

    protected AbstractPatternMethod(PatternTaxonomy taxonomy, MethodId method) {
        this.taxonomy = taxonomy;
        this.profile = taxonomy.profile(method);
    }

    @Override
    public MethodId methodId() {
        return profile.method();
    }

    protected MethodProfile profile() {
        return profile;
    }

    protected List<Hit> scan(List<PatternRule> rules, String text) {
        return scan(rules, text, ANY_SPAN);
    }

    /**
     * Runs every voting rule over the text, rule by rule, keeping matches whose
     * {@code [start, end)} span passes the filter. Hits come out in rule order,
     * then text order.
     */
    protected List<Hit> scan(List<PatternRule> rules, String text, BiPredicate<Integer, Integer> spanFilter) {
        List<Hit> hits = new ArrayList<>();
        for (PatternRule rule : rules) {
            if (!rule.polarity().votes()) {
                continue;
            }
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                if (matcher.end() == matcher.start()) {
                    continue;
                }
                if (spanFilter.test(matcher.start(), matcher.end())) {
                    hits.add(new Hit(rule.id(), rule.polarity(), matcher.group(), rule.weight(), matcher.start()));
                }
            }
        }
        return hits;
    }

    protected MethodVote toVote(List<Hit> hits) {
        if (hits.isEmpty()) {
            return MethodVote.empty(methodId());
        }
        Map<Polarity, Double> sums = new EnumMap<>(Polarity.class);
        for (Hit hit : hits) {
            sums.merge(hit.polarity(), hit.weight(), Double::sum);
        }
        Map<Polarity, Double> local = new EnumMap<>(Polarity.class);
        sums.forEach((polarity, sum) -> local.put(polarity, profile.cap(sum / taxonomy.hitNormalizer())));
        return new MethodVote(methodId(), hits, local);
    }
}
