package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.DefaultTaxonomy;
import com.decisionfacts.taxonomy.PatternCategory;
import com.decisionfacts.taxonomy.PatternRule;
import com.decisionfacts.taxonomy.PatternTaxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a verdict per labor right from the taxonomy's labor-right patterns.
 *
 * Each voting match names one right. When a right is ruled on more than once
 * the statement furthest into the text wins, since the dispositive part comes
 * last. Rights are listed in order of first mention.
 */
public class LaborRightsAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LaborRightsAnalyzer.class);

    private final List<PatternRule> rules;
    private final Map<Pattern, String> labels;

    public LaborRightsAnalyzer(PatternTaxonomy taxonomy) {
        this(taxonomy, DefaultTaxonomy.labeledRights());
    }

    public LaborRightsAnalyzer(PatternTaxonomy taxonomy, Map<String, String> labeledRights) {
        this.rules = taxonomy.rules(PatternCategory.LABOR_RIGHT);
        Map<Pattern, String> compiled = new LinkedHashMap<>();
        labeledRights.forEach((regex, label) ->
            compiled.put(Pattern.compile("(?<![\\p{L}\\d])" + regex + "(?![\\p{L}])", PatternTaxonomy.PATTERN_FLAGS), label));
        this.labels = compiled;
    }

    public List<RightOutcome> analyze(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        Map<String, Ruling> rulings = new LinkedHashMap<>();
        for (PatternRule rule : rules) {
            if (!rule.polarity().votes()) {
                continue;
            }
            Matcher matcher = rule.pattern().matcher(lower);
            while (matcher.find()) {
                String snippet = matcher.group();
                Optional<String> right = label(snippet);
                if (right.isEmpty()) {
                    continue;
                }
                Ruling ruling = new Ruling(matcher.start(), new RightOutcome(right.get(),
                    RightVerdict.of(rule.polarity()), snippet, rule.id()));
                rulings.merge(right.get(), ruling, Ruling::later);
            }
        }
        List<Ruling> ordered = new ArrayList<>(rulings.values());
        ordered.sort((a, b) -> Integer.compare(a.firstSeen, b.firstSeen));
        List<RightOutcome> outcomes = new ArrayList<>(ordered.size());
        for (Ruling ruling : ordered) {
            outcomes.add(ruling.outcome);
        }
        log.debug("Ruled rights: {}", outcomes.size());
        return List.copyOf(outcomes);
    }

    /** The label whose expression matches earliest in the snippet; the longer match breaks a tie. */
    private Optional<String> label(String snippet) {
        String best = null;
        int bestStart = Integer.MAX_VALUE;
        int bestLength = 0;
        for (Map.Entry<Pattern, String> entry : labels.entrySet()) {
            Matcher matcher = entry.getKey().matcher(snippet);
            if (!matcher.find()) {
                continue;
            }
            int length = matcher.end() - matcher.start();
            if (matcher.start() < bestStart || (matcher.start() == bestStart && length > bestLength)) {
                best = entry.getValue();
                bestStart = matcher.start();
                bestLength = length;
            }
        }
        return Optional.ofNullable(best);
    }

    private static final class Ruling {

        private final int firstSeen;
        private final int start;
        private final RightOutcome outcome;

        Ruling(int start, RightOutcome outcome) {
            this(start, start, outcome);
        }

        private Ruling(int firstSeen, int start, RightOutcome outcome) {
            this.firstSeen = firstSeen;
            this.start = start;
            this.outcome = outcome;
        }

        Ruling later(Ruling other) {
            int first = Math.min(firstSeen, other.firstSeen);
            Ruling winner = other.start > start ? other : this;
            return new Ruling(first, winner.start, winner.outcome);
        }
    }
}
