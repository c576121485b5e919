package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;
import com.decisionfacts.taxonomy.PatternCategory;
import com.decisionfacts.taxonomy.PatternRule;
import com.decisionfacts.taxonomy.PatternTaxonomy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Direct lexicon restricted to windows around discourse markers ("isto posto",
 * "julgo", "no mérito", ...). Overlapping windows are merged first and the
 * lexicon is run once over the whole text, so a span is never counted twice.
 */
public class SemanticContextMethod extends AbstractPatternMethod {

    static final int WINDOW_BEFORE = 100;
    static final int WINDOW_AFTER = 200;

    public SemanticContextMethod(PatternTaxonomy taxonomy) {
        super(taxonomy, MethodId.SEMANTIC_CONTEXT);
    }

    @Override
    public MethodVote vote(String text) {
        List<int[]> windows = windows(text);
        if (windows.isEmpty()) {
            return MethodVote.empty(methodId());
        }
        List<Hit> hits = new ArrayList<>();
        for (PatternCategory category : List.of(PatternCategory.FAVORABLE, PatternCategory.UNFAVORABLE,
                PatternCategory.PARTIAL)) {
            hits.addAll(scan(taxonomy.rules(category), text, (start, end) -> insideAny(windows, start, end)));
        }
        return toVote(hits);
    }

    /** Merged, sorted {@code [start, end)} windows around every marker. */
    List<int[]> windows(String text) {
        List<int[]> raw = new ArrayList<>();
        for (PatternRule marker : taxonomy.rules(PatternCategory.CONTEXTUAL)) {
            Matcher matcher = marker.pattern().matcher(text);
            while (matcher.find()) {
                raw.add(new int[] {
                    Math.max(0, matcher.start() - WINDOW_BEFORE),
                    Math.min(text.length(), matcher.end() + WINDOW_AFTER)
                });
            }
        }
        raw.sort(Comparator.comparingInt((int[] w) -> w[0]).thenComparingInt(w -> w[1]));
        List<int[]> merged = new ArrayList<>();
        for (int[] window : raw) {
            int[] last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && window[0] <= last[1]) {
                last[1] = Math.max(last[1], window[1]);
            } else {
                merged.add(window);
            }
        }
        return merged;
    }

    private static boolean insideAny(List<int[]> windows, int start, int end) {
        for (int[] window : windows) {
            if (start >= window[0] && end <= window[1]) {
                return true;
            }
        }
        return false;
    }
}
