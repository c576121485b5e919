package com.decisionfacts.summary;

import com.decisionfacts.outcome.OutcomeSettings;
import com.decisionfacts.taxonomy.PatternTaxonomy;

/**
 * Version stamp of every summary: the taxonomy version plus a short hash of
 * everything that shapes the result (patterns, method profiles, summary
 * weights and tie-break settings), e.g. {@code 2.1.0+3f9a61c2}.
 */
public final class PipelineVersion {

    private static final int HASH_LENGTH = 8;

    private PipelineVersion() {
    }

    public static String of(PatternTaxonomy taxonomy, SummaryWeights weights, OutcomeSettings settings) {
        String content = taxonomy.fingerprint()
            + "|weights=" + weights.outcome() + "," + weights.parties() + "," + weights.references()
            + "|tie=" + settings.tieEpsilon() + "," + settings.preferPartialOnTie();
        return taxonomy.version() + "+" + PatternTaxonomy.sha256Hex(content).substring(0, HASH_LENGTH);
    }
}
