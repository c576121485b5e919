package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;
import com.decisionfacts.taxonomy.Polarity;

/**
 * A single independent outcome heuristic.
 * Methods are deterministic and stateless; they never see each other's votes.
 */
public interface OutcomeMethod {

    MethodId methodId();

    /**
     * Scan already lower-cased text.
     *
     * @param text lower-cased decision text, never null
     * @return the method's hits and local confidence per polarity
     */
    MethodVote vote(String text);

    /**
     * A single pattern match.
     *
     * @param start offset of the match in the scanned text
     */
    record Hit(String patternId, Polarity polarity, String snippet, double weight, int start) {
    }
}
