package com.decisionfacts.taxonomy;

/**
 * Direction a matched pattern pushes the outcome towards.
 * CONTEXT patterns locate regions of the text and never vote.
 */
public enum Polarity {
    FAVORABLE,
    UNFAVORABLE,
    PARTIAL,
    CONTEXT;

    public boolean votes() {
        return this != CONTEXT;
    }
}
