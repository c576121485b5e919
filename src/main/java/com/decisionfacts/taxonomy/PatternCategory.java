package com.decisionfacts.taxonomy;

/**
 * Pattern groups of the taxonomy. Each category belongs to exactly one
 * classification method; the direct lexicon is also read by the
 * semantic-context method.
 */
public enum PatternCategory {
    FAVORABLE(MethodId.DIRECT_PATTERN),
    UNFAVORABLE(MethodId.DIRECT_PATTERN),
    PARTIAL(MethodId.DIRECT_PATTERN),
    INFERENTIAL(MethodId.INFERENCE),
    LABOR_RIGHT(MethodId.LABOR_RIGHTS),
    CONTEXTUAL(MethodId.SEMANTIC_CONTEXT),
    STRUCTURAL(MethodId.DOCUMENT_STRUCTURE),
    DISPOSITIVE_HEADER(MethodId.DOCUMENT_STRUCTURE),
    LEGAL_LANGUAGE(MethodId.LEGAL_LANGUAGE);

    private final MethodId owner;

    PatternCategory(MethodId owner) {
        this.owner = owner;
    }

    public MethodId owner() {
        return owner;
    }

    /** Categories whose patterns only locate regions and carry {@link Polarity#CONTEXT}. */
    public boolean isLocator() {
        return this == CONTEXTUAL || this == DISPOSITIVE_HEADER;
    }
}
