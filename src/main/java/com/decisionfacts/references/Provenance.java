package com.decisionfacts.references;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Provenance {
    EXTRACTED("extracted", 0.85),
    PRE_EXISTING("pre_existing", 1.0);

    private final String value;
    private final double confidence;

    Provenance(String value, double confidence) {
        this.value = value;
        this.confidence = confidence;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** How much a citation of this origin is trusted. */
    public double confidence() {
        return confidence;
    }
}
