package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.Polarity;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RightVerdict {
    GRANTED("granted"),
    DENIED("denied"),
    PARTIALLY_GRANTED("partially_granted");

    private final String value;

    RightVerdict(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    static RightVerdict of(Polarity polarity) {
        return switch (polarity) {
            case FAVORABLE -> GRANTED;
            case UNFAVORABLE -> DENIED;
            case PARTIAL -> PARTIALLY_GRANTED;
            case CONTEXT -> throw new IllegalArgumentException("context patterns carry no verdict");
        };
    }
}
