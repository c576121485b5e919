package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.Polarity;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Outcome {
    FAVORABLE_TO_CLAIMANT("favorable_to_claimant"),
    FAVORABLE_TO_DEFENDANT("favorable_to_defendant"),
    PARTIALLY_FAVORABLE("partially_favorable"),
    UNDETERMINED("undetermined");

    private final String value;

    Outcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Outcome fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown outcome: " + raw));
    }

    /** Label voted for by a pattern of the given polarity. */
    public static Outcome of(Polarity polarity) {
        return switch (polarity) {
            case FAVORABLE -> FAVORABLE_TO_CLAIMANT;
            case UNFAVORABLE -> FAVORABLE_TO_DEFENDANT;
            case PARTIAL -> PARTIALLY_FAVORABLE;
            case CONTEXT -> throw new IllegalArgumentException("context patterns do not vote");
        };
    }
}
