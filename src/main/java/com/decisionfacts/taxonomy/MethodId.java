package com.decisionfacts.taxonomy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum MethodId {
    DIRECT_PATTERN("direct_pattern"),
    INFERENCE("inference"),
    LABOR_RIGHTS("labor_rights"),
    SEMANTIC_CONTEXT("semantic_context"),
    DOCUMENT_STRUCTURE("document_structure"),
    LEGAL_LANGUAGE("legal_language");

    private final String value;

    MethodId(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MethodId fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown method: " + raw));
    }
}
