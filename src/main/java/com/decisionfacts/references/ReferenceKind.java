package com.decisionfacts.references;

import com.fasterxml.jackson.annotation.JsonValue;

/** Citation kinds in output order. */
public enum ReferenceKind {
    ARTICLE("article"),
    STATUTE("statute"),
    SUMULA("sumula"),
    DECREE("decree"),
    ORDINANCE("ordinance");

    private final String value;

    ReferenceKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
