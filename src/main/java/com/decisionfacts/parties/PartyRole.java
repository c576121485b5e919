package com.decisionfacts.parties;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PartyRole {
    CLAIMANT("claimant"),
    DEFENDANT("defendant");

    private final String value;

    PartyRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
