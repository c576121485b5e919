package com.decisionfacts.parties;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Optional;

public record ExtractedParties(Optional<PartyRecord> claimant, Optional<PartyRecord> defendant, double confidence) {

    public static ExtractedParties empty() {
        return new ExtractedParties(Optional.empty(), Optional.empty(), 0.0);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return claimant.isEmpty() && defendant.isEmpty();
    }
}
