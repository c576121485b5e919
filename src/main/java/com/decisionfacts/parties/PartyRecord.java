package com.decisionfacts.parties;

import java.util.List;
import java.util.Optional;

/**
 * One party of the lawsuit.
 *
 * @param counsel lawyer names in order of appearance, without duplicates
 */
public record PartyRecord(
    PartyRole role,
    String name,
    Optional<TaxIdentifier> taxId,
    Optional<String> address,
    List<String> counsel,
    double confidence
) {

    public PartyRecord {
        counsel = List.copyOf(counsel);
    }

    PartyRecord withConfidence(double value) {
        return new PartyRecord(role, name, taxId, address, counsel, value);
    }
}
