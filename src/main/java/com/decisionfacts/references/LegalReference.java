package com.decisionfacts.references;

/**
 * A normalized citation. Two references are the same citation when their
 * {@link #key()} is equal, regardless of provenance.
 */
public record LegalReference(ReferenceKind kind, String normalizedCitation, Provenance provenance) {

    public Key key() {
        return new Key(kind, normalizedCitation);
    }

    LegalReference withProvenance(Provenance value) {
        return new LegalReference(kind, normalizedCitation, value);
    }

    public record Key(ReferenceKind kind, String normalizedCitation) {
    }
}
