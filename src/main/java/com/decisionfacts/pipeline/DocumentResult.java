package com.decisionfacts.pipeline;

import com.decisionfacts.summary.StructuredSummary;

import java.util.Optional;

/**
 * Outcome of one document of a batch: a summary, or the reason there is none.
 */
public record DocumentResult(String documentId, Optional<StructuredSummary> summary, Optional<String> failure) {

    public static DocumentResult success(String documentId, StructuredSummary summary) {
        return new DocumentResult(documentId, Optional.of(summary), Optional.empty());
    }

    public static DocumentResult failed(String documentId, String failure) {
        return new DocumentResult(documentId, Optional.empty(), Optional.of(failure));
    }

    public boolean succeeded() {
        return summary.isPresent();
    }
}
