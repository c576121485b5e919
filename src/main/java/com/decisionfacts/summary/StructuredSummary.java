package com.decisionfacts.summary;

import com.decisionfacts.outcome.OutcomeClassification;
import com.decisionfacts.outcome.RightOutcome;
import com.decisionfacts.parties.ExtractedParties;
import com.decisionfacts.references.LegalReference;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Structured facts of one decision. Holds no clock-dependent data, so the
 * same text and pipeline version always give an equal summary.
 *
 * @param rightOutcomes verdict per labor right, in order of first mention
 * @param mainReasoning the first sentences of the reasoning that cite legal grounds, or ""
 * @param failures branches that failed; their fields hold the no-signal value
 */
public record StructuredSummary(
    OutcomeClassification outcome,
    List<RightOutcome> rightOutcomes,
    ExtractedParties parties,
    List<LegalReference> legalReferences,
    List<MonetaryMention> monetaryMentions,
    List<String> mainRequests,
    String decisionExcerpt,
    String mainReasoning,
    double overallConfidence,
    String pipelineVersion,
    List<ExtractionFailure> failures
) {

    public StructuredSummary {
        rightOutcomes = List.copyOf(rightOutcomes);
        legalReferences = List.copyOf(legalReferences);
        monetaryMentions = List.copyOf(monetaryMentions);
        mainRequests = List.copyOf(mainRequests);
        failures = List.copyOf(failures);
    }

    @JsonIgnore
    public boolean isDegraded() {
        return !failures.isEmpty();
    }
}
