package com.decisionfacts.api;

import com.decisionfacts.summary.DecisionText;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body of the decision endpoints. A missing {@code text} is read as empty.
 */
public record DecisionRequest(
    @JsonProperty("document_id") String documentId,
    @JsonProperty("text") String text,
    @JsonProperty("parties_hint") String partiesHint,
    @JsonProperty("references_hint") String referencesHint
) {

    DecisionText toDecisionText() {
        return new DecisionText(documentId, text, partiesHint, referencesHint);
    }
}
