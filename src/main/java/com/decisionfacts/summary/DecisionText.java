package com.decisionfacts.summary;

/**
 * One decision to summarize. A null text is read as empty; hints are optional.
 *
 * @param partiesHint    raw parties string supplied by the caller, e.g. "FULANO x EMPRESA LTDA"
 * @param referencesHint raw legislative-reference field, entries separated by ';', '|' or new lines
 */
public record DecisionText(String documentId, String text, String partiesHint, String referencesHint) {

    public DecisionText {
        text = text == null ? "" : text;
    }

    public static DecisionText of(String text) {
        return new DecisionText(null, text, null, null);
    }
}
