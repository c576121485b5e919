package com.decisionfacts.summary;

/** A summary branch that failed and contributed no signal. */
public record ExtractionFailure(String component, String detail) {
}
