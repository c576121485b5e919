package com.decisionfacts.summary;

import com.decisionfacts.outcome.LaborRightsAnalyzer;
import com.decisionfacts.outcome.OutcomeClassification;
import com.decisionfacts.outcome.OutcomeClassifier;
import com.decisionfacts.outcome.RightOutcome;
import com.decisionfacts.parties.ExtractedParties;
import com.decisionfacts.parties.PartyExtractor;
import com.decisionfacts.references.LegalReference;
import com.decisionfacts.references.LegalReferenceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Normalizes one decision, runs the outcome, per-right, party, reference and
 * monetary/request extractors over it and assembles their results into a
 * {@link StructuredSummary}.
 *
 * Branches run concurrently on the given executor. A branch that throws is
 * recorded as an {@link ExtractionFailure} and contributes its no-signal
 * value; the other branches are unaffected.
 */
public class StructuredSummarizer {

    private static final Logger log = LoggerFactory.getLogger(StructuredSummarizer.class);

    static final String DOCUMENT_ID_KEY = "documentId";

    private final TextNormalizer normalizer;
    private final OutcomeClassifier outcomeClassifier;
    private final LaborRightsAnalyzer rightsAnalyzer;
    private final PartyExtractor partyExtractor;
    private final LegalReferenceExtractor referenceExtractor;
    private final MonetaryRequestExtractor monetaryRequestExtractor;
    private final SummaryWeights weights;
    private final int excerptLength;
    private final Executor executor;
    private final String pipelineVersion;

    public StructuredSummarizer(TextNormalizer normalizer,
                                OutcomeClassifier outcomeClassifier,
                                LaborRightsAnalyzer rightsAnalyzer,
                                PartyExtractor partyExtractor,
                                LegalReferenceExtractor referenceExtractor,
                                MonetaryRequestExtractor monetaryRequestExtractor,
                                SummaryWeights weights,
                                int excerptLength,
                                Executor executor,
                                String pipelineVersion) {
        if (excerptLength <= 0) {
            throw new IllegalArgumentException("excerpt length must be positive: " + excerptLength);
        }
        this.normalizer = normalizer;
        this.outcomeClassifier = outcomeClassifier;
        this.rightsAnalyzer = rightsAnalyzer;
        this.partyExtractor = partyExtractor;
        this.referenceExtractor = referenceExtractor;
        this.monetaryRequestExtractor = monetaryRequestExtractor;
        this.weights = weights;
        this.excerptLength = excerptLength;
        this.executor = executor;
        this.pipelineVersion = pipelineVersion;
    }

    public String pipelineVersion() {
        return pipelineVersion;
    }

    public StructuredSummary summarize(DecisionText document) {
        boolean tagged = document.documentId() != null && MDC.get(DOCUMENT_ID_KEY) == null;
        if (tagged) {
            MDC.put(DOCUMENT_ID_KEY, document.documentId());
        }
        try {
            return doSummarize(document);
        } finally {
            if (tagged) {
                MDC.remove(DOCUMENT_ID_KEY);
            }
        }
    }

    private StructuredSummary doSummarize(DecisionText document) {
        String text = normalizer.normalize(document.text());

        CompletableFuture<Branch<OutcomeClassification>> outcome = branch("outcome",
            () -> outcomeClassifier.classify(text), OutcomeClassification.undetermined());
        CompletableFuture<Branch<List<RightOutcome>>> rights = branch("rights",
            () -> rightsAnalyzer.analyze(text), List.of());
        CompletableFuture<Branch<ExtractedParties>> parties = branch("parties",
            () -> partyExtractor.extract(text, document.partiesHint()), ExtractedParties.empty());
        CompletableFuture<Branch<List<LegalReference>>> references = branch("references",
            () -> referenceExtractor.extract(text, document.referencesHint()), List.of());
        CompletableFuture<Branch<MonetaryRequestExtractor.Result>> monetary = branch("monetary",
            () -> monetaryRequestExtractor.extract(text), MonetaryRequestExtractor.Result.empty());

        CompletableFuture.allOf(outcome, rights, parties, references, monetary).join();

        List<ExtractionFailure> failures = new ArrayList<>();
        OutcomeClassification classification = outcome.join().collect(failures);
        List<RightOutcome> rightOutcomes = rights.join().collect(failures);
        ExtractedParties extractedParties = parties.join().collect(failures);
        List<LegalReference> legalReferences = references.join().collect(failures);
        MonetaryRequestExtractor.Result monetaryResult = monetary.join().collect(failures);

        double overall = weights.combine(classification.confidence(), extractedParties.confidence(),
            LegalReferenceExtractor.confidence(legalReferences));

        StructuredSummary summary = new StructuredSummary(
            classification,
            rightOutcomes,
            extractedParties,
            legalReferences,
            monetaryResult.monetaryMentions(),
            monetaryResult.mainRequests(),
            DecisionExcerpt.select(text, excerptLength),
            MainReasoning.select(text, excerptLength),
            overall,
            pipelineVersion,
            failures);
        log.debug("Summary built: outcome={}, references={}, failures={}",
            classification.outcome(), legalReferences.size(), failures.size());
        return summary;
    }

    private <T> CompletableFuture<Branch<T>> branch(String component, Supplier<T> work, T fallback) {
        return CompletableFuture.supplyAsync(work, executor)
            .handle((value, ex) -> {
                if (ex == null) {
                    return new Branch<>(value, Optional.empty());
                }
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                log.warn("Extraction branch '{}' failed: {}", component, cause.toString());
                return new Branch<>(fallback, Optional.of(new ExtractionFailure(component,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage())));
            });
    }

    private record Branch<T>(T value, Optional<ExtractionFailure> failure) {

        T collect(List<ExtractionFailure> failures) {
            failure.ifPresent(failures::add);
            return value;
        }
    }
}
