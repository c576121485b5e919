package com.decisionfacts.pipeline;

import com.decisionfacts.outcome.LaborRightsAnalyzer;
import com.decisionfacts.outcome.Outcome;
import com.decisionfacts.outcome.OutcomeClassifier;
import com.decisionfacts.outcome.OutcomeSettings;
import com.decisionfacts.parties.PartyExtractor;
import com.decisionfacts.references.LegalReferenceExtractor;
import com.decisionfacts.summary.DecisionExcerpt;
import com.decisionfacts.summary.DecisionText;
import com.decisionfacts.summary.MonetaryRequestExtractor;
import com.decisionfacts.summary.StructuredSummarizer;
import com.decisionfacts.summary.StructuredSummary;
import com.decisionfacts.summary.SummaryWeights;
import com.decisionfacts.summary.TextNormalizer;
import com.decisionfacts.taxonomy.DefaultTaxonomy;
import com.decisionfacts.taxonomy.PatternTaxonomy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DecisionBatchProcessorTest {

    private MdcPropagatingExecutor extractorExecutor;
    private MdcPropagatingExecutor documentExecutor;
    private StructuredSummarizer summarizer;

    @BeforeEach
    void setUp() {
        extractorExecutor = new MdcPropagatingExecutor("test-extractor", 4);
        documentExecutor = new MdcPropagatingExecutor("test-document", 4);
        PatternTaxonomy taxonomy = DefaultTaxonomy.create();
        OutcomeClassifier classifier = OutcomeClassifier.withDefaultMethods(taxonomy, OutcomeSettings.defaults());
        summarizer = new StructuredSummarizer(new TextNormalizer(), classifier, new LaborRightsAnalyzer(taxonomy),
            new PartyExtractor(), new LegalReferenceExtractor(), new MonetaryRequestExtractor(),
            SummaryWeights.defaults(), DecisionExcerpt.DEFAULT_MAX_LENGTH, extractorExecutor, "test-version") {
            @Override
            public StructuredSummary summarize(DecisionText document) {
                if ("bad".equals(document.documentId())) {
                    throw new IllegalStateException("corrupt document");
                }
                if ("slow".equals(document.documentId())) {
                    try {
                        Thread.sleep(2_000);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.summarize(document);
            }
        };
    }

    @AfterEach
    void tearDown() {
        documentExecutor.shutdown();
        extractorExecutor.shutdown();
    }

    @Test
    @DisplayName("Batch keeps input order and isolates a failing document")
    void failingDocument_doesNotAffectOthers() {
        DecisionBatchProcessor processor = new DecisionBatchProcessor(summarizer, documentExecutor, Duration.ofSeconds(10));

        List<DocumentResult> results = processor.processAll(List.of(
            new DecisionText("a", "Julgo procedente o pedido.", null, null),
            new DecisionText("bad", "Julgo procedente o pedido.", null, null),
            new DecisionText("c", "Julgo improcedente o pedido.", null, null)));

        assertEquals(List.of("a", "bad", "c"), results.stream().map(DocumentResult::documentId).toList());
        assertTrue(results.get(0).succeeded());
        assertEquals(Outcome.FAVORABLE_TO_CLAIMANT, results.get(0).summary().orElseThrow().outcome().outcome());
        assertFalse(results.get(1).succeeded());
        assertTrue(results.get(1).failure().orElseThrow().contains("corrupt document"));
        assertEquals(Outcome.FAVORABLE_TO_DEFENDANT, results.get(2).summary().orElseThrow().outcome().outcome());
    }

    @Test
    @DisplayName("A slow document times out without holding back the batch")
    void slowDocument_timesOut() {
        DecisionBatchProcessor processor = new DecisionBatchProcessor(summarizer, documentExecutor, Duration.ofMillis(200));

        List<DocumentResult> results = processor.processAll(List.of(
            new DecisionText("slow", "Julgo procedente o pedido.", null, null),
            new DecisionText("fast", "Julgo procedente o pedido.", null, null)));

        assertFalse(results.get(0).succeeded());
        assertTrue(results.get(0).failure().orElseThrow().contains("timed out"));
        assertTrue(results.get(1).succeeded());
    }

    @Test
    void documentWithoutId_isLabelledByPosition() {
        DecisionBatchProcessor processor = new DecisionBatchProcessor(summarizer, documentExecutor, Duration.ofSeconds(10));

        List<DocumentResult> results = processor.processAll(List.of(DecisionText.of("")));

        assertEquals("#0", results.get(0).documentId());
        assertTrue(results.get(0).succeeded());
    }

    @Test
    void nonPositiveTimeout_isRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new DecisionBatchProcessor(summarizer, documentExecutor, Duration.ZERO));
    }

    @Test
    @DisplayName("Executor runs tasks with the caller's MDC and clears it afterwards")
    void executor_propagatesMdc() throws Exception {
        MDC.put("documentId", "doc-42");
        try {
            CompletableFuture<String> seen = CompletableFuture.supplyAsync(() -> MDC.get("documentId"), documentExecutor);
            assertEquals("doc-42", seen.get(5, TimeUnit.SECONDS));
        } finally {
            MDC.remove("documentId");
        }

        CompletableFuture<String> after = CompletableFuture.supplyAsync(() -> MDC.get("documentId"), documentExecutor);
        assertNull(after.get(5, TimeUnit.SECONDS));
    }
}
