package com.decisionfacts.pipeline;

import com.decisionfacts.summary.DecisionText;
import com.decisionfacts.summary.StructuredSummarizer;
import com.decisionfacts.summary.StructuredSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Summarizes many decisions concurrently. Results come back in input order and
 * one failing or slow document never affects the others.
 */
public class DecisionBatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(DecisionBatchProcessor.class);

    private final StructuredSummarizer summarizer;
    private final Executor executor;
    private final Duration documentTimeout;

    public DecisionBatchProcessor(StructuredSummarizer summarizer, Executor executor, Duration documentTimeout) {
        if (documentTimeout.isNegative() || documentTimeout.isZero()) {
            throw new IllegalArgumentException("document timeout must be positive");
        }
        this.summarizer = summarizer;
        this.executor = executor;
        this.documentTimeout = documentTimeout;
    }

    public List<DocumentResult> processAll(List<DecisionText> documents) {
        List<CompletableFuture<StructuredSummary>> futures = new ArrayList<>(documents.size());
        for (DecisionText document : documents) {
            futures.add(CompletableFuture.supplyAsync(() -> summarizer.summarize(document), executor));
        }

        List<DocumentResult> results = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            String documentId = documentId(documents.get(i), i);
            results.add(await(documentId, futures.get(i)));
        }
        long failed = results.stream().filter(r -> !r.succeeded()).count();
        log.info("Batch processed: documents={}, failed={}", results.size(), failed);
        return results;
    }

    private DocumentResult await(String documentId, CompletableFuture<StructuredSummary> future) {
        try {
            StructuredSummary summary = future.get(documentTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Document {} summarized: outcome={}, confidence={}",
                documentId, summary.outcome().outcome(), summary.overallConfidence());
            return DocumentResult.success(documentId, summary);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Document {} timed out after {}", documentId, documentTimeout);
            return DocumentResult.failed(documentId, "timed out after " + documentTimeout.toMillis() + " ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("Document {} failed: {}", documentId, cause.toString());
            return DocumentResult.failed(documentId, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DocumentResult.failed(documentId, "interrupted");
        }
    }

    private static String documentId(DecisionText document, int index) {
        return document.documentId() != null ? document.documentId() : "#" + index;
    }
}
