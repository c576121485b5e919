package com.decisionfacts.pipeline;

import com.decisionfacts.outcome.OutcomeSettings;
import com.decisionfacts.summary.DecisionExcerpt;
import com.decisionfacts.summary.MonetaryRequestExtractor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the extraction pipeline, bound from {@code decision-facts.*}.
 * Every value has a default, so an empty configuration runs the stock pipeline.
 */
@ConfigurationProperties(prefix = "decision-facts")
public class DecisionFactsProperties {

    private final Outcome outcome = new Outcome();
    private final Summary summary = new Summary();
    private final Concurrency concurrency = new Concurrency();

    public Outcome getOutcome() {
        return outcome;
    }

    public Summary getSummary() {
        return summary;
    }

    public Concurrency getConcurrency() {
        return concurrency;
    }

    public static class Outcome {

        /** Score gap under which two outcomes count as tied. */
        private double tieEpsilon = OutcomeSettings.DEFAULT_TIE_EPSILON;

        /** Resolve a favorable/unfavorable tie as partially favorable. */
        private boolean preferPartialOnTie = true;

        public double getTieEpsilon() {
            return tieEpsilon;
        }

        public void setTieEpsilon(double tieEpsilon) {
            this.tieEpsilon = tieEpsilon;
        }

        public boolean isPreferPartialOnTie() {
            return preferPartialOnTie;
        }

        public void setPreferPartialOnTie(boolean preferPartialOnTie) {
            this.preferPartialOnTie = preferPartialOnTie;
        }
    }

    public static class Summary {

        private double outcomeWeight = 0.5;
        private double partiesWeight = 0.25;
        private double referencesWeight = 0.25;
        private int excerptLength = DecisionExcerpt.DEFAULT_MAX_LENGTH;
        private int maxMonetaryMentions = MonetaryRequestExtractor.DEFAULT_MAX_MONETARY_MENTIONS;
        private int maxRequests = MonetaryRequestExtractor.DEFAULT_MAX_REQUESTS;

        public double getOutcomeWeight() {
            return outcomeWeight;
        }

        public void setOutcomeWeight(double outcomeWeight) {
            this.outcomeWeight = outcomeWeight;
        }

        public double getPartiesWeight() {
            return partiesWeight;
        }

        public void setPartiesWeight(double partiesWeight) {
            this.partiesWeight = partiesWeight;
        }

        public double getReferencesWeight() {
            return referencesWeight;
        }

        public void setReferencesWeight(double referencesWeight) {
            this.referencesWeight = referencesWeight;
        }

        public int getExcerptLength() {
            return excerptLength;
        }

        public void setExcerptLength(int excerptLength) {
            this.excerptLength = excerptLength;
        }

        public int getMaxMonetaryMentions() {
            return maxMonetaryMentions;
        }

        public void setMaxMonetaryMentions(int maxMonetaryMentions) {
            this.maxMonetaryMentions = maxMonetaryMentions;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }
    }

    public static class Concurrency {

        /** Threads shared by the extraction branches of all summaries. */
        private int extractorThreads = 4;

        /** Documents of a batch processed at the same time. */
        private int documentThreads = 4;

        /** Upper bound on the time spent on one document of a batch. */
        private Duration documentTimeout = Duration.ofSeconds(10);

        private int maxBatchSize = 500;

        public int getExtractorThreads() {
            return extractorThreads;
        }

        public void setExtractorThreads(int extractorThreads) {
            this.extractorThreads = extractorThreads;
        }

        public int getDocumentThreads() {
            return documentThreads;
        }

        public void setDocumentThreads(int documentThreads) {
            this.documentThreads = documentThreads;
        }

        public Duration getDocumentTimeout() {
            return documentTimeout;
        }

        public void setDocumentTimeout(Duration documentTimeout) {
            this.documentTimeout = documentTimeout;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }
    }
}
