package com.decisionfacts.summary;

import com.decisionfacts.outcome.LaborRightsAnalyzer;
import com.decisionfacts.outcome.OutcomeClassifier;
import com.decisionfacts.outcome.OutcomeSettings;
import com.decisionfacts.parties.PartyExtractor;
import com.decisionfacts.pipeline.DecisionFactsProperties;
import com.decisionfacts.pipeline.MdcPropagatingExecutor;
import com.decisionfacts.references.LegalReferenceExtractor;
import com.decisionfacts.taxonomy.PatternTaxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SummaryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SummaryConfiguration.class);

    @Bean
    public TextNormalizer textNormalizer() {
        return new TextNormalizer();
    }

    @Bean
    public LaborRightsAnalyzer laborRightsAnalyzer(PatternTaxonomy taxonomy) {
        return new LaborRightsAnalyzer(taxonomy);
    }

    @Bean
    public PartyExtractor partyExtractor() {
        return new PartyExtractor();
    }

    @Bean
    public LegalReferenceExtractor legalReferenceExtractor() {
        return new LegalReferenceExtractor();
    }

    @Bean
    public MonetaryRequestExtractor monetaryRequestExtractor(DecisionFactsProperties properties) {
        DecisionFactsProperties.Summary summary = properties.getSummary();
        return new MonetaryRequestExtractor(summary.getMaxMonetaryMentions(), summary.getMaxRequests());
    }

    @Bean
    public SummaryWeights summaryWeights(DecisionFactsProperties properties) {
        DecisionFactsProperties.Summary summary = properties.getSummary();
        return new SummaryWeights(summary.getOutcomeWeight(), summary.getPartiesWeight(), summary.getReferencesWeight());
    }

    /**
     * The summarizer stamps every summary with the pipeline version computed
     * here once at startup.
     */
    @Bean
    public StructuredSummarizer structuredSummarizer(PatternTaxonomy taxonomy,
                                                     TextNormalizer textNormalizer,
                                                     OutcomeClassifier outcomeClassifier,
                                                     LaborRightsAnalyzer laborRightsAnalyzer,
                                                     OutcomeSettings outcomeSettings,
                                                     PartyExtractor partyExtractor,
                                                     LegalReferenceExtractor legalReferenceExtractor,
                                                     MonetaryRequestExtractor monetaryRequestExtractor,
                                                     SummaryWeights summaryWeights,
                                                     @Qualifier("extractorExecutor") MdcPropagatingExecutor extractorExecutor,
                                                     DecisionFactsProperties properties) {
        String pipelineVersion = PipelineVersion.of(taxonomy, summaryWeights, outcomeSettings);
        log.info("Pipeline version {}", pipelineVersion);
        return new StructuredSummarizer(textNormalizer, outcomeClassifier, laborRightsAnalyzer, partyExtractor,
            legalReferenceExtractor, monetaryRequestExtractor, summaryWeights,
            properties.getSummary().getExcerptLength(), extractorExecutor, pipelineVersion);
    }
}
