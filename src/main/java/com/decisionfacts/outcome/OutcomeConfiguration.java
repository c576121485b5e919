package com.decisionfacts.outcome;

import com.decisionfacts.pipeline.DecisionFactsProperties;
import com.decisionfacts.taxonomy.PatternTaxonomy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OutcomeConfiguration {

    @Bean
    public OutcomeSettings outcomeSettings(DecisionFactsProperties properties) {
        DecisionFactsProperties.Outcome outcome = properties.getOutcome();
        return new OutcomeSettings(outcome.getTieEpsilon(), outcome.isPreferPartialOnTie());
    }

    @Bean
    public OutcomeClassifier outcomeClassifier(PatternTaxonomy taxonomy, OutcomeSettings outcomeSettings) {
        return OutcomeClassifier.withDefaultMethods(taxonomy, outcomeSettings);
    }
}
