package com.decisionfacts.taxonomy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaxonomyConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyConfiguration.class);

    /** Built and validated once; an invalid entry stops the application from starting. */
    @Bean
    public PatternTaxonomy patternTaxonomy() {
        PatternTaxonomy taxonomy = DefaultTaxonomy.create();
        log.info("Loaded pattern taxonomy {} with {} patterns", taxonomy.version(), taxonomy.patternCount());
        return taxonomy;
    }
}
