package com.decisionfacts.pipeline;

import com.decisionfacts.summary.StructuredSummarizer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfiguration {

    @Bean(destroyMethod = "shutdown")
    public MdcPropagatingExecutor extractorExecutor(DecisionFactsProperties properties) {
        return new MdcPropagatingExecutor("extractor", properties.getConcurrency().getExtractorThreads());
    }

    @Bean(destroyMethod = "shutdown")
    public MdcPropagatingExecutor documentExecutor(DecisionFactsProperties properties) {
        return new MdcPropagatingExecutor("document", properties.getConcurrency().getDocumentThreads());
    }

    @Bean
    public DecisionBatchProcessor decisionBatchProcessor(StructuredSummarizer summarizer,
                                                         @Qualifier("documentExecutor") MdcPropagatingExecutor documentExecutor,
                                                         DecisionFactsProperties properties) {
        return new DecisionBatchProcessor(summarizer, documentExecutor, properties.getConcurrency().getDocumentTimeout());
    }
}
