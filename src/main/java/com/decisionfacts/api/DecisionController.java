package com.decisionfacts.api;

import com.decisionfacts.outcome.OutcomeClassification;
import com.decisionfacts.outcome.OutcomeClassifier;
import com.decisionfacts.pipeline.DecisionBatchProcessor;
import com.decisionfacts.pipeline.DecisionFactsProperties;
import com.decisionfacts.pipeline.DocumentResult;
import com.decisionfacts.summary.DecisionText;
import com.decisionfacts.summary.StructuredSummarizer;
import com.decisionfacts.summary.StructuredSummary;
import com.decisionfacts.summary.TextNormalizer;
import com.decisionfacts.taxonomy.PatternTaxonomy;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class DecisionController {

    private final StructuredSummarizer summarizer;
    private final OutcomeClassifier outcomeClassifier;
    private final TextNormalizer normalizer;
    private final DecisionBatchProcessor batchProcessor;
    private final PatternTaxonomy taxonomy;
    private final int maxBatchSize;

    public DecisionController(StructuredSummarizer summarizer,
                              OutcomeClassifier outcomeClassifier,
                              TextNormalizer normalizer,
                              DecisionBatchProcessor batchProcessor,
                              PatternTaxonomy taxonomy,
                              DecisionFactsProperties properties) {
        this.summarizer = summarizer;
        this.outcomeClassifier = outcomeClassifier;
        this.normalizer = normalizer;
        this.batchProcessor = batchProcessor;
        this.taxonomy = taxonomy;
        this.maxBatchSize = properties.getConcurrency().getMaxBatchSize();
    }

    @PostMapping("/decisions/summary")
    public StructuredSummary summarize(@RequestBody DecisionRequest request) {
        return summarizer.summarize(request.toDecisionText());
    }

    @PostMapping("/decisions/batch")
    public List<DocumentResult> summarizeBatch(@RequestBody List<DecisionRequest> requests) {
        if (requests.size() > maxBatchSize) {
            throw new IllegalArgumentException(
                "batch of " + requests.size() + " documents exceeds the limit of " + maxBatchSize);
        }
        List<DecisionText> documents = new ArrayList<>(requests.size());
        for (DecisionRequest request : requests) {
            documents.add(request.toDecisionText());
        }
        return batchProcessor.processAll(documents);
    }

    @PostMapping("/decisions/outcome")
    public OutcomeClassification classify(@RequestBody DecisionRequest request) {
        return outcomeClassifier.classify(normalizer.normalize(request.toDecisionText().text()));
    }

    @GetMapping("/taxonomy")
    public Map<String, Object> taxonomy() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("taxonomy_version", taxonomy.version());
        body.put("pipeline_version", summarizer.pipelineVersion());
        body.put("pattern_count", taxonomy.patternCount());
        return body;
    }
}
