package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;
import com.decisionfacts.taxonomy.MethodProfile;
import com.decisionfacts.taxonomy.PatternTaxonomy;
import com.decisionfacts.taxonomy.Polarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Combines the votes of independent outcome methods into one classification.
 *
 * Each method adds {@code weight × local confidence} to the label of every
 * polarity it found. The confidence of a label is its score divided by the
 * largest score the methods that fired could have produced. Ties (scores
 * within {@link OutcomeSettings#tieEpsilon()} of the maximum) resolve to a
 * partial outcome when allowed, then to the label backed by more methods,
 * else to {@link Outcome#UNDETERMINED}.
 */
public class OutcomeClassifier {

    private static final Logger log = LoggerFactory.getLogger(OutcomeClassifier.class);

    private static final List<Polarity> LABELS = List.of(Polarity.FAVORABLE, Polarity.UNFAVORABLE, Polarity.PARTIAL);

    private final PatternTaxonomy taxonomy;
    private final List<OutcomeMethod> methods;
    private final OutcomeSettings settings;

    public OutcomeClassifier(PatternTaxonomy taxonomy, List<OutcomeMethod> methods, OutcomeSettings settings) {
        this.taxonomy = taxonomy;
        this.methods = List.copyOf(methods);
        this.settings = settings;
    }

    /** Classifier running all six built-in methods in their canonical order. */
    public static OutcomeClassifier withDefaultMethods(PatternTaxonomy taxonomy, OutcomeSettings settings) {
        return new OutcomeClassifier(taxonomy, List.of(
            new DirectPatternMethod(taxonomy),
            new InferenceMethod(taxonomy),
            new LaborRightsMethod(taxonomy),
            new SemanticContextMethod(taxonomy),
            new DocumentStructureMethod(taxonomy),
            new LegalLanguageMethod(taxonomy)
        ), settings);
    }

    public OutcomeSettings settings() {
        return settings;
    }

    /**
     * Classify a decision. Null, blank or signal-free text yields
     * {@link OutcomeClassification#undetermined()}; this method does not throw on input.
     */
    public OutcomeClassification classify(String rawText) {
        String text = rawText == null ? "" : rawText.toLowerCase(Locale.ROOT);
        if (text.isBlank()) {
            return OutcomeClassification.undetermined();
        }

        Map<Polarity, Double> scores = new EnumMap<>(Polarity.class);
        Map<Polarity, Set<MethodId>> support = new EnumMap<>(Polarity.class);
        List<Evidence> evidence = new ArrayList<>();
        Set<MethodId> methodsUsed = EnumSet.noneOf(MethodId.class);
        double attainable = 0.0;

        for (OutcomeMethod method : methods) {
            MethodVote vote = method.vote(text);
            if (!vote.hasHits()) {
                continue;
            }
            MethodProfile profile = taxonomy.profile(vote.method());
            attainable += profile.maxContribution();
            methodsUsed.add(vote.method());

            Map<Polarity, Double> weighted = new EnumMap<>(Polarity.class);
            vote.localConfidence().forEach((polarity, local) -> {
                double score = profile.weight() * local;
                weighted.put(polarity, score);
                scores.merge(polarity, score, Double::sum);
                support.computeIfAbsent(polarity, p -> EnumSet.noneOf(MethodId.class)).add(vote.method());
            });
            for (OutcomeMethod.Hit hit : vote.hits()) {
                double share = hit.weight() / vote.weightSum(hit.polarity());
                evidence.add(new Evidence(vote.method(), hit.polarity(), hit.patternId(), hit.snippet(),
                    hit.weight(), weighted.get(hit.polarity()) * share));
            }
            log.debug("Method {} found {} hit(s), local confidence {}", vote.method(), vote.hits().size(),
                vote.localConfidence());
        }

        if (evidence.isEmpty()) {
            return OutcomeClassification.undetermined();
        }

        Verdict verdict = decide(scores, support, attainable);
        Map<Outcome, Double> labelScores = new EnumMap<>(Outcome.class);
        for (Polarity label : LABELS) {
            labelScores.put(Outcome.of(label), scores.getOrDefault(label, 0.0));
        }
        log.debug("Classified as {} ({}), scores {}", verdict.outcome(), verdict.confidence(), labelScores);
        return new OutcomeClassification(verdict.outcome(), verdict.confidence(), evidence,
            new ArrayList<>(methodsUsed), labelScores);
    }

    private Verdict decide(Map<Polarity, Double> scores, Map<Polarity, Set<MethodId>> support, double attainable) {
        double max = 0.0;
        for (Polarity label : LABELS) {
            max = Math.max(max, scores.getOrDefault(label, 0.0));
        }
        List<Polarity> contenders = new ArrayList<>();
        for (Polarity label : LABELS) {
            double score = scores.getOrDefault(label, 0.0);
            if (score > 0 && max - score <= settings.tieEpsilon()) {
                contenders.add(label);
            }
        }

        if (contenders.size() == 1) {
            Polarity winner = contenders.get(0);
            return new Verdict(Outcome.of(winner), normalize(scores.get(winner), attainable));
        }

        if (settings.preferPartialOnTie()) {
            if (contenders.contains(Polarity.PARTIAL)) {
                return new Verdict(Outcome.PARTIALLY_FAVORABLE, normalize(scores.get(Polarity.PARTIAL), attainable));
            }
            if (contenders.contains(Polarity.FAVORABLE) && contenders.contains(Polarity.UNFAVORABLE)) {
                double mean = (normalize(scores.get(Polarity.FAVORABLE), attainable)
                    + normalize(scores.get(Polarity.UNFAVORABLE), attainable)) / 2.0;
                return new Verdict(Outcome.PARTIALLY_FAVORABLE, mean);
            }
        }

        Polarity best = null;
        int bestSupport = -1;
        boolean tied = false;
        for (Polarity label : contenders) {
            int count = support.getOrDefault(label, Set.of()).size();
            if (count > bestSupport) {
                best = label;
                bestSupport = count;
                tied = false;
            } else if (count == bestSupport) {
                tied = true;
            }
        }
        if (!tied && best != null) {
            return new Verdict(Outcome.of(best), normalize(scores.get(best), attainable));
        }
        return new Verdict(Outcome.UNDETERMINED, normalize(max, attainable));
    }

    private static double normalize(double score, double attainable) {
        if (attainable <= 0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score / attainable));
    }

    private record Verdict(Outcome outcome, double confidence) {
    }
}
