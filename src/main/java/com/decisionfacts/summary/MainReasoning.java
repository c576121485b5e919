package com.decisionfacts.summary;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The legal grounds of a decision: the first sentences of the reasoning
 * section that cite a norm or precedent. The section runs from its heading
 * to the dispositive heading; without a reasoning heading the whole text is
 * searched.
 */
public final class MainReasoning {

    static final int MAX_SENTENCES = 2;
    private static final int MIN_SENTENCE_LENGTH = 30;

    private static final Pattern REASONING_HEADER = Pattern.compile(
        "(?m)^[ \\t]*(?:(?:[IVX]+|\\d+)\\s*[-–.)]\\s*)?(?:D[AO]\\s+)?"
            + "(?:FUNDAMENTAÇÃO|FUNDAMENTOS|MOTIVAÇÃO|MÉRITO|NO\\s+MÉRITO)[ \\t]*:?[ \\t]*$");

    private static final Pattern DISPOSITIVE_HEADER = Pattern.compile(
        "(?m)^[ \\t]*(?:(?:[IVX]+|\\d+)\\s*[-–.)]\\s*)?(?:DO\\s+|DA\\s+)?(?:DISPOSITIVO|CONCLUSÃO)[ \\t]*:?[ \\t]*$");

    private static final Pattern LEGAL_GROUNDS = Pattern.compile(
        "(?<![\\p{L}])(?:conforme|segundo|de\\s+acordo\\s+com|nos\\s+termos|previst[oa]s?|dispost[oa]s?"
            + "|artigos?|arts?\\.|incisos?|leis?|decretos?|súmulas?|orientação\\s+jurisprudencial|oj"
            + "|jurisprudência|precedentes?|clt|constituição)(?![\\p{L}])|§",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private MainReasoning() {
    }

    public static String select(String text, int maxLength) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String scope = DecisionSections.after(REASONING_HEADER, DISPOSITIVE_HEADER, text).orElse(text);
        List<String> grounds = new ArrayList<>(MAX_SENTENCES);
        for (String sentence : Sentences.split(scope)) {
            if (sentence.length() > MIN_SENTENCE_LENGTH && LEGAL_GROUNDS.matcher(sentence).find()) {
                grounds.add(sentence);
                if (grounds.size() == MAX_SENTENCES) {
                    break;
                }
            }
        }
        return DecisionExcerpt.truncate(String.join(" ", grounds), maxLength);
    }
}
