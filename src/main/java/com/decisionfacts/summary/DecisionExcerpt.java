package com.decisionfacts.summary;

import java.util.regex.Pattern;

/**
 * Picks a short excerpt of the decision: the earliest sentence that reads
 * like a ruling, else the opening of the text.
 */
public final class DecisionExcerpt {

    public static final int DEFAULT_MAX_LENGTH = 200;

    private static final String ELLIPSIS = "...";
    private static final int MIN_SENTENCE_LENGTH = 20;

    private static final Pattern RULING_VERB = Pattern.compile(
        "(?<![\\p{L}])(?:julgo|decido|determino|condeno|reconheço|defiro|indefiro|acolho|rejeito|extingo|homologo"
            + "|concedo|arbitro|declaro|mantenho|reformo|dou\\s+provimento|nego\\s+provimento)(?![\\p{L}])",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern RULING_WORD = Pattern.compile(
        "(?<![\\p{L}])(?:julga|julgou|decide|decidiu|determina|determinou|condena|condenou|reconhece|reconheceu"
            + "|defere|deferiu|indefere|indeferiu|acolhe|acolheu|rejeita|rejeitou|procedente|procedência|improcedente"
            + "|improcedência|parcialmente|extingue|extinguiu|homologa|homologou|concede|concedeu|arbitra|arbitrou"
            + "|declara|declarou|mantém|manteve|reforma|reformou|dá\\s+provimento|nega\\s+provimento|provido"
            + "|desprovido|improvido)(?![\\p{L}])",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private DecisionExcerpt() {
    }

    public static String select(String text, int maxLength) {
        if (text == null || text.isBlank()) {
            return "";
        }
        for (String sentence : Sentences.split(text)) {
            boolean ruledByVerb = RULING_VERB.matcher(sentence).find();
            boolean ruledByWord = sentence.length() > MIN_SENTENCE_LENGTH && RULING_WORD.matcher(sentence).find();
            if (ruledByVerb || ruledByWord) {
                return truncate(sentence, maxLength);
            }
        }
        return truncate(text.replaceAll("\\s+", " ").trim(), maxLength);
    }

    static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength) + ELLIPSIS;
    }
}
