package com.decisionfacts.summary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits decision text into sentences. A blank line always ends a sentence;
 * a '.', '!' or '?' followed by whitespace does, except after a legal or
 * corporate abbreviation ("Art.", "nº.", "fls.", "Ltda.") or before a
 * lower-case word.
 */
final class Sentences {

    private static final Pattern BREAK = Pattern.compile("(?<=[.!?])\\s+|\\r?\\n[ \\t]*\\r?\\n");

    private static final Set<String> ABBREVIATIONS = Set.of(
        "art", "arts", "n", "nº", "fl", "fls", "pág", "pag", "p", "inc", "al", "par", "cap",
        "dr", "dra", "drs", "sr", "sra", "srs", "exmo", "exma", "des", "min", "rel", "proc", "ac", "res",
        "ltda", "cia", "me", "epp", "eireli", "s/a", "jr", "av", "ss", "vol", "ed", "obs");

    private Sentences() {
    }

    /** Sentences in text order, whitespace collapsed, blanks dropped. */
    static List<String> split(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }
        Matcher matcher = BREAK.matcher(text);
        int start = 0;
        while (matcher.find()) {
            if (!blankLine(matcher.group()) && !endsSentence(text, matcher.start(), matcher.end())) {
                continue;
            }
            add(sentences, text.substring(start, matcher.start()));
            start = matcher.end();
        }
        add(sentences, text.substring(start));
        return sentences;
    }

    private static boolean blankLine(String gap) {
        return gap.indexOf('\n') != gap.lastIndexOf('\n');
    }

    private static boolean endsSentence(String text, int mark, int next) {
        if (next < text.length() && Character.isLowerCase(text.charAt(next))) {
            return false;
        }
        if (text.charAt(mark - 1) != '.') {
            return true;
        }
        int begin = mark - 1;
        while (begin > 0 && isWordChar(text.charAt(begin - 1))) {
            begin--;
        }
        String word = text.substring(begin, mark - 1).toLowerCase(Locale.ROOT);
        if (word.isEmpty()) {
            return true;
        }
        boolean initial = word.length() == 1 && Character.isLetter(word.charAt(0));
        return !initial && !ABBREVIATIONS.contains(word);
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == 'º' || c == 'ª' || c == '/';
    }

    private static void add(List<String> sentences, String raw) {
        String sentence = raw.replaceAll("\\s+", " ").trim();
        if (!sentence.isEmpty()) {
            sentences.add(sentence);
        }
    }
}
