package com.decisionfacts.summary;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates headed sections of a decision. A heading is a line of upper-case
 * words, optionally numbered ("II - PEDIDOS", "3. MÉRITO").
 */
final class DecisionSections {

    static final Pattern HEADING = Pattern.compile(
        "(?m)^[ \\t]*(?:(?:[IVX]+|\\d+)\\s*[-–.)]\\s*)?[A-ZÁÉÍÓÚÂÊÔÃÕÇ][A-ZÁÉÍÓÚÂÊÔÃÕÇ ]{3,}[ \\t]*:?[ \\t]*$");

    private DecisionSections() {
    }

    /** Text after the first line matching {@code header}, up to the next heading. */
    static Optional<String> after(Pattern header, String text) {
        return after(header, HEADING, text);
    }

    /** Text after the first line matching {@code header}, up to the first match of {@code end} after it. */
    static Optional<String> after(Pattern header, Pattern end, String text) {
        Matcher start = header.matcher(text);
        if (!start.find()) {
            return Optional.empty();
        }
        Matcher next = end.matcher(text);
        int stop = next.find(start.end()) ? next.start() : text.length();
        return Optional.of(text.substring(start.end(), stop));
    }
}
