package com.decisionfacts.references;

import java.util.Locale;
import java.util.Map;

/** Canonical spelling of the parts of a citation. */
final class CitationNormalizer {

    private static final Map<String, String> SOURCES = Map.ofEntries(
        Map.entry("clt", "CLT"),
        Map.entry("consolidação das leis do trabalho", "CLT"),
        Map.entry("cf", "CF"),
        Map.entry("cf/88", "CF"),
        Map.entry("constituição", "CF"),
        Map.entry("constituição federal", "CF"),
        Map.entry("constituição da república", "CF"),
        Map.entry("cc", "CC"),
        Map.entry("código civil", "CC"),
        Map.entry("cpc", "CPC"),
        Map.entry("código de processo civil", "CPC"),
        Map.entry("cp", "CP"),
        Map.entry("código penal", "CP"),
        Map.entry("cdc", "CDC"),
        Map.entry("código de defesa do consumidor", "CDC"),
        Map.entry("adct", "ADCT")
    );

    private static final Map<String, String> AGENCIES = Map.of(
        "mte", "MTE",
        "mtb", "MTb",
        "mtps", "MTPS",
        "mtp", "MTP",
        "sit", "SIT",
        "rfb", "RFB",
        "inss", "INSS",
        "tst", "TST"
    );

    private CitationNormalizer() {
    }

    /** Digits only, with dots as thousands separators: {@code 8213 -> 8.213}. */
    static String number(String raw) {
        String digits = raw.replaceAll("\\D", "").replaceFirst("^0+(?=\\d)", "");
        StringBuilder out = new StringBuilder();
        int lead = digits.length() % 3;
        for (int i = 0; i < digits.length(); i++) {
            if (i > 0 && (i - lead) % 3 == 0) {
                out.append('.');
            }
            out.append(digits.charAt(i));
        }
        return out.toString();
    }

    /** Four-digit year; two-digit years from 30 on are 19xx, the rest 20xx. */
    static String year(String raw) {
        if (raw.length() == 2) {
            int value = Integer.parseInt(raw);
            return (value >= 30 ? "19" : "20") + raw;
        }
        return raw;
    }

    /** Adds the ordinal mark to numbers one to nine: {@code 7 -> 7º}, {@code 10 -> 10}. */
    static String ordinal(String number) {
        String digits = number.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return number;
        }
        return digits.length() == 1 && !"0".equals(digits) ? number + "º" : number;
    }

    static String source(String raw) {
        String key = raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return SOURCES.getOrDefault(key, raw.trim().toUpperCase(Locale.ROOT));
    }

    static String agency(String raw) {
        return AGENCIES.getOrDefault(raw.toLowerCase(Locale.ROOT), raw.toUpperCase(Locale.ROOT));
    }

    /** Roman numerals {@code I} and {@code II} and plain digits, as used by the SDI sections. */
    static String section(String raw) {
        String value = raw.trim().toUpperCase(Locale.ROOT);
        return switch (value) {
            case "I" -> "1";
            case "II" -> "2";
            default -> value;
        };
    }
}
