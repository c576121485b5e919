package com.decisionfacts.references;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds legal citations and rewrites each into its canonical form, e.g.
 * {@code "artigo 7 da CLT"} and {@code "CLT, art. 7º"} both become {@code "Art. 7º CLT"}.
 *
 * Citations from the references hint are parsed the same way, marked
 * {@link Provenance#PRE_EXISTING} and merged with the extracted ones.
 */
public class LegalReferenceExtractor {

    private static final Logger log = LoggerFactory.getLogger(LegalReferenceExtractor.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern HINT_SEPARATOR = Pattern.compile("[;|\\r\\n]+");

    private static final String NO = "(?:n(?:[º°o]|\\.)\\s*[º°]?\\s*)?";
    private static final String NUM = "(\\d{1,3}(?:\\.\\d{3})+|\\d+)";
    private static final String YEAR = "(?:\\s*/\\s*(\\d{4}|\\d{2})(?!\\d)"
        + "|,?\\s+de\\s+(?:\\d{1,2}º?\\s+de\\s+\\p{L}+\\s+de\\s+)?(\\d{4})(?!\\d))?";
    private static final String SOURCE = "(Consolidação\\s+das\\s+Leis\\s+do\\s+Trabalho|CLT|CF/88|CF"
        + "|Constituição\\s+Federal|Constituição\\s+da\\s+República|Constituição"
        + "|Código\\s+de\\s+Processo\\s+Civil|Código\\s+de\\s+Defesa\\s+do\\s+Consumidor|Código\\s+Civil|Código\\s+Penal"
        + "|CPC|CDC|CC|CP|ADCT)(?![\\p{L}])";
    private static final String ARTICLE_BODY = "art(?:igo)?s?\\.?\\s*(\\d{1,3}(?:\\.\\d{3})*)\\s*(?:º|°|o(?![\\p{L}]))?"
        + "(?:\\s*-\\s*([A-Z])(?![\\p{L}]))?"
        + "(?:\\s*,?\\s*caput(?![\\p{L}]))?"
        + "(?:\\s*,?\\s*(?:§|par[áa]grafo)\\s*(\\d+|único)\\s*[º°]?)?"
        + "(?:\\s*,?\\s*(?:inciso\\s+)?((?-i:[IVXLC]+))(?![\\p{L}]))?"
        + "(?:\\s*,?\\s*al[íi]nea\\s+\"?[a-z]\"?)?";
    private static final String LIST_ITEM = "\\d{1,3}(?:\\.\\d{3})*\\s*(?:º|°|o(?![\\p{L}]))?(?:\\s*-\\s*[A-Z](?![\\p{L}]))?";
    private static final String ARTICLE_LIST = "art(?:igo)?s\\.?\\s*(" + LIST_ITEM + "(?:\\s*,\\s*" + LIST_ITEM + ")*"
        + "\\s*,?\\s+e\\s+" + LIST_ITEM + ")";

    private static final Pattern ARTICLE_LIST_ITEM = Pattern.compile(
        "(\\d{1,3}(?:\\.\\d{3})*)\\s*(?:º|°|o(?![\\p{L}]))?(?:\\s*-\\s*([A-Z])(?![\\p{L}]))?", FLAGS);

    private final List<CitationRule> rules = List.of(
        new CitationRule(ReferenceKind.ARTICLE,
            Pattern.compile("(?<![\\p{L}])" + ARTICLE_LIST + "\\s*,?\\s*(?:d[aoe]\\s+)?" + SOURCE, FLAGS),
            m -> articleList(m.group(1), m.group(2))),
        single(ReferenceKind.ARTICLE,
            Pattern.compile("(?<![\\p{L}])" + ARTICLE_BODY + "\\s*,?\\s*(?:d[aoe]\\s+)?" + SOURCE, FLAGS),
            m -> article(m.group(1), m.group(2), m.group(3), m.group(4), m.group(5))),
        single(ReferenceKind.ARTICLE,
            Pattern.compile("(?<![\\p{L}])" + SOURCE + "\\s*,\\s*" + ARTICLE_BODY, FLAGS),
            m -> article(m.group(2), m.group(3), m.group(4), m.group(5), m.group(1))),
        single(ReferenceKind.DECREE,
            Pattern.compile("(?<![\\p{L}])(Decreto\\s*-?\\s*Lei|Decreto)(?![\\p{L}])\\s*" + NO + NUM + YEAR, FLAGS),
            m -> numbered(m.group(1).toLowerCase(Locale.ROOT).contains("lei") ? "Decreto-Lei" : "Decreto",
                m.group(2), m.group(3), m.group(4))),
        single(ReferenceKind.STATUTE,
            Pattern.compile("(?<![\\p{L}-])(Lei\\s+Complementar|Medida\\s+Provisória|(?-i:LC)|(?-i:MP)|Lei)(?![\\p{L}-])\\s*"
                + NO + NUM + YEAR, FLAGS),
            m -> numbered(statuteType(m.group(1)), m.group(2), m.group(3), m.group(4))),
        single(ReferenceKind.SUMULA,
            Pattern.compile("(?<![\\p{L}])Súmula\\s+Vinculante\\s*" + NO + "(\\d{1,4})(?!\\d)(?:\\s*,?\\s*d[oa]\\s+STF)?", FLAGS),
            m -> "Súmula Vinculante " + Integer.parseInt(m.group(1)) + " STF"),
        single(ReferenceKind.SUMULA,
            Pattern.compile("(?<![\\p{L}])(?:S[úu]mula|Enunciado)\\s*" + NO + "(\\d{1,4})(?!\\d)"
                + "(?:\\s*,?\\s*(?:d[oa]\\s+(?:(?:c\\.|col\\.)\\s*)?)?((?-i:TST|STF|STJ|TRT)))?", FLAGS),
            m -> "Súmula " + Integer.parseInt(m.group(1)) + " " + (m.group(2) == null ? "TST" : m.group(2))),
        single(ReferenceKind.SUMULA,
            Pattern.compile("(?<![\\p{L}])((?-i:TST|STF|STJ))\\s*,?\\s*S[úu]mula\\s*" + NO + "(\\d{1,4})(?!\\d)", FLAGS),
            m -> "Súmula " + Integer.parseInt(m.group(2)) + " " + m.group(1)),
        single(ReferenceKind.SUMULA,
            Pattern.compile("(?<![\\p{L}])(?:(?-i:OJ)|Orientação\\s+Jurisprudencial)\\s*" + NO + "(\\d{1,4})(?!\\d)"
                + "(?:\\s*,?\\s*(?:d[ao]\\s+)?(?:S?B?DI|SBDI)\\s*-?\\s*(\\d|(?-i:II|I))(?![\\p{L}\\d]))?"
                + "(?:\\s*,?\\s*d[oa]\\s+(?-i:TST))?", FLAGS),
            m -> "OJ " + Integer.parseInt(m.group(1)) + (m.group(2) == null ? "" : " SDI-" + CitationNormalizer.section(m.group(2)))
                + " TST"),
        single(ReferenceKind.ORDINANCE,
            Pattern.compile("(?<![\\p{L}])Portaria\\s+(?:((?-i:MTE|MTb|MTPS|MTP|SIT|SEPRT))\\s*/?\\s*)?" + NO + NUM + YEAR, FLAGS),
            m -> numbered("Portaria" + (m.group(1) == null ? "" : " " + CitationNormalizer.agency(m.group(1))),
                m.group(2), m.group(3), m.group(4))),
        single(ReferenceKind.ORDINANCE,
            Pattern.compile("(?<![\\p{L}])(?:Instrução\\s+Normativa|(?-i:IN))\\s+(?:((?-i:RFB|MTE|SIT|TST|INSS))\\s*/?\\s*)?"
                + NO + NUM + YEAR, FLAGS),
            m -> numbered("Instrução Normativa" + (m.group(1) == null ? "" : " " + CitationNormalizer.agency(m.group(1))),
                m.group(2), m.group(3), m.group(4))),
        single(ReferenceKind.ORDINANCE,
            Pattern.compile("(?<![\\p{L}])(?:(?-i:NR)|Norma\\s+Regulamentadora)\\s*-?\\s*" + NO + "(\\d{1,2})(?!\\d)", FLAGS),
            m -> "NR " + Integer.parseInt(m.group(1)))
    );

    /**
     * Extracted citations merged with those parsed from the hint, unique on
     * (kind, citation) and ordered by kind, then by first appearance.
     */
    public List<LegalReference> extract(String text, String referencesHint) {
        List<LegalReference> extracted = scan(text, Provenance.EXTRACTED);
        List<LegalReference> preExisting = parseHint(referencesHint);
        List<LegalReference> merged = merge(extracted, preExisting);
        log.debug("Found {} citation(s) in text, {} in hint, {} after merge",
            extracted.size(), preExisting.size(), merged.size());
        return merged;
    }

    public List<LegalReference> parseHint(String referencesHint) {
        if (referencesHint == null || referencesHint.isBlank()) {
            return List.of();
        }
        List<LegalReference> found = new ArrayList<>();
        for (String piece : HINT_SEPARATOR.split(referencesHint)) {
            if (!piece.isBlank()) {
                found.addAll(scan(piece, Provenance.PRE_EXISTING));
            }
        }
        return found;
    }

    /** Every citation in the text in order of appearance, without merging. */
    public List<LegalReference> scan(String text, Provenance provenance) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Span> spans = new ArrayList<>();
        for (CitationRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                List<LegalReference> references = new ArrayList<>();
                for (String citation : rule.citations().apply(matcher)) {
                    references.add(new LegalReference(rule.kind(), citation, provenance));
                }
                spans.add(new Span(matcher.start(), matcher.end(), references));
            }
        }
        // earliest first, longer spans win where matches overlap
        spans.sort(Comparator.comparingInt(Span::start).thenComparing(Comparator.comparingInt((Span s) -> s.end()).reversed()));
        List<LegalReference> found = new ArrayList<>();
        int claimedUntil = -1;
        for (Span span : spans) {
            if (span.start() >= claimedUntil) {
                found.addAll(span.references());
                claimedUntil = span.end();
            }
        }
        return found;
    }

    /**
     * Union of two citation lists, unique on {@link LegalReference#key()}. A citation
     * present on both sides, or present with both provenances, ends up
     * {@link Provenance#PRE_EXISTING}. Merging a result again with either input
     * returns the same result.
     */
    public List<LegalReference> merge(List<LegalReference> first, List<LegalReference> second) {
        Map<LegalReference.Key, LegalReference> byKey = new LinkedHashMap<>();
        for (List<LegalReference> side : List.of(first, second)) {
            for (LegalReference reference : side) {
                byKey.merge(reference.key(), reference, (existing, incoming) ->
                    existing.provenance() == incoming.provenance()
                        ? existing
                        : existing.withProvenance(Provenance.PRE_EXISTING));
            }
        }
        List<LegalReference> merged = new ArrayList<>(byKey.values());
        merged.sort(Comparator.comparing(LegalReference::kind));
        return List.copyOf(merged);
    }

    /** Mean provenance confidence of the references, 0 when there are none. */
    public static double confidence(List<LegalReference> references) {
        if (references.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (LegalReference reference : references) {
            sum += reference.provenance().confidence();
        }
        return sum / references.size();
    }

    private static String article(String number, String letter, String paragraph, String item, String source) {
        StringBuilder citation = new StringBuilder("Art. ").append(CitationNormalizer.ordinal(CitationNormalizer.number(number)));
        if (letter != null) {
            citation.append('-').append(letter.toUpperCase(Locale.ROOT));
        }
        if (paragraph != null) {
            if (paragraph.equalsIgnoreCase("único")) {
                citation.append(", parágrafo único");
            } else {
                citation.append(", § ").append(CitationNormalizer.ordinal(CitationNormalizer.number(paragraph)));
            }
        }
        if (item != null) {
            citation.append(", ").append(item);
        }
        return citation.append(' ').append(CitationNormalizer.source(source)).toString();
    }

    /** "arts. 7º e 8º da CLT" cites each listed article of the same source. */
    private static List<String> articleList(String numbers, String source) {
        List<String> citations = new ArrayList<>();
        Matcher item = ARTICLE_LIST_ITEM.matcher(numbers);
        while (item.find()) {
            citations.add(article(item.group(1), item.group(2), null, null, source));
        }
        return citations;
    }

    private static String numbered(String type, String number, String shortYear, String longYear) {
        String citation = type + " " + CitationNormalizer.number(number);
        String year = shortYear != null ? shortYear : longYear;
        return year == null ? citation : citation + "/" + CitationNormalizer.year(year);
    }

    private static String statuteType(String raw) {
        String type = raw.replaceAll("\\s+", " ");
        if (type.equals("LC") || type.equalsIgnoreCase("Lei Complementar")) {
            return "Lei Complementar";
        }
        if (type.equals("MP") || type.equalsIgnoreCase("Medida Provisória")) {
            return "Medida Provisória";
        }
        return "Lei";
    }

    private static CitationRule single(ReferenceKind kind, Pattern pattern, Function<Matcher, String> canonical) {
        return new CitationRule(kind, pattern, matcher -> List.of(canonical.apply(matcher)));
    }

    /** A citation pattern and the canonical citations of one match. */
    private record CitationRule(ReferenceKind kind, Pattern pattern, Function<Matcher, List<String>> citations) {
    }

    private record Span(int start, int end, List<LegalReference> references) {
    }
}
