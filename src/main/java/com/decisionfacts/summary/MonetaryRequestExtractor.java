package com.decisionfacts.summary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Amounts of money in BRL and the claim topics of a decision.
 */
public class MonetaryRequestExtractor {

    private static final Logger log = LoggerFactory.getLogger(MonetaryRequestExtractor.class);

    public static final int DEFAULT_MAX_MONETARY_MENTIONS = 10;
    public static final int DEFAULT_MAX_REQUESTS = 5;

    static final int CONTEXT_CHARS = 30;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String AMOUNT = "(\\d{1,3}(?:\\.\\d{3})+(?:,\\d{1,2})?|\\d+(?:,\\d{1,2})?)";
    private static final String SCALE = "(mil|milhões|milhão|milhoes|milhao|bilhões|bilhão|bilhoes|bilhao)";

    private static final List<Pattern> MONEY = List.of(
        Pattern.compile("R\\$\\s*" + AMOUNT + "(?:\\s*" + SCALE + "(?![\\p{L}]))?(?:\\s+de\\s+reais)?", FLAGS),
        Pattern.compile("(?<![\\d,.])" + AMOUNT + "\\s*" + SCALE + "(?:\\s+de)?\\s+reais(?![\\p{L}])", FLAGS),
        Pattern.compile("(?<![\\d,.])" + AMOUNT + "\\s+reais(?![\\p{L}])", FLAGS)
    );

    private static final Pattern REQUESTS_HEADER = Pattern.compile(
        "(?m)^[ \\t]*(?:(?:[IVX]+|\\d+)\\s*[-–.)]\\s*)?(?:D[OA]S?\\s+)?PEDIDOS?[ \\t]*:?[ \\t]*$");
    private static final Pattern REQUEST_PHRASE = Pattern.compile(
        "\\b(?:[oa]\\s+(?:reclamante|autora?|requerente)\\s+(?:requer|postula|pleiteia|pede)"
            + "|(?:pede|requer|pleiteia|postula)\\s+[oa]\\s+(?:reclamante|autora?|requerente))\\b", FLAGS);
    private static final Pattern BLANK_LINE = Pattern.compile("\\n[ \\t]*\\r?\\n");
    private static final int REQUEST_PHRASE_SPAN = 1000;

    private static final Map<String, Pattern> TOPICS = topics();

    private static final String GENERIC_END = "(?=[.;,\\n]|\\s+e\\s+ainda|\\s+por\\s+fim|\\s+diante\\s+do\\s+exposto|$)";
    private static final List<Pattern> GENERIC_REQUESTS = List.of(
        Pattern.compile("\\b(?:pede|requer|pleiteia|solicita|postula)\\s+(.+?)" + GENERIC_END, FLAGS),
        Pattern.compile("\\b(?:condenar|determinar|reconhecer|declarar|conceder|deferir|acolher|restabelecer|liberar)\\s+(.+?)"
            + GENERIC_END, FLAGS),
        Pattern.compile("\\b(?:pagamento|indenização|reparação|restituição)\\s+(?:de|por|a\\s+título\\s+de)\\s+(.+?)"
            + GENERIC_END, FLAGS)
    );

    private final int maxMonetaryMentions;
    private final int maxRequests;

    public MonetaryRequestExtractor() {
        this(DEFAULT_MAX_MONETARY_MENTIONS, DEFAULT_MAX_REQUESTS);
    }

    public MonetaryRequestExtractor(int maxMonetaryMentions, int maxRequests) {
        if (maxMonetaryMentions < 0 || maxRequests < 0) {
            throw new IllegalArgumentException("limits must not be negative");
        }
        this.maxMonetaryMentions = maxMonetaryMentions;
        this.maxRequests = maxRequests;
    }

    public Result extract(String text) {
        return new Result(monetaryMentions(text), mainRequests(text));
    }

    /**
     * Amounts in order of appearance. Overlapping matches collapse into the
     * longest one and an amount written identically twice is kept once.
     */
    public List<MonetaryMention> monetaryMentions(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();
        for (Pattern pattern : MONEY) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String scale = matcher.groupCount() >= 2 ? matcher.group(2) : null;
                candidates.add(new Candidate(matcher.start(), matcher.end(), parseAmount(matcher.group(1), scale)));
            }
        }
        candidates.sort(Comparator.comparingInt(Candidate::start)
            .thenComparing(Comparator.comparingInt((Candidate c) -> c.end()).reversed()));

        List<MonetaryMention> mentions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int claimedUntil = -1;
        for (Candidate candidate : candidates) {
            if (mentions.size() == maxMonetaryMentions) {
                break;
            }
            if (candidate.start() < claimedUntil) {
                continue;
            }
            claimedUntil = candidate.end();
            String surface = text.substring(candidate.start(), candidate.end()).replaceAll("\\s+", " ").trim();
            if (seen.add(surface.toLowerCase(Locale.ROOT).replace(" ", ""))) {
                mentions.add(new MonetaryMention(surface, candidate.value(),
                    context(text, candidate.start(), candidate.end())));
            }
        }
        return mentions;
    }

    /**
     * Claim topics found in the requests section, or in the whole text when
     * there is none. Falls back to generic request phrases.
     */
    public List<String> mainRequests(String text) {
        if (text == null || text.isBlank() || maxRequests == 0) {
            return List.of();
        }
        String scope = requestsSection(text);
        Set<String> requests = new LinkedHashSet<>();
        for (Map.Entry<String, Pattern> topic : TOPICS.entrySet()) {
            if (topic.getValue().matcher(scope).find()) {
                requests.add(topic.getKey());
            }
        }
        if (requests.isEmpty()) {
            for (Pattern pattern : GENERIC_REQUESTS) {
                Matcher matcher = pattern.matcher(scope);
                while (matcher.find()) {
                    String request = matcher.group(1).replaceAll("\\s+", " ").trim();
                    if (request.length() > 10 && request.length() < 100) {
                        requests.add(request);
                    }
                }
            }
            log.debug("No claim topic matched, {} generic request(s) found", requests.size());
        }
        return requests.stream().limit(maxRequests).toList();
    }

    /** The requests section of the text, or the whole text when no section is found. */
    String requestsSection(String text) {
        Optional<String> section = DecisionSections.after(REQUESTS_HEADER, text);
        if (section.isPresent()) {
            return section.get();
        }
        Matcher phrase = REQUEST_PHRASE.matcher(text);
        if (phrase.find()) {
            int end = Math.min(text.length(), phrase.start() + REQUEST_PHRASE_SPAN);
            Matcher blank = BLANK_LINE.matcher(text);
            if (blank.find(phrase.end()) && blank.start() < end) {
                end = blank.start();
            }
            return text.substring(phrase.start(), end);
        }
        return text;
    }

    /** Brazilian notation: dots group thousands, the comma separates cents. */
    static BigDecimal parseAmount(String amount, String scale) {
        BigDecimal value = new BigDecimal(amount.replace(".", "").replace(',', '.'));
        if (scale != null) {
            String word = scale.toLowerCase(Locale.ROOT);
            if (word.startsWith("mil") && word.length() > 3) {
                value = value.movePointRight(6);
            } else if (word.startsWith("bilh")) {
                value = value.movePointRight(9);
            } else {
                value = value.movePointRight(3);
            }
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static String context(String text, int start, int end) {
        int from = Math.max(0, start - CONTEXT_CHARS);
        int to = Math.min(text.length(), end + CONTEXT_CHARS);
        return text.substring(from, to).replaceAll("\\s+", " ").trim();
    }

    private static Map<String, Pattern> topics() {
        Map<String, String> lexicon = new LinkedHashMap<>();
        lexicon.put("Horas Extras", "horas?\\s+extras?|sobrejornada|trabalho\\s+extraordinário|labor\\s+extraordinário"
            + "|jornada\\s+extraordinária|excesso\\s+de\\s+jornada|banco\\s+de\\s+horas|acordo\\s+de\\s+compensação");
        lexicon.put("Adicional Noturno", "adicional\\s+noturno|trabalho\\s+noturno|labor\\s+noturno|jornada\\s+noturna"
            + "|hora\\s+noturna\\s+reduzida");
        lexicon.put("Insalubridade", "insalubridade|trabalho\\s+insalubre|condições\\s+insalubres");
        lexicon.put("Periculosidade", "periculosidade|trabalho\\s+perigoso|atividade\\s+perigosa|risco\\s+de\\s+vida");
        lexicon.put("FGTS", "fgts|fundo\\s+de\\s+garantia");
        lexicon.put("Danos Morais", "danos?\\s+morais?|dano\\s+moral|reparação\\s+moral|compensação\\s+moral|abalo\\s+moral"
            + "|sofrimento\\s+moral");
        lexicon.put("Equiparação Salarial", "equiparação\\s+salarial|isonomia\\s+salarial|igualdade\\s+salarial"
            + "|paridade\\s+salarial|paradigma");
        lexicon.put("Diferença Salarial", "diferenças?\\s+salaria(?:l|is)|dissídio\\s+salarial|reajuste\\s+salarial"
            + "|salário\\s+inferior|subsalário|piso\\s+salarial");
        lexicon.put("Verbas Rescisórias", "verbas?\\s+rescisórias?|acerto\\s+rescisório|pagamento\\s+da\\s+rescisão"
            + "|saldo\\s+de\\s+salário");
        lexicon.put("Aviso Prévio", "aviso\\s+prévio|pré[-\\s]?aviso|aviso\\s+de\\s+dispensa");
        lexicon.put("Férias", "férias|abono\\s+pecuniário|descanso\\s+anual");
        lexicon.put("Décimo Terceiro", "décimo\\s+terceiro|13[º°o]?\\s+salário|gratificação\\s+natalina"
            + "|gratificação\\s+de\\s+natal");
        lexicon.put("Registro CTPS e Vínculo", "registro\\s+em\\s+ctps|anotação\\s+(?:em|na)\\s+(?:carteira|ctps)"
            + "|vínculo\\s+empregatício|reconhecimento\\s+de\\s+vínculo|relação\\s+de\\s+emprego");
        lexicon.put("Rescisão Indireta", "rescisão\\s+indireta|justa\\s+causa\\s+do\\s+empregador|dispensa\\s+indireta"
            + "|falta\\s+grave\\s+do\\s+empregador");
        lexicon.put("Salário Família", "salário[-\\s]?família|abono\\s+família|auxílio\\s+família");
        lexicon.put("Seguro Desemprego", "seguro[-\\s]desemprego");
        lexicon.put("Reintegração", "reintegração|readmissão|retorno\\s+ao\\s+posto\\s+de\\s+trabalho"
            + "|estabilidade\\s+provisória");
        lexicon.put("Danos Materiais", "danos?\\s+materiais?|lucros\\s+cessantes|danos?\\s+emergentes|reparação\\s+material");
        lexicon.put("Assédio Moral ou Sexual", "assédio\\s+moral|assédio\\s+sexual|violência\\s+psicológica"
            + "|constrangimento\\s+no\\s+trabalho|ambiente\\s+hostil");
        lexicon.put("Acidente ou Doença do Trabalho", "acidente\\s+de\\s+trabalho|acidente\\s+do\\s+trabalho"
            + "|doença\\s+ocupacional|doença\\s+do\\s+trabalho|moléstia\\s+profissional|estabilidade\\s+acidentária");
        lexicon.put("Multas da CLT", "multas?\\s+do\\s+art(?:igo|\\.)?\\s*4(?:67|77)|multas?\\s+da\\s+clt"
            + "|multas?\\s+rescisórias?");

        Map<String, Pattern> compiled = new LinkedHashMap<>();
        lexicon.forEach((label, regex) -> compiled.put(label,
            Pattern.compile("(?<![\\p{L}])(?:" + regex + ")(?![\\p{L}])", FLAGS)));
        return compiled;
    }

    private record Candidate(int start, int end, BigDecimal value) {
    }

    /** Monetary mentions and claim topics of one text. */
    public record Result(List<MonetaryMention> monetaryMentions, List<String> mainRequests) {

        public Result {
            monetaryMentions = List.copyOf(monetaryMentions);
            mainRequests = List.copyOf(mainRequests);
        }

        public static Result empty() {
            return new Result(List.of(), List.of());
        }
    }
}
