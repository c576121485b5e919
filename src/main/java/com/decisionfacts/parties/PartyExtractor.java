package com.decisionfacts.parties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the claimant and the defendant of a decision.
 *
 * A role is located by its keyword ("RECLAMANTE:", "RECLAMADA -", ...). A keyword
 * at the start of a line followed by a colon or dash is a strong match and is
 * preferred over an upper-case keyword in running text. The role block runs up
 * to the next role keyword, a blank line or {@value #MAX_BLOCK} characters, and
 * the name, tax id, address and counsel are read from that block. After a weak
 * match the name is the run of capitalized words that follows the keyword, so
 * "O RECLAMANTE Fulano de Tal alega" yields "Fulano de Tal".
 *
 * Roles the text does not yield are looked up in the parties hint, first by
 * keyword and then in the {@code "A x B"} form; such records are discounted by
 * {@value #HINT_FACTOR}.
 */
public class PartyExtractor {

    private static final Logger log = LoggerFactory.getLogger(PartyExtractor.class);

    static final double NAME_SCORE = 0.4;
    static final double TAX_ID_SCORE = 0.25;
    static final double COUNSEL_SCORE = 0.25;
    static final double ADDRESS_SCORE = 0.1;
    static final double SINGLE_PARTY_FACTOR = 0.8;
    static final double HINT_FACTOR = 0.8;
    static final int MAX_BLOCK = 400;
    static final int MIN_NAME_LENGTH = 4;

    private static final String CLAIMANT_KEYWORDS = "SINDICATO\\s+AUTOR|SUBSTITUTO\\s+PROCESSUAL|AUTOR\\(A\\)"
        + "|RECLAMANTES?|REQUERENTES?|AUTORES|AUTORA|AUTOR|EXEQUENTES?|IMPETRANTES?";
    private static final String DEFENDANT_KEYWORDS = "RECLAMAD[OA]\\([AO]\\)|RECLAMAD[AO]S?|REQUERID[AO]S?"
        + "|RÉUS?|RÉ|EXECUTAD[AO]S?|IMPETRAD[AO]S?";

    private static final int CI = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern CLAIMANT_STRONG = strong(CLAIMANT_KEYWORDS);
    private static final Pattern CLAIMANT_WEAK = weak(CLAIMANT_KEYWORDS);
    private static final Pattern DEFENDANT_STRONG = strong(DEFENDANT_KEYWORDS);
    private static final Pattern DEFENDANT_WEAK = weak(DEFENDANT_KEYWORDS);
    private static final Pattern ANY_ROLE_STRONG = strong(CLAIMANT_KEYWORDS + "|" + DEFENDANT_KEYWORDS);
    private static final Pattern ANY_ROLE_UPPER = Pattern.compile(
        "(?<!\\p{L})(?:" + CLAIMANT_KEYWORDS + "|" + DEFENDANT_KEYWORDS + ")(?!\\p{L})");
    private static final Pattern BLANK_LINE = Pattern.compile("\\n[ \\t]*\\r?\\n");

    /** Labels that end a party name. */
    private static final Pattern NAME_STOP = Pattern.compile(
        "(?<!\\p{L})(?:CPF|CNPJ|OAB|RG|CTPS|advogad[oa]s?|procurador(?:a|es|as)?|patron[oa]s?|adv\\."
            + "|endereço|residente|domiciliad[oa]|com\\s+sede|sediad[oa]|inscrit[oa]|portador(?:a)?"
            + "|representad[oa]|assistid[oa])(?!\\p{L})", CI);

    private static final Pattern CNPJ = Pattern.compile("(?<![\\d./-])\\d{2}\\.?\\d{3}\\.?\\d{3}/?\\d{4}-?\\d{2}(?!\\d)");
    private static final Pattern CPF = Pattern.compile("(?<![\\d./-])\\d{3}\\.?\\d{3}\\.?\\d{3}-?\\d{2}(?!\\d)");

    private static final Pattern ADDRESS = Pattern.compile(
        "(?<!\\p{L})(?:endereço|residente(?:\\s+e\\s+domiciliad[oa])?|domiciliad[oa]|com\\s+sede|sediad[oa])(?!\\p{L})"
            + "\\s*[:\\-]?\\s*(?:(?:em|na|no|à)\\s+)?", CI);
    private static final Pattern ADDRESS_STOP = Pattern.compile(
        "[;\\n]|(?<!\\p{L})(?:CPF|CNPJ|OAB|advogad|procurador|patron|adv\\.|por\\s+seu|neste\\s+ato)", CI);

    private static final Pattern COUNSEL = Pattern.compile(
        "(?<!\\p{L})(?:advogad[oa]s?|procurador(?:a|es|as)?|patron[oa]s?|adv\\.)(?:\\([a-z]{1,2}\\))*"
            + "\\s*[:\\-]?\\s*", CI);
    private static final Pattern OAB = Pattern.compile(
        "\\(?\\s*[-–]?\\s*OAB\\b[^\\d]{0,12}[\\d.\\-]+(?:[/\\-]?[A-Z]{2}(?!\\p{L}))?\\s*\\)?", CI);
    private static final Pattern HONORIFIC = Pattern.compile("^(?:dr\\.|dra\\.|doutor[a]?)\\s*", CI);
    private static final Pattern COUNSEL_SPLIT = Pattern.compile("\\s*,\\s*|\\s+e\\s+");

    private static final Pattern VERSUS = Pattern.compile("^\\s*(.+?)\\s+(?:x|X|vs\\.?|VS\\.?|versus)\\s+(.+?)\\s*$",
        Pattern.DOTALL);

    private static final Set<String> ABBREVIATIONS = Set.of("ltda", "cia", "me", "epp", "eireli", "jr", "dr",
        "dra", "sr", "sra", "av", "n", "nº", "s/a");

    /** Lower-case particles allowed between capitalized words of a name. */
    private static final Set<String> CONNECTORS = Set.of("de", "da", "do", "dos", "das", "e", "di", "du", "del");

    public ExtractedParties extract(String text, String partiesHint) {
        String body = text == null ? "" : text;
        Optional<PartyRecord> claimant = find(body, PartyRole.CLAIMANT);
        Optional<PartyRecord> defendant = find(body, PartyRole.DEFENDANT);

        if ((claimant.isEmpty() || defendant.isEmpty()) && partiesHint != null && !partiesHint.isBlank()) {
            ExtractedParties fromHint = fromHint(partiesHint);
            if (claimant.isEmpty() && fromHint.claimant().isPresent()) {
                claimant = fromHint.claimant();
                log.debug("Claimant taken from the parties hint");
            }
            if (defendant.isEmpty() && fromHint.defendant().isPresent()) {
                defendant = fromHint.defendant();
                log.debug("Defendant taken from the parties hint");
            }
        }
        return new ExtractedParties(claimant, defendant, overallConfidence(claimant, defendant));
    }

    static double overallConfidence(Optional<PartyRecord> claimant, Optional<PartyRecord> defendant) {
        if (claimant.isPresent() && defendant.isPresent()) {
            return (claimant.get().confidence() + defendant.get().confidence()) / 2.0;
        }
        if (claimant.isPresent()) {
            return claimant.get().confidence() * SINGLE_PARTY_FACTOR;
        }
        if (defendant.isPresent()) {
            return defendant.get().confidence() * SINGLE_PARTY_FACTOR;
        }
        return 0.0;
    }

    private ExtractedParties fromHint(String hint) {
        Optional<PartyRecord> claimant = find(hint, PartyRole.CLAIMANT);
        Optional<PartyRecord> defendant = find(hint, PartyRole.DEFENDANT);
        if (claimant.isEmpty() && defendant.isEmpty()) {
            Matcher versus = VERSUS.matcher(hint.replaceAll("\\s+", " "));
            if (versus.matches()) {
                claimant = nameOnly(PartyRole.CLAIMANT, versus.group(1));
                defendant = nameOnly(PartyRole.DEFENDANT, versus.group(2));
            }
        }
        return new ExtractedParties(
            claimant.map(r -> r.withConfidence(r.confidence() * HINT_FACTOR)),
            defendant.map(r -> r.withConfidence(r.confidence() * HINT_FACTOR)),
            0.0);
    }

    private Optional<PartyRecord> find(String text, PartyRole role) {
        if (text.isBlank()) {
            return Optional.empty();
        }
        Pattern strong = role == PartyRole.CLAIMANT ? CLAIMANT_STRONG : DEFENDANT_STRONG;
        Pattern weak = role == PartyRole.CLAIMANT ? CLAIMANT_WEAK : DEFENDANT_WEAK;
        for (Pattern pattern : List.of(strong, weak)) {
            boolean inProse = pattern == weak;
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                Optional<PartyRecord> record = fromBlock(role, block(text, matcher.end()), inProse);
                if (record.isPresent()) {
                    return record;
                }
            }
        }
        return Optional.empty();
    }

    private static String block(String text, int start) {
        int end = Math.min(text.length(), start + MAX_BLOCK);
        for (Pattern boundary : List.of(ANY_ROLE_STRONG, ANY_ROLE_UPPER, BLANK_LINE)) {
            Matcher matcher = boundary.matcher(text);
            if (matcher.find(start) && matcher.start() < end) {
                end = matcher.start();
            }
        }
        return text.substring(start, end);
    }

    private static Optional<PartyRecord> fromBlock(PartyRole role, String block, boolean inProse) {
        String name = readName(block, inProse);
        if (!isValidName(name)) {
            return Optional.empty();
        }
        Optional<TaxIdentifier> taxId = readTaxId(block);
        Optional<String> address = readAddress(block);
        List<String> counsel = readCounsel(block);

        double confidence = NAME_SCORE;
        if (taxId.isPresent()) {
            confidence += TAX_ID_SCORE;
        }
        if (!counsel.isEmpty()) {
            confidence += COUNSEL_SCORE;
        }
        if (address.isPresent()) {
            confidence += ADDRESS_SCORE;
        }
        return Optional.of(new PartyRecord(role, name, taxId, address, counsel, Math.min(confidence, 1.0)));
    }

    private static Optional<PartyRecord> nameOnly(PartyRole role, String raw) {
        String name = clean(raw);
        if (!isValidName(name)) {
            return Optional.empty();
        }
        return Optional.of(new PartyRecord(role, name, Optional.empty(), Optional.empty(), List.of(), NAME_SCORE));
    }

    static String readName(String block, boolean inProse) {
        int end = block.length();
        for (int i = 0; i < block.length(); i++) {
            char c = block.charAt(i);
            if (c == ',' || c == ';' || c == '(' || c == '\n' || c == '\r'
                    || (c == '.' && endsSentence(block, i))) {
                end = i;
                break;
            }
            if (c == '.' && abbreviationBeforeProse(block, i)) {
                end = i + 1;
                break;
            }
        }
        Matcher stop = NAME_STOP.matcher(block);
        if (stop.find() && stop.start() < end) {
            end = stop.start();
        }
        String name = clean(block.substring(0, end));
        return inProse ? capitalizedRun(name) : upperCaseRun(name);
    }

    /** Leading capitalized words, joined by lower-case particles ("Fulano de Tal"). */
    private static String capitalizedRun(String name) {
        String[] words = name.split(" ");
        int kept = 0;
        while (kept < words.length) {
            String word = words[kept];
            boolean particle = kept > 0 && CONNECTORS.contains(word)
                && kept + 1 < words.length && isCapitalized(words[kept + 1]);
            if (!isCapitalized(word) && !particle) {
                break;
            }
            kept++;
        }
        return clean(String.join(" ", Arrays.copyOf(words, kept)));
    }

    private static boolean isCapitalized(String word) {
        return !word.isEmpty() && (Character.isUpperCase(word.codePointAt(0)) || Character.isDigit(word.charAt(0)));
    }

    /** "Ltda. contesta": an abbreviation dot followed by a lower-case word closes the name after the dot. */
    private static boolean abbreviationBeforeProse(String s, int dot) {
        int next = dot + 1;
        if (next >= s.length() || !Character.isWhitespace(s.charAt(next))) {
            return false;
        }
        while (next < s.length() && Character.isWhitespace(s.charAt(next))) {
            next++;
        }
        if (next >= s.length() || !Character.isLowerCase(s.charAt(next))) {
            return false;
        }
        return ABBREVIATIONS.contains(tokenBefore(s, dot));
    }

    /** An upper-case name followed by running prose keeps only its upper-case words. */
    private static String upperCaseRun(String name) {
        String[] words = name.split(" ");
        if (words.length < 2 || !isUpperCase(words[0])) {
            return name;
        }
        int kept = 0;
        while (kept < words.length && isUpperCase(words[kept])) {
            kept++;
        }
        return clean(String.join(" ", Arrays.copyOf(words, kept)));
    }

    private static boolean isUpperCase(String word) {
        return word.chars().anyMatch(Character::isLetter) && word.chars().noneMatch(Character::isLowerCase);
    }

    private static boolean endsSentence(String s, int dot) {
        int next = dot + 1;
        if (next < s.length() && !Character.isWhitespace(s.charAt(next))) {
            return false;
        }
        String token = tokenBefore(s, dot);
        return token.length() > 1 && !ABBREVIATIONS.contains(token);
    }

    private static String tokenBefore(String s, int dot) {
        int from = dot;
        while (from > 0 && !Character.isWhitespace(s.charAt(from - 1)) && s.charAt(from - 1) != '.') {
            from--;
        }
        return s.substring(from, dot).toLowerCase(Locale.ROOT);
    }

    private static Optional<TaxIdentifier> readTaxId(String block) {
        Matcher cnpj = CNPJ.matcher(block);
        if (cnpj.find()) {
            return TaxIdentifier.fromDigits(cnpj.group());
        }
        Matcher cpf = CPF.matcher(block);
        if (cpf.find()) {
            return TaxIdentifier.fromDigits(cpf.group());
        }
        return Optional.empty();
    }

    private static Optional<String> readAddress(String block) {
        Matcher matcher = ADDRESS.matcher(block);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int start = matcher.end();
        int end = block.length();
        Matcher stop = ADDRESS_STOP.matcher(block);
        if (stop.find(start)) {
            end = stop.start();
        }
        String address = clean(block.substring(start, end));
        return address.length() >= 5 ? Optional.of(address) : Optional.empty();
    }

    private static List<String> readCounsel(String block) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = COUNSEL.matcher(block);
        while (matcher.find()) {
            int start = matcher.end();
            int end = block.length();
            for (int i = start; i < block.length(); i++) {
                char c = block.charAt(i);
                if (c == ';' || c == '\n' || (c == '.' && endsSentence(block, i))) {
                    end = i;
                    break;
                }
            }
            String value = OAB.matcher(block.substring(start, end)).replaceAll(" ");
            for (String piece : COUNSEL_SPLIT.split(value)) {
                String name = clean(HONORIFIC.matcher(piece.trim()).replaceFirst(""));
                if (isValidName(name)) {
                    names.add(name);
                }
            }
        }
        return new ArrayList<>(names);
    }

    private static String clean(String raw) {
        String value = raw.replaceAll("\\s+", " ").trim();
        value = value.replaceAll("^[\\s,.:;\\-–]+", "");
        value = value.replaceAll("[\\s,:;\\-–]+$", "");
        return value.trim();
    }

    private static boolean isValidName(String name) {
        return name != null && name.length() >= MIN_NAME_LENGTH && name.chars().anyMatch(Character::isLetter);
    }

    private static Pattern strong(String keywords) {
        return Pattern.compile("(?m)^[ \\t]*(?:" + keywords + ")(?!\\p{L})[ \\t]*(?:\\([a-z]{1,2}\\))?[ \\t]*[:\\-–][ \\t]*",
            CI);
    }

    private static Pattern weak(String keywords) {
        return Pattern.compile("(?<!\\p{L})(?:" + keywords + ")(?!\\p{L})[ \\t]*[:\\-–]?[ \\t]*(?=\\p{Lu})");
    }
}
