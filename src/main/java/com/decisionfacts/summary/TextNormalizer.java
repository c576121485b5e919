package com.decisionfacts.summary;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cleans raw decision text before extraction.
 *
 * <ul>
 *   <li>HTML markup is reduced to text with Jsoup; block elements and {@code <br>} become line breaks.</li>
 *   <li>Entities are decoded, common UTF-8-read-as-Latin-1 sequences are repaired and the text is NFC-composed.</li>
 *   <li>Page markers ("Página 2 de 5", "fls. 12") and lines of bare numbers or dashes are dropped.</li>
 *   <li>Runs of spaces collapse to one and at most one blank line separates paragraphs.</li>
 * </ul>
 *
 * Line structure is kept: party headers and section headings are line-based.
 */
public class TextNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TextNormalizer.class);

    private static final Pattern MARKUP = Pattern.compile("<(?:/?[a-zA-Z][a-zA-Z0-9]*(?:\\s[^<>]*)?/?|!--.*?--)>",
        Pattern.DOTALL);

    private static final Pattern CONTROL = Pattern.compile("[\\p{Cc}&&[^\\n\\t]]|[\\u200B-\\u200D\\uFEFF]");

    private static final Pattern PAGE_MARKER = Pattern.compile(
        "(?:p[áa]g(?:ina)?\\.?|fls?\\.|folhas?)\\s*\\d+(?:\\s*(?:de|/)\\s*\\d+)?",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern USELESS_LINE = Pattern.compile("[\\d\\s\\-–—_=*.|/]{1,5}");

    private static final Pattern SPACES = Pattern.compile("[ \\t\\u00A0\\u2007\\u202F\\f\\x0B]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private static final List<String> BLOCK_LINE_BREAK = List.of("br", "tr");
    private static final String REMOVED_ELEMENTS = "script, style, noscript, img, svg, canvas, video, audio";

    private static final Map<String, String> MOJIBAKE = mojibake();

    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String text = raw.replace("\r\n", "\n").replace('\r', '\n');
        text = MARKUP.matcher(text).find() ? htmlToText(text) : Parser.unescapeEntities(text, false);
        text = cleanEncoding(text);
        text = dropPageLines(text);
        text = normalizeSpaces(text);
        if (log.isDebugEnabled()) {
            log.debug("Normalized text: {} -> {} chars", raw.length(), text.length());
        }
        return text;
    }

    static String htmlToText(String html) {
        Document document = Jsoup.parse(html);
        document.select(REMOVED_ELEMENTS).remove();
        StringBuilder out = new StringBuilder(html.length() / 2);
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    out.append(textNode.text());
                } else if (node instanceof Element element && breaksLine(element)) {
                    out.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && element.isBlock()) {
                    out.append('\n');
                }
            }
        }, document.body());
        return out.toString();
    }

    private static boolean breaksLine(Element element) {
        return element.isBlock() || BLOCK_LINE_BREAK.contains(element.normalName());
    }

    static String cleanEncoding(String text) {
        String cleaned = text;
        for (Map.Entry<String, String> fix : MOJIBAKE.entrySet()) {
            cleaned = cleaned.replace(fix.getKey(), fix.getValue());
        }
        cleaned = CONTROL.matcher(cleaned).replaceAll("");
        return Normalizer.normalize(cleaned, Normalizer.Form.NFC);
    }

    private static String dropPageLines(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (String line : text.split("\n", -1)) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()
                && (PAGE_MARKER.matcher(trimmed).matches() || USELESS_LINE.matcher(trimmed).matches())) {
                continue;
            }
            out.append(line).append('\n');
        }
        return out.toString();
    }

    private static String normalizeSpaces(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (String line : text.split("\n", -1)) {
            out.append(SPACES.matcher(line).replaceAll(" ").strip()).append('\n');
        }
        return BLANK_LINES.matcher(out).replaceAll("\n\n").strip();
    }

    private static Map<String, String> mojibake() {
        Map<String, String> fixes = new LinkedHashMap<>();
        fixes.put("â€™", "'");
        fixes.put("â€˜", "'");
        fixes.put("â€œ", "\"");
        fixes.put("â€\u009d", "\"");
        fixes.put("â€¦", "...");
        fixes.put("â€“", "–");
        fixes.put("Ã§", "ç");
        fixes.put("Ã¡", "á");
        fixes.put("Ã©", "é");
        fixes.put("Ã­", "í");
        fixes.put("Ã³", "ó");
        fixes.put("Ãº", "ú");
        fixes.put("Ã¢", "â");
        fixes.put("Ãª", "ê");
        fixes.put("Ã´", "ô");
        fixes.put("Ã£", "ã");
        fixes.put("Ãµ", "õ");
        fixes.put("Ã‡", "Ç");
        fixes.put("Ã‰", "É");
        fixes.put("Ãƒ", "Ã");
        fixes.put("Âº", "º");
        fixes.put("Âª", "ª");
        fixes.put("Â§", "§");
        fixes.put("Ã ", "à");
        return fixes;
    }
}
