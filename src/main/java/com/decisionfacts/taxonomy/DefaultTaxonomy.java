package com.decisionfacts.taxonomy;

import static com.decisionfacts.taxonomy.PatternCategory.CONTEXTUAL;
import static com.decisionfacts.taxonomy.PatternCategory.DISPOSITIVE_HEADER;
import static com.decisionfacts.taxonomy.PatternCategory.FAVORABLE;
import static com.decisionfacts.taxonomy.PatternCategory.INFERENTIAL;
import static com.decisionfacts.taxonomy.PatternCategory.LABOR_RIGHT;
import static com.decisionfacts.taxonomy.PatternCategory.LEGAL_LANGUAGE;
import static com.decisionfacts.taxonomy.PatternCategory.PARTIAL;
import static com.decisionfacts.taxonomy.PatternCategory.STRUCTURAL;
import static com.decisionfacts.taxonomy.PatternCategory.UNFAVORABLE;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The built-in taxonomy for Brazilian labor-court decisions.
 *
 * Bump {@link #VERSION} whenever an entry below changes. The pipeline version
 * also embeds a content fingerprint, so a forgotten bump still yields a new
 * pipeline version.
 */
public final class DefaultTaxonomy {

    public static final String VERSION = "2.1.0";

    public static final double HIT_NORMALIZER = 2.0;
    public static final double PRE_DISPOSITIVE_DISCOUNT = 0.5;

    public static final double DIRECT_WEIGHT = 1.0;
    public static final double DIRECT_CEILING = 1.0;
    public static final double INFERENCE_WEIGHT = 0.6;
    public static final double INFERENCE_CEILING = 0.8;
    public static final double LABOR_RIGHTS_WEIGHT = 0.8;
    public static final double LABOR_RIGHTS_CEILING = 0.88;
    public static final double SEMANTIC_CONTEXT_WEIGHT = 0.9;
    public static final double SEMANTIC_CONTEXT_CEILING = 0.9;
    public static final double DOCUMENT_STRUCTURE_WEIGHT = 0.7;
    public static final double DOCUMENT_STRUCTURE_CEILING = 0.7;
    public static final double LEGAL_LANGUAGE_WEIGHT = 0.7;
    public static final double LEGAL_LANGUAGE_CEILING = 0.7;

    /** Labor-right categories recognised by the labor-rights method, expression to display label. */
    private static final Map<String, String> RIGHT_LABELS = rightLabels();

    static final String RIGHTS = "(?:" + String.join("|", RIGHT_LABELS.keySet()) + ")";

    private static final String MONEY = "\\d{1,3}(?:\\.?\\d{3})*(?:,\\d{2})?";

    private static final String GRANTED = "(?:devid[oa]s?|deferid[oa]s?|concedid[oa]s?|reconhecid[oa]s?)";
    private static final String DENIED = "(?:indevid[oa]s?|indeferid[oa]s?|negad[oa]s?|rejeitad[oa]s?|improcedentes?)";

    private DefaultTaxonomy() {
    }

    /**
     * Labels of the labor rights the taxonomy recognises, keyed by the regular
     * expression that finds each one. Iteration order is match priority.
     */
    public static Map<String, String> labeledRights() {
        return RIGHT_LABELS;
    }

    private static Map<String, String> rightLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("horas?\\s+extras?", "horas extras");
        labels.put("adicional\\s+noturno", "adicional noturno");
        labels.put("adicional\\s+de\\s+insalubridade", "adicional de insalubridade");
        labels.put("insalubridade", "adicional de insalubridade");
        labels.put("adicional\\s+de\\s+periculosidade", "adicional de periculosidade");
        labels.put("periculosidade", "adicional de periculosidade");
        labels.put("verbas\\s+rescisórias", "verbas rescisórias");
        labels.put("aviso\\s+prévio", "aviso prévio");
        labels.put("décimo\\s+terceiro", "13º salário");
        labels.put("13[º°o]?\\s+salário", "13º salário");
        labels.put("férias", "férias");
        labels.put("fgts", "FGTS");
        labels.put("vínculo\\s+empregatício", "vínculo empregatício");
        labels.put("reintegração", "reintegração");
        labels.put("rescisão\\s+indireta", "rescisão indireta");
        labels.put("danos?\\s+morais?", "danos morais");
        labels.put("equiparação\\s+salarial", "equiparação salarial");
        labels.put("intervalo\\s+intrajornada", "intervalo intrajornada");
        labels.put("diferenças?\\s+salariais", "diferenças salariais");
        return Collections.unmodifiableMap(labels);
    }

    public static PatternTaxonomy create() {
        PatternTaxonomy.Builder b = PatternTaxonomy.builder(VERSION)
            .hitNormalizer(HIT_NORMALIZER)
            .preDispositiveDiscount(PRE_DISPOSITIVE_DISCOUNT)
            .method(MethodId.DIRECT_PATTERN, DIRECT_WEIGHT, DIRECT_CEILING)
            .method(MethodId.INFERENCE, INFERENCE_WEIGHT, INFERENCE_CEILING)
            .method(MethodId.LABOR_RIGHTS, LABOR_RIGHTS_WEIGHT, LABOR_RIGHTS_CEILING)
            .method(MethodId.SEMANTIC_CONTEXT, SEMANTIC_CONTEXT_WEIGHT, SEMANTIC_CONTEXT_CEILING)
            .method(MethodId.DOCUMENT_STRUCTURE, DOCUMENT_STRUCTURE_WEIGHT, DOCUMENT_STRUCTURE_CEILING)
            .method(MethodId.LEGAL_LANGUAGE, LEGAL_LANGUAGE_WEIGHT, LEGAL_LANGUAGE_CEILING);

        favorable(b);
        unfavorable(b);
        partial(b);
        inferential(b);
        laborRights(b);
        contextual(b);
        structural(b);
        legalLanguage(b);
        return b.build();
    }

    private static void favorable(PatternTaxonomy.Builder b) {
        b.rule("fav.julgo-procedente", FAVORABLE, Polarity.FAVORABLE, 0.98,
                "\\b(?:julgo|decido)\\s+(?:totalmente\\s+)?procedentes?\\b(?!\\s+em\\s+parte)")
            .rule("fav.homologacao", FAVORABLE, Polarity.FAVORABLE, 0.95,
                "\\b(?:homologo|homologar|homologad[oa])\\b")
            .rule("fav.concessao", FAVORABLE, Polarity.FAVORABLE, 0.9,
                "\\b(?:concedo|conceder|concedid[oa]s?|concessão)\\b")
            .rule("fav.deferimento", FAVORABLE, Polarity.FAVORABLE, 0.9,
                "\\b(?:defiro|deferir|deferimento|deferid[oa]s?)\\b")
            .rule("fav.acolhimento", FAVORABLE, Polarity.FAVORABLE, 0.9,
                "\\b(?:acolho|acolher|acolhid[oa]s?|acolhimento)\\b")
            .rule("fav.reconhecimento", FAVORABLE, Polarity.FAVORABLE, 0.88,
                "\\b(?:reconheço|reconhecer|reconhecid[oa]s?|reconhecimento)\\b")
            .rule("fav.condenacao", FAVORABLE, Polarity.FAVORABLE, 0.95,
                "(?<!sem\\s)\\b(?:condeno|condenar|condenad[oa]s?|condenação)\\b")
            .rule("fav.condenacao-pagamento", FAVORABLE, Polarity.FAVORABLE, 0.98,
                "\\b(?:condeno|condenar|condenad[oa])\\s+(?:[oa]s?\\s+)?(?:reclamad[ao]s?|réu|ré|empresa|empregador|parte)"
                    + "\\s+(?:ao\\s+pagamento|a\\s+pagar|a\\s+indenizar)\\b")
            .rule("fav.arbitramento", FAVORABLE, Polarity.FAVORABLE, 0.85,
                "\\b(?:arbitro|arbitrad[oa])\\b")
            .rule("fav.determinacao", FAVORABLE, Polarity.FAVORABLE, 0.85,
                "\\b(?:determino|determinar)\\s+(?:o\\s+pagamento|a\\s+reintegração|a\\s+anotação|a\\s+liberação)\\b")
            .rule("fav.recurso-provido", FAVORABLE, Polarity.FAVORABLE, 0.95,
                "\\brecurso\\s+(?:ordinário\\s+)?provido\\b")
            .rule("fav.dar-provimento", FAVORABLE, Polarity.FAVORABLE, 0.9,
                "\\b(?:dar|dando|dou|dá)\\s+provimento\\b")
            .rule("fav.reforma", FAVORABLE, Polarity.FAVORABLE, 0.9,
                "\\b(?:reformo|reformar|reformad[oa])\\s+(?:a\\s+sentença|o\\s+acórdão)\\b")
            .rule("fav.faz-jus", FAVORABLE, Polarity.FAVORABLE, 0.85,
                "(?<!não\\s)\\b(?:faz|fazendo)\\s+jus\\b")
            .rule("fav.tem-direito", FAVORABLE, Polarity.FAVORABLE, 0.85,
                "(?<!não\\s)\\b(?:tem|tendo)\\s+direito\\b")
            .rule("fav.e-devido", FAVORABLE, Polarity.FAVORABLE, 0.85,
                "(?<!não\\s)\\b(?:é|são)\\s+devid[oa]s?\\b")
            .rule("fav.deve-ser-pago", FAVORABLE, Polarity.FAVORABLE, 0.85,
                "(?<!não\\s)\\b(?:deve\\s+ser\\s+pag[oa]|devem\\s+ser\\s+pag[oa]s)\\b")
            .rule("fav.em-favor-reclamante", FAVORABLE, Polarity.FAVORABLE, 0.8,
                "\\bem\\s+favor\\s+d[oa]\\s+(?:reclamante|autor[a]?|empregad[oa]|requerente)\\b")
            .rule("fav.razao-reclamante", FAVORABLE, Polarity.FAVORABLE, 0.8,
                "\\brazão\\s+(?:ao|à)\\s+(?:reclamante|autor[a]?|requerente)\\b")
            .rule("fav.pagamento-valor", FAVORABLE, Polarity.FAVORABLE, 0.7,
                "\\b(?:pagar|pagamento|condeno|condenação)\\s+(?:de\\s+)?r\\$\\s*" + MONEY)
            .rule("fav.indenizacao-valor", FAVORABLE, Polarity.FAVORABLE, 0.7,
                "\\b(?:indenização|indenizar)\\s+de\\s+r\\$\\s*" + MONEY)
            .rule("fav.vinculo-reconhecido", FAVORABLE, Polarity.FAVORABLE, 0.85,
                "\\bvínculo\\s+empregatício\\s+(?:reconhecido|declarado)\\b");
    }

    private static void unfavorable(PatternTaxonomy.Builder b) {
        b.rule("unf.improcedente", UNFAVORABLE, Polarity.UNFAVORABLE, 0.9,
                "\\b(?:improcedentes?|improcedência)\\b")
            .rule("unf.julgo-improcedente", UNFAVORABLE, Polarity.UNFAVORABLE, 0.95,
                "\\bjulgo\\s+(?:totalmente\\s+)?improcedentes?\\b")
            .rule("unf.pedido-improcedente", UNFAVORABLE, Polarity.UNFAVORABLE, 0.85,
                "\\b(?:pedidos?|ação|sentença)\\s+improcedentes?\\b")
            .rule("unf.negacao", UNFAVORABLE, Polarity.UNFAVORABLE, 0.8,
                "\\b(?:nego|negar|negad[oa]s?)\\b")
            .rule("unf.indeferimento", UNFAVORABLE, Polarity.UNFAVORABLE, 0.8,
                "\\b(?:indefiro|indeferimento|indeferid[oa]s?)\\b")
            .rule("unf.rejeicao", UNFAVORABLE, Polarity.UNFAVORABLE, 0.8,
                "\\b(?:rejeito|rejeição|rejeitad[oa]s?)\\b")
            .rule("unf.recurso-desprovido", UNFAVORABLE, Polarity.UNFAVORABLE, 0.8,
                "\\brecurso\\s+(?:ordinário\\s+)?(?:desprovido|improvido|não\\s+provido)\\b")
            .rule("unf.nego-seguimento", UNFAVORABLE, Polarity.UNFAVORABLE, 0.8,
                "\\b(?:nego|denego|nega)\\s+(?:provimento|seguimento)\\b")
            .rule("unf.nao-tem-direito", UNFAVORABLE, Polarity.UNFAVORABLE, 0.8,
                "\\bnão\\s+(?:tem\\s+direito|faz\\s+jus|é\\s+devid[oa]|são\\s+devid[oa]s)\\b")
            .rule("unf.ausencia-direito", UNFAVORABLE, Polarity.UNFAVORABLE, 0.7,
                "\\bausência\\s+de\\s+direito\\b")
            .rule("unf.nao-procede", UNFAVORABLE, Polarity.UNFAVORABLE, 0.7,
                "\\bnão\\s+procede\\b")
            .rule("unf.extincao", UNFAVORABLE, Polarity.UNFAVORABLE, 0.7,
                "\\bextingo\\s+o\\s+(?:processo|feito)\\b")
            .rule("unf.favor-reclamado", UNFAVORABLE, Polarity.UNFAVORABLE, 0.7,
                "\\b(?:em\\s+favor\\s+d[oa]|razão\\s+(?:ao|à))\\s+(?:reclamad[oa]|requerid[oa]|réu|ré)\\b")
            .rule("unf.absolvicao", UNFAVORABLE, Polarity.UNFAVORABLE, 0.8,
                "\\b(?:absolvo|absolvição|absolvid[oa])\\b")
            .rule("unf.sem-condenacao", UNFAVORABLE, Polarity.UNFAVORABLE, 0.7,
                "\\b(?:sem\\s+condenação|isent[oa]\\s+de\\s+pagamento)\\b")
            .rule("unf.falta-prova", UNFAVORABLE, Polarity.UNFAVORABLE, 0.6,
                "\\b(?:falta\\s+de\\s+prova|não\\s+comprovad[oa]|prova\\s+insuficiente|não\\s+demonstrad[oa])\\b")
            .rule("unf.arquivamento", UNFAVORABLE, Polarity.UNFAVORABLE, 0.6,
                "\\b(?:arquivad[oa]|arquivamento)\\b");
    }

    private static void partial(PatternTaxonomy.Builder b) {
        b.rule("par.julgo-parcialmente", PARTIAL, Polarity.PARTIAL, 0.98,
                "\\b(?:julgo|decido)\\s+(?:os\\s+pedidos\\s+)?parcialmente\\s+procedentes?\\b")
            .rule("par.procedente-em-parte", PARTIAL, Polarity.PARTIAL, 0.95,
                "\\bprocedentes?\\s+em\\s+parte\\b")
            .rule("par.acolho-parcialmente", PARTIAL, Polarity.PARTIAL, 0.95,
                "\\b(?:acolho|defiro|concedo|deferid[oa]s?|concedid[oa]s?|acolhid[oa]s?)\\s+(?:os\\s+pedidos\\s+)?"
                    + "(?:parcialmente|em\\s+parte)\\b")
            .rule("par.parcial-provimento", PARTIAL, Polarity.PARTIAL, 0.95,
                "\\b(?:dou|dá|dando|dar)\\s+parcial\\s+provimento\\b|\\brecurso\\s+parcialmente\\s+provido\\b")
            .rule("par.reforma-parcial", PARTIAL, Polarity.PARTIAL, 0.93,
                "\\b(?:reformo|reformar|reformad[oa])\\s+parcialmente\\s+(?:a\\s+sentença|o\\s+acórdão)\\b")
            .rule("par.indicador", PARTIAL, Polarity.PARTIAL, 0.9,
                "\\b(?:parcialmente|em\\s+parte)\\b")
            .rule("par.parte-do-pedido", PARTIAL, Polarity.PARTIAL, 0.88,
                "\\bparte\\s+(?:do\\s+pedido|dos\\s+pedidos|da\\s+pretensão)\\b")
            .rule("par.somente-pedido", PARTIAL, Polarity.PARTIAL, 0.8,
                "\\b(?:concedo|defiro|acolho)\\s+(?:somente|apenas)\\s+o\\s+pedido\\s+de\\b")
            .rule("par.alguns-pedidos", PARTIAL, Polarity.PARTIAL, 0.75,
                "\\balguns\\s+pedidos?\\s+(?:foram\\s+acolhidos|procedem|deferidos)\\b")
            .rule("par.demais-rejeitados", PARTIAL, Polarity.PARTIAL, 0.7,
                "\\b(?:rejeitad[oa]s|indeferid[oa]s|improcedentes)\\s+(?:os\\s+)?demais\\s+pedidos?\\b")
            .rule("par.limitado", PARTIAL, Polarity.PARTIAL, 0.7,
                "\\b(?:limitad[oa]|restrit[oa])\\s+(?:a|ao|à|aos|às)\\b")
            .rule("par.exclusao", PARTIAL, Polarity.PARTIAL, 0.7,
                "\\b(?:excluo|excluíd[oa]|afasto|afastad[oa])\\s+(?:o\\s+pedido\\s+de|da\\s+condenação|a\\s+condenação\\s+em)\\b");
    }

    private static void inferential(PatternTaxonomy.Builder b) {
        b.rule("inf.pagamento-valor", INFERENTIAL, Polarity.FAVORABLE, 0.7,
                "\\b(?:pagamento|pagar)\\s+(?:de\\s+|referente\\s+a\\s+|o\\s+valor\\s+de\\s+)?(?:r\\$\\s*|quantia\\s+de\\s*r\\$\\s*)?"
                    + MONEY + "\\b")
            .rule("inf.indenizacao-danos", INFERENTIAL, Polarity.FAVORABLE, 0.8,
                "\\b(?:indenização|indenizar)\\s+(?:por\\s+|a\\s+título\\s+de\\s+)?danos?\\s+(?:morais?|materiais?)\\b")
            .rule("inf.valor-devido", INFERENTIAL, Polarity.FAVORABLE, 0.85,
                "\\b(?:valor|montante|importe|quantia)\\s+(?:de\\s+)?(?:r\\$\\s*)?" + MONEY
                    + "\\s+(?:devido|a\\s+ser\\s+pago)\\b")
            .rule("inf.liberacao-fgts", INFERENTIAL, Polarity.FAVORABLE, 0.75,
                "\\b(?:liberação|liberad[oa])\\s+(?:d[oa]s?\\s+)?(?:fgts|guias?)\\b")
            .rule("inf.reintegracao", INFERENTIAL, Polarity.FAVORABLE, 0.8,
                "\\b(?:reintegrar|reintegração)\\b")
            .rule("inf.obrigacao", INFERENTIAL, Polarity.FAVORABLE, 0.75,
                "\\bobrigação\\s+de\\s+(?:fazer|pagar|entregar)\\b")
            .rule("inf.ctps", INFERENTIAL, Polarity.FAVORABLE, 0.7,
                "\\b(?:anotação|retificação|registro)\\s+(?:na\\s+|em\\s+)?(?:ctps|carteira)\\b")
            .rule("inf.expedicao", INFERENTIAL, Polarity.FAVORABLE, 0.75,
                "\\b(?:expedição|expedir|emitir|fornecer)\\s+(?:de\\s+)?(?:guias?|alvarás?|certidão)\\b")
            .rule("inf.prazo", INFERENTIAL, Polarity.FAVORABLE, 0.75,
                "\\bno\\s+prazo\\s+de\\s+\\d+\\s+(?:\\(\\w+\\)\\s+)?(?:dias|horas)\\b")
            .rule("inf.sob-pena", INFERENTIAL, Polarity.FAVORABLE, 0.7,
                "\\bsob\\s+pena\\s+de\\s+(?:multa|execução|pagamento)\\b")
            .rule("inf.nao-ha-falar", INFERENTIAL, Polarity.UNFAVORABLE, 0.9,
                "\\bnão\\s+há\\s+(?:que|como)\\s+se\\s+falar\\s+em\\b")
            .rule("inf.nao-se-vislumbra", INFERENTIAL, Polarity.UNFAVORABLE, 0.85,
                "\\b(?:não\\s+se\\s+vislumbra|não\\s+se\\s+verifica|não\\s+restou\\s+comprovad[oa]|ausência\\s+de\\s+prova)\\b")
            .rule("inf.incabivel", INFERENTIAL, Polarity.UNFAVORABLE, 0.8,
                "\\b(?:incabível|descabid[oa]|improcedentes?)\\b")
            .rule("inf.negacao-direito", INFERENTIAL, Polarity.UNFAVORABLE, 0.9,
                "\\bnão\\s+(?:faz\\s+jus|tem\\s+direito|é\\s+devid[oa]|cabe)\\b")
            .rule("inf.indeferimento-pedido", INFERENTIAL, Polarity.UNFAVORABLE, 0.85,
                "\\b(?:indeferimento|rejeição)\\s+(?:d[oa]s?\\s+)?(?:pedidos?|pretensão)\\b")
            .rule("inf.onus-prova", INFERENTIAL, Polarity.UNFAVORABLE, 0.85,
                "\\bônus\\s+da\\s+prova\\s+(?:não\\s+foi\\s+desincumbido|do\\s+qual\\s+não\\s+se\\s+desincumbiu)\\b")
            .rule("inf.improvido", INFERENTIAL, Polarity.UNFAVORABLE, 0.7,
                "\\bimprovid[oa]s?\\b");
    }

    private static void laborRights(PatternTaxonomy.Builder b) {
        b.rule("lab.right-granted", LABOR_RIGHT, Polarity.FAVORABLE, 0.8,
                "\\b" + RIGHTS + "\\s+(?:são\\s+|é\\s+)?" + GRANTED + "\\b(?!\\s+(?:parcialmente|em\\s+parte))")
            .rule("lab.grant-right", LABOR_RIGHT, Polarity.FAVORABLE, 0.8,
                "\\b(?:defiro|concedo|reconheço|" + GRANTED + ")\\b(?!\\s+(?:parcialmente|em\\s+parte))"
                    + "[^.;]{0,40}?\\b" + RIGHTS + "\\b")
            .rule("lab.right-denied", LABOR_RIGHT, Polarity.UNFAVORABLE, 0.8,
                "\\b" + RIGHTS + "\\s+(?:são\\s+|é\\s+)?" + DENIED + "\\b")
            .rule("lab.deny-right", LABOR_RIGHT, Polarity.UNFAVORABLE, 0.8,
                "\\b(?:indefiro|rejeito|" + DENIED + ")\\b[^.;]{0,40}?\\b" + RIGHTS + "\\b")
            .rule("lab.no-right", LABOR_RIGHT, Polarity.UNFAVORABLE, 0.8,
                "\\bnão\\s+(?:faz\\s+jus|tem\\s+direito)\\s+(?:a|à|ao|às|aos)\\s+" + RIGHTS + "\\b")
            .rule("lab.grant-right-partially", LABOR_RIGHT, Polarity.PARTIAL, 0.8,
                "\\b(?:defiro|concedo|acolho|" + GRANTED + ")\\s+(?:parcialmente|em\\s+parte)\\b[^.;]{0,40}?\\b"
                    + RIGHTS + "\\b")
            .rule("lab.right-partially-granted", LABOR_RIGHT, Polarity.PARTIAL, 0.8,
                "\\b" + RIGHTS + "\\s+(?:são\\s+|é\\s+)?" + GRANTED + "\\s+(?:parcialmente|em\\s+parte)\\b");
    }

    private static void contextual(PatternTaxonomy.Builder b) {
        b.rule("ctx.dispositivo", CONTEXTUAL, Polarity.CONTEXT, 1.0,
                "\\b(?:dispositivo|decisório)\\b")
            .rule("ctx.conclusao-formal", CONTEXTUAL, Polarity.CONTEXT, 0.95,
                "\\b(?:isto\\s+posto|diante\\s+do\\s+exposto|pelo\\s+exposto|ante\\s+o\\s+exposto"
                    + "|por\\s+todo\\s+o\\s+exposto|em\\s+face\\s+do\\s+exposto)\\b")
            .rule("ctx.conclusao-inferencial", CONTEXTUAL, Polarity.CONTEXT, 0.85,
                "\\b(?:assim\\s+sendo|dessa\\s+forma|portanto|em\\s+consequência)\\b")
            .rule("ctx.verbo-julgamento", CONTEXTUAL, Polarity.CONTEXT, 0.95,
                "\\b(?:julgo|decido|sentencio|acordam)\\b")
            .rule("ctx.verbo-ordem", CONTEXTUAL, Polarity.CONTEXT, 0.85,
                "\\b(?:determino|ordeno|homologo)\\b")
            .rule("ctx.merito", CONTEXTUAL, Polarity.CONTEXT, 0.9,
                "\\b(?:no\\s+mérito|quanto\\s+ao\\s+mérito|em\\s+relação\\s+ao\\s+mérito)\\b");
    }

    private static void structural(PatternTaxonomy.Builder b) {
        b.rule("hdr.dispositivo", DISPOSITIVE_HEADER, Polarity.CONTEXT, 1.0,
                "(?m)^\\s*(?:[ivx]+\\s*[-–.]\\s*)?(?:dispositivo|conclusão|decisão)\\s*:?\\s*$")
            .rule("hdr.exposto", DISPOSITIVE_HEADER, Polarity.CONTEXT, 0.95,
                "\\b(?:isto\\s+posto|ante\\s+o\\s+exposto|pelo\\s+exposto|diante\\s+do\\s+exposto"
                    + "|em\\s+face\\s+do\\s+exposto|por\\s+todo\\s+o\\s+exposto)\\b")
            .rule("hdr.acordam", DISPOSITIVE_HEADER, Polarity.CONTEXT, 0.95,
                "\\bacordam\\b");

        String judged = "\\b(?:julgo|decido|sentencio)\\s+(?:(?:o|os)\\s+pedidos?\\s+|a\\s+ação\\s+|a\\s+pretensão\\s+)?";
        b.rule("str.julgamento-procedente", STRUCTURAL, Polarity.FAVORABLE, 0.9,
                judged + "(?:totalmente\\s+)?procedentes?\\b(?!\\s+em\\s+parte)")
            .rule("str.julgamento-improcedente", STRUCTURAL, Polarity.UNFAVORABLE, 0.9,
                judged + "(?:totalmente\\s+)?improcedentes?\\b")
            .rule("str.julgamento-parcial", STRUCTURAL, Polarity.PARTIAL, 0.95,
                judged + "parcialmente\\s+procedentes?\\b")
            .rule("str.procedente-em-parte", STRUCTURAL, Polarity.PARTIAL, 0.9,
                "\\bprocedentes?\\s+em\\s+parte\\b")
            .rule("str.provimento", STRUCTURAL, Polarity.FAVORABLE, 0.85,
                "\\b(?:dou|dar|dá)\\s+provimento\\b|\\brecurso\\s+(?:ordinário\\s+)?provido\\b")
            .rule("str.desprovimento", STRUCTURAL, Polarity.UNFAVORABLE, 0.85,
                "\\bnego\\s+provimento\\b|\\brecurso\\s+(?:ordinário\\s+)?(?:desprovido|improvido|não\\s+provido)\\b"
                    + "|\\bnão\\s+conheço\\s+do\\s+recurso\\b")
            .rule("str.parcial-provimento", STRUCTURAL, Polarity.PARTIAL, 0.9,
                "\\b(?:dou|dar|dá)\\s+parcial\\s+provimento\\b|\\brecurso\\s+parcialmente\\s+provido\\b")
            .rule("str.condeno-parte", STRUCTURAL, Polarity.FAVORABLE, 0.85,
                "\\bcondeno\\s+(?:[oa]s?\\s+)?(?:reclamad[oa]s?|réu|ré|requerid[oa]s?|empresa|executad[oa])\\b")
            .rule("str.absolvo-parte", STRUCTURAL, Polarity.UNFAVORABLE, 0.85,
                "\\babsolvo\\s+(?:[oa]s?\\s+)?(?:reclamad[oa]s?|réu|ré|requerid[oa]s?|empresa|executad[oa])\\b");
    }

    private static void legalLanguage(PatternTaxonomy.Builder b) {
        b.rule("leg.fundamentos-procedente", LEGAL_LANGUAGE, Polarity.FAVORABLE, 0.8,
                "\\bpel[oa]s\\s+(?:fundamentos|razões)\\s+[^.]{0,200}?\\bprocedentes?\\b")
            .rule("leg.fundamentos-improcedente", LEGAL_LANGUAGE, Polarity.UNFAVORABLE, 0.8,
                "\\bpel[oa]s\\s+(?:fundamentos|razões)\\s+[^.]{0,200}?\\bimprocedentes?\\b")
            .rule("leg.restou-comprovado", LEGAL_LANGUAGE, Polarity.FAVORABLE, 0.6,
                "(?<!não\\s)\\b(?:restou|ficou)\\s+(?:comprovad[oa]|demonstrad[oa]|provad[oa])\\b")
            .rule("leg.nao-restou-comprovado", LEGAL_LANGUAGE, Polarity.UNFAVORABLE, 0.6,
                "\\bnão\\s+(?:restou|ficou)\\s+(?:comprovad[oa]|demonstrad[oa]|provad[oa])\\b")
            .rule("leg.conjunto-probatorio", LEGAL_LANGUAGE, Polarity.FAVORABLE, 0.5,
                "\\bface\\s+ao\\s+conjunto\\s+probatório\\b")
            .rule("leg.ausencia-elementos", LEGAL_LANGUAGE, Polarity.UNFAVORABLE, 0.6,
                "\\bausência\\s+de\\s+elementos\\s+probatórios\\b")
            .rule("leg.acolho-pedido", LEGAL_LANGUAGE, Polarity.FAVORABLE, 0.7,
                "\\b(?:acolho|defiro)\\s+(?:integralmente\\s+)?(?:o|os)\\s+pedidos?\\b")
            .rule("leg.rejeito-pedido", LEGAL_LANGUAGE, Polarity.UNFAVORABLE, 0.7,
                "\\b(?:rejeito|indefiro)\\s+(?:integralmente\\s+)?(?:o|os)\\s+pedidos?\\b")
            .rule("leg.declaro-direito", LEGAL_LANGUAGE, Polarity.FAVORABLE, 0.6,
                "\\bdeclaro\\s+(?:o\\s+)?(?:vínculo|direito)\\b");
    }
}
