package com.decisionfacts.references;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LegalReferenceExtractorTest {

    private LegalReferenceExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new LegalReferenceExtractor();
    }

    private static List<String> citations(List<LegalReference> references) {
        return references.stream().map(LegalReference::normalizedCitation).toList();
    }

    @Nested
    @DisplayName("Canonical forms")
    class CanonicalForms {

        @Test
        void articleSpellings_collapseToOneCitation() {
            for (String text : List.of("Art. 7º da CLT", "artigo 7 da CLT", "CLT, art. 7º", "art 7o, CLT")) {
                List<LegalReference> found = extractor.scan(text, Provenance.EXTRACTED);
                assertEquals(List.of("Art. 7º CLT"), citations(found), text);
                assertEquals(ReferenceKind.ARTICLE, found.get(0).kind());
            }
        }

        @Test
        void articleWithParagraph_keepsParagraph() {
            List<LegalReference> found = extractor.scan("nos termos do art. 477, § 8º, da CLT", Provenance.EXTRACTED);

            assertEquals(List.of("Art. 477, § 8º CLT"), citations(found));
        }

        @Test
        void statutes_getThousandsSeparatorAndFullYear() {
            assertEquals(List.of("Lei 8.213/1991"), citations(extractor.scan("Lei 8213/91", Provenance.EXTRACTED)));
            assertEquals(List.of("Lei 13.467/2017"),
                citations(extractor.scan("Lei nº 13.467/2017", Provenance.EXTRACTED)));
        }

        @Test
        void sumula_defaultsToTst() {
            assertEquals(List.of("Súmula 331 TST"), citations(extractor.scan("Súmula 331 do TST", Provenance.EXTRACTED)));
            assertEquals(List.of("Súmula 85 TST"), citations(extractor.scan("súmula nº 85", Provenance.EXTRACTED)));
        }

        @Test
        void decreeLaw_isOneDecreeReference() {
            List<LegalReference> found = extractor.scan("Decreto Lei nº 5.452/43", Provenance.EXTRACTED);

            assertEquals(List.of("Decreto-Lei 5.452/1943"), citations(found));
            assertEquals(ReferenceKind.DECREE, found.get(0).kind());
            assertEquals(List.of("Decreto-Lei 5.452/1943"),
                citations(extractor.scan("Decreto-Lei 5452/1943", Provenance.EXTRACTED)));
        }

        @Test
        void ordinances_keepAgencyAndFullYear() {
            List<LegalReference> found = extractor.scan("Portaria MTE nº 3.214/78 e NR-15", Provenance.EXTRACTED);

            assertEquals(List.of("Portaria MTE 3.214/1978", "NR 15"), citations(found));
            assertTrue(found.stream().allMatch(r -> r.kind() == ReferenceKind.ORDINANCE));
        }

        @Test
        void orientacaoJurisprudencial_carriesSection() {
            List<LegalReference> found = extractor.scan("OJ 394 da SDI-1 do TST", Provenance.EXTRACTED);

            assertEquals(List.of("OJ 394 SDI-1 TST"), citations(found));
            assertEquals(ReferenceKind.SUMULA, found.get(0).kind());
        }

        @Test
        void bindingSumula_isAttributedToStf() {
            List<LegalReference> found = extractor.scan("Súmula Vinculante 4", Provenance.EXTRACTED);

            assertEquals(List.of("Súmula Vinculante 4 STF"), citations(found));
        }

        @Test
        void caput_isAccepted() {
            assertEquals(List.of("Art. 9º CLT"),
                citations(extractor.scan("art. 9º, caput, da CLT", Provenance.EXTRACTED)));
            assertEquals(List.of("Art. 818 CLT"),
                citations(extractor.scan("CLT, art. 818, caput", Provenance.EXTRACTED)));
        }

        @Test
        void articleList_citesEveryArticle() {
            assertEquals(List.of("Art. 7º CLT", "Art. 8º CLT"),
                citations(extractor.scan("arts. 7º e 8º da CLT", Provenance.EXTRACTED)));
            assertEquals(List.of("Art. 58 CLT", "Art. 59 CLT", "Art. 59-A CLT"),
                citations(extractor.scan("artigos 58, 59 e 59-A da CLT", Provenance.EXTRACTED)));
        }

        @Test
        void consolidacaoSpelledOut_isClt() {
            assertEquals(List.of("Art. 477, § 8º CLT"), citations(extractor.scan(
                "art. 477, § 8º, da Consolidação das Leis do Trabalho", Provenance.EXTRACTED)));
        }

        @Test
        void textWithoutCitations_yieldsNothing() {
            assertTrue(extractor.extract("Vistos etc. Nada a citar.", null).isEmpty());
            assertTrue(extractor.extract("", "").isEmpty());
        }
    }

    @Nested
    @DisplayName("Merge with the references hint")
    class Merge {

        @Test
        void sameArticleInTextAndHint_appearsOnceAsPreExisting() {
            List<LegalReference> merged = extractor.extract("Conforme o Art. 7º da CLT, defiro.", "Artigo 7, CLT");

            assertEquals(1, merged.size());
            LegalReference reference = merged.get(0);
            assertEquals(ReferenceKind.ARTICLE, reference.kind());
            assertEquals("Art. 7º CLT", reference.normalizedCitation());
            assertEquals(Provenance.PRE_EXISTING, reference.provenance());
        }

        @Test
        void merge_isIdempotent() {
            List<LegalReference> extracted = extractor.scan(
                "Lei 8.213/91, art. 7º da CLT e Súmula 331 do TST", Provenance.EXTRACTED);
            List<LegalReference> hint = extractor.parseHint("Art. 7º CLT; Lei 13.467/2017");

            List<LegalReference> merged = extractor.merge(extracted, hint);

            assertEquals(merged, extractor.merge(merged, hint));
            assertEquals(merged, extractor.merge(merged, extracted));
        }

        @Test
        void merged_isUniqueAndOrderedByKind() {
            List<LegalReference> merged = extractor.extract(
                "Súmula 331 do TST. Lei 8.213/91. Art. 7º da CLT. Súmula 331 TST.", "Lei 8213/1991 | Súmula 85");

            assertEquals(List.of("Art. 7º CLT", "Lei 8.213/1991", "Súmula 331 TST", "Súmula 85 TST"), citations(merged));
            assertEquals(merged.size(), merged.stream().map(LegalReference::key).distinct().count());
        }

        @Test
        void everyKind_isOrderedArticleStatuteSumulaDecreeOrdinance() {
            List<LegalReference> merged = extractor.extract(
                "NR 15. Decreto 3.048/99. OJ 394 da SDI-1 do TST. Lei 8.213/91. Art. 7º da CLT.", null);

            assertEquals(List.of(ReferenceKind.ARTICLE, ReferenceKind.STATUTE, ReferenceKind.SUMULA,
                ReferenceKind.DECREE, ReferenceKind.ORDINANCE), merged.stream().map(LegalReference::kind).toList());
        }

        @Test
        void confidence_isMeanOfProvenanceConfidence() {
            List<LegalReference> references = List.of(
                new LegalReference(ReferenceKind.ARTICLE, "Art. 7º CLT", Provenance.PRE_EXISTING),
                new LegalReference(ReferenceKind.STATUTE, "Lei 8.213/1991", Provenance.EXTRACTED));

            assertEquals((1.0 + 0.85) / 2, LegalReferenceExtractor.confidence(references), 1e-9);
            assertEquals(0.0, LegalReferenceExtractor.confidence(List.of()));
        }
    }
}
