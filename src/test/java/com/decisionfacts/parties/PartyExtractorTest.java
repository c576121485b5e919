package com.decisionfacts.parties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PartyExtractorTest {

    private static final String HEADER = """
        RECLAMANTE: JOÃO DA SILVA, CPF 123.456.789-09, residente na Rua das Flores, 100; Advogado: Dr. Pedro Alves (OAB/SP 12345)
        RECLAMADA: EMPRESA XYZ LTDA, CNPJ 12.345.678/0001-90, com sede na Av. Paulista, 1000

        SENTENÇA
        Vistos etc.
        """;

    private PartyExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new PartyExtractor();
    }

    @Nested
    @DisplayName("Labelled header")
    class LabelledHeader {

        @Test
        void claimant_hasNameTaxIdAddressAndCounsel() {
            PartyRecord claimant = extractor.extract(HEADER, null).claimant().orElseThrow();

            assertEquals(PartyRole.CLAIMANT, claimant.role());
            assertEquals("JOÃO DA SILVA", claimant.name());
            assertEquals(Optional.of(new TaxIdentifier(TaxIdentifier.Kind.CPF, "123.456.789-09")), claimant.taxId());
            assertEquals(Optional.of("Rua das Flores, 100"), claimant.address());
            assertEquals(List.of("Pedro Alves"), claimant.counsel());
            assertEquals(1.0, claimant.confidence(), 1e-9);
        }

        @Test
        void defendant_hasCnpjAndAddress() {
            PartyRecord defendant = extractor.extract(HEADER, null).defendant().orElseThrow();

            assertEquals("EMPRESA XYZ LTDA", defendant.name());
            assertEquals(TaxIdentifier.Kind.CNPJ, defendant.taxId().orElseThrow().kind());
            assertEquals("12.345.678/0001-90", defendant.taxId().orElseThrow().value());
            assertEquals(Optional.of("Av. Paulista, 1000"), defendant.address());
            assertTrue(defendant.counsel().isEmpty());
            assertEquals(0.75, defendant.confidence(), 1e-9);
        }

        @Test
        void overallConfidence_isMeanOfBothParties() {
            assertEquals(0.875, extractor.extract(HEADER, null).confidence(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Parties named in running text")
    class RunningText {

        @Test
        void nameAfterKeyword_stopsAtProse() {
            ExtractedParties parties = extractor.extract(
                "O RECLAMANTE Fulano de Tal alega horas extras. A RECLAMADA Beta Comércio Ltda. contesta.", null);

            assertEquals("Fulano de Tal", parties.claimant().orElseThrow().name());
            assertEquals("Beta Comércio Ltda.", parties.defendant().orElseThrow().name());
            assertEquals(PartyExtractor.NAME_SCORE, parties.confidence(), 1e-9);
        }

        @Test
        void upperCaseNameInProse_keepsConnectorsAndAbbreviation() {
            ExtractedParties parties = extractor.extract(
                "A RECLAMADA COMERCIAL DOS SANTOS LTDA. apresentou defesa.", null);

            assertEquals("COMERCIAL DOS SANTOS LTDA.", parties.defendant().orElseThrow().name());
        }
    }

    @Nested
    @DisplayName("Missing parties")
    class MissingParties {

        @Test
        void emptyText_yieldsNoParties() {
            ExtractedParties parties = extractor.extract("", null);

            assertTrue(parties.isEmpty());
            assertEquals(0.0, parties.confidence());
        }

        @Test
        void singleParty_isDiscounted() {
            ExtractedParties parties = extractor.extract("RECLAMANTE: MARIA SOUZA\n\nVistos etc.", null);

            assertEquals("MARIA SOUZA", parties.claimant().orElseThrow().name());
            assertTrue(parties.defendant().isEmpty());
            assertEquals(PartyExtractor.NAME_SCORE * PartyExtractor.SINGLE_PARTY_FACTOR, parties.confidence(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Parties hint")
    class PartiesHint {

        @Test
        void versusHint_fillsBothRolesWithDiscount() {
            ExtractedParties parties = extractor.extract("", "JOSÉ PEREIRA x CONSTRUTORA ABC S/A");

            assertEquals("JOSÉ PEREIRA", parties.claimant().orElseThrow().name());
            assertEquals("CONSTRUTORA ABC S/A", parties.defendant().orElseThrow().name());
            double expected = PartyExtractor.NAME_SCORE * PartyExtractor.HINT_FACTOR;
            assertEquals(expected, parties.claimant().orElseThrow().confidence(), 1e-9);
            assertEquals(expected, parties.confidence(), 1e-9);
        }

        @Test
        void textParty_winsOverHint() {
            ExtractedParties parties = extractor.extract("RECLAMANTE: MARIA SOUZA\n\nVistos etc.",
                "JOSÉ PEREIRA x CONSTRUTORA ABC S/A");

            assertEquals("MARIA SOUZA", parties.claimant().orElseThrow().name());
            assertEquals("CONSTRUTORA ABC S/A", parties.defendant().orElseThrow().name());
        }
    }

    @Test
    void taxIdentifier_acceptsOnlyElevenOrFourteenDigits() {
        assertEquals("123.456.789-09", TaxIdentifier.fromDigits("12345678909").orElseThrow().value());
        assertEquals(TaxIdentifier.Kind.CNPJ, TaxIdentifier.fromDigits("12345678000190").orElseThrow().kind());
        assertTrue(TaxIdentifier.fromDigits("1234").isEmpty());
    }
}
