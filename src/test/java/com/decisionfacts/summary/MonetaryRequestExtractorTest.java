package com.decisionfacts.summary;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MonetaryRequestExtractorTest {

    private MonetaryRequestExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new MonetaryRequestExtractor();
    }

    @Nested
    @DisplayName("Monetary mentions")
    class MonetaryMentions {

        @Test
        void amounts_areParsedInOrderAndDeduplicated() {
            List<MonetaryMention> mentions = extractor.monetaryMentions(
                "Condeno a reclamada ao pagamento de R$ 1.500,00 a título de horas extras e "
                    + "R$ 2,5 milhões de indenização. Repito: R$ 1.500,00.");

            assertEquals(2, mentions.size());
            assertEquals("R$ 1.500,00", mentions.get(0).surfaceText());
            assertEquals(0, new BigDecimal("1500.00").compareTo(mentions.get(0).numericValue()));
            assertEquals("R$ 2,5 milhões", mentions.get(1).surfaceText());
            assertEquals(0, new BigDecimal("2500000").compareTo(mentions.get(1).numericValue()));
            assertTrue(mentions.get(0).context().contains("pagamento de"));
        }

        @Test
        void amountSpelledWithReais_isRecognized() {
            List<MonetaryMention> mentions = extractor.monetaryMentions("fixo a indenização em 10 mil reais");

            assertEquals(1, mentions.size());
            assertEquals(0, new BigDecimal("10000").compareTo(mentions.get(0).numericValue()));
        }

        @Test
        void parseAmount_handlesBrazilianNotationAndScales() {
            assertEquals(new BigDecimal("1234.56"), MonetaryRequestExtractor.parseAmount("1.234,56", null));
            assertEquals(new BigDecimal("3000.00"), MonetaryRequestExtractor.parseAmount("3", "mil"));
            assertEquals(new BigDecimal("1000000.00"), MonetaryRequestExtractor.parseAmount("1", "milhão"));
            assertEquals(new BigDecimal("2000000000.00"), MonetaryRequestExtractor.parseAmount("2", "bilhões"));
        }

        @Test
        void mentions_areLimited() {
            MonetaryRequestExtractor limited = new MonetaryRequestExtractor(1, 5);

            assertEquals(1, limited.monetaryMentions("R$ 10,00 e R$ 20,00 e R$ 30,00").size());
        }

        @Test
        void negativeLimits_areRejected() {
            assertThrows(IllegalArgumentException.class, () -> new MonetaryRequestExtractor(-1, 5));
        }
    }

    @Nested
    @DisplayName("Main requests")
    class MainRequests {

        @Test
        void topics_areReadFromRequestsSection() {
            String text = "DOS PEDIDOS\n"
                + "O reclamante requer horas extras, FGTS e indenização por danos morais.\n"
                + "FUNDAMENTAÇÃO\n"
                + "Quanto às férias, nada a deferir.";

            assertEquals(List.of("Horas Extras", "FGTS", "Danos Morais"), extractor.mainRequests(text));
        }

        @Test
        void topics_areLimited() {
            MonetaryRequestExtractor limited = new MonetaryRequestExtractor(10, 2);

            List<String> requests = limited.mainRequests("horas extras, adicional noturno, FGTS e férias");

            assertEquals(List.of("Horas Extras", "Adicional Noturno"), requests);
        }

        @Test
        void genericRequest_isUsedWhenNoTopicMatches() {
            List<String> requests = extractor.mainRequests(
                "O autor pede a devolução dos valores descontados indevidamente.");

            assertEquals(List.of("a devolução dos valores descontados indevidamente"), requests);
        }

        @Test
        void emptyText_hasNoRequests() {
            assertTrue(extractor.mainRequests("").isEmpty());
            assertEquals(MonetaryRequestExtractor.Result.empty(), extractor.extract(""));
        }
    }
}
