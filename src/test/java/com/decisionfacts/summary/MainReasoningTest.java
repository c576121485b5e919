package com.decisionfacts.summary;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MainReasoningTest {

    private static final String DECISION = """
        RELATÓRIO
        Conforme a inicial, o reclamante pede horas extras.

        FUNDAMENTAÇÃO
        A prova oral foi coerente e convincente.
        Nos termos do art. 59 da CLT, as horas excedentes devem ser pagas com adicional.
        Conforme a Súmula 85 do TST, o acordo de compensação não foi observado.
        Segundo a Lei 13.467/2017, a jornada não foi regularmente pactuada.

        DISPOSITIVO
        Julgo procedente o pedido, nos termos do art. 7º da CLT.
        """;

    @Test
    void reasoningSection_yieldsFirstTwoGroundedSentences() {
        assertEquals("Nos termos do art. 59 da CLT, as horas excedentes devem ser pagas com adicional. "
                + "Conforme a Súmula 85 do TST, o acordo de compensação não foi observado.",
            MainReasoning.select(DECISION, 300));
    }

    @Test
    void textWithoutReasoningHeading_isSearchedWhole() {
        String text = "Vistos etc. De acordo com o art. 818 da CLT, cabia ao autor provar o fato. Julgo improcedente.";

        assertEquals("De acordo com o art. 818 da CLT, cabia ao autor provar o fato.", MainReasoning.select(text, 200));
    }

    @Test
    void shortOrUngroundedSentences_areSkipped() {
        assertEquals("", MainReasoning.select("Conforme a lei. A prova foi coerente e convincente no caso.", 200));
    }

    @Test
    void longReasoning_isTruncated() {
        String reasoning = MainReasoning.select(DECISION, 20);

        assertEquals("Nos termos do art. 5...", reasoning);
    }

    @Test
    void blankText_givesEmptyReasoning() {
        assertEquals("", MainReasoning.select("", 200));
        assertEquals("", MainReasoning.select(null, 200));
    }
}
