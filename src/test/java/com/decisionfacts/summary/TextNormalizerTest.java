package com.decisionfacts.summary;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
    }

    @Nested
    @DisplayName("HTML input")
    class Html {

        @Test
        void markup_isReducedToLines() {
            String html = "<div><p>RECLAMANTE: MARIA SOUZA</p><p>Julgo <b>procedente</b> o pedido.<br>Custas pela ré.</p>"
                + "<script>var x = 1;</script></div>";

            assertEquals("RECLAMANTE: MARIA SOUZA\n\nJulgo procedente o pedido.\nCustas pela ré.", normalizer.normalize(html));
        }

        @Test
        void entities_areDecoded() {
            assertEquals("art. 7º da CLT & Súmula 85", normalizer.normalize("<p>art. 7&ordm; da CLT &amp; S&uacute;mula 85</p>"));
        }
    }

    @Nested
    @DisplayName("Plain text")
    class PlainText {

        @Test
        void plainEntities_areDecodedWithoutParsing() {
            assertEquals("Fulano & Cia", normalizer.normalize("Fulano &amp; Cia"));
        }

        @Test
        void mojibake_isRepaired() {
            assertEquals("reclamação trabalhista nº 10", normalizer.normalize("reclamaÃ§Ã£o trabalhista nÂº 10"));
        }

        @Test
        void pageMarkersAndBareNumbers_areDropped() {
            String text = "Vistos etc.\nPágina 2 de 5\nfls. 12\n- 3 -\nJulgo procedente o pedido.";

            assertEquals("Vistos etc.\nJulgo procedente o pedido.", normalizer.normalize(text));
        }

        @Test
        void whitespace_isCollapsedButParagraphsKept() {
            String text = "  DISPOSITIVO  \r\n\r\n\r\n\r\nJulgo\t\tprocedente   o pedido.  ";

            assertEquals("DISPOSITIVO\n\nJulgo procedente o pedido.", normalizer.normalize(text));
        }

        @Test
        void blankText_givesEmptyString() {
            assertEquals("", normalizer.normalize(null));
            assertEquals("", normalizer.normalize(" \n "));
        }
    }
}
