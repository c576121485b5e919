package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.DefaultTaxonomy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LaborRightsAnalyzerTest {

    private LaborRightsAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new LaborRightsAnalyzer(DefaultTaxonomy.create());
    }

    @Test
    void eachRight_getsItsOwnVerdict() {
        List<RightOutcome> outcomes = analyzer.analyze(
            "Defiro as horas extras. Indefiro o pedido de danos morais. "
                + "Defiro parcialmente o adicional de insalubridade.");

        assertEquals(List.of("horas extras", "danos morais", "adicional de insalubridade"),
            outcomes.stream().map(RightOutcome::right).toList());
        assertEquals(List.of(RightVerdict.GRANTED, RightVerdict.DENIED, RightVerdict.PARTIALLY_GRANTED),
            outcomes.stream().map(RightOutcome::verdict).toList());
        assertEquals("defiro as horas extras", outcomes.get(0).snippet());
        assertEquals("lab.grant-right", outcomes.get(0).patternId());
    }

    @Test
    void laterRuling_overridesEarlierOne() {
        List<RightOutcome> outcomes = analyzer.analyze(
            "Na sentença, defiro as horas extras. Em embargos, reconsidero e indefiro as horas extras.");

        assertEquals(1, outcomes.size());
        assertEquals(RightVerdict.DENIED, outcomes.get(0).verdict());
    }

    @Test
    void textWithoutRights_yieldsNothing() {
        assertTrue(analyzer.analyze("Julgo procedente o pedido.").isEmpty());
        assertTrue(analyzer.analyze("").isEmpty());
        assertTrue(analyzer.analyze(null).isEmpty());
    }

    @Test
    void verdict_isSerializedInSnakeCase() {
        assertEquals("partially_granted", RightVerdict.PARTIALLY_GRANTED.getValue());
    }
}
