package com.decisionfacts.summary;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SummaryWeightsTest {

    @Nested
    @DisplayName("Weighted mean")
    class Combine {

        @Test
        void defaults_giveHalfToOutcome() {
            SummaryWeights weights = SummaryWeights.defaults();

            assertEquals(0.5, weights.combine(1.0, 0.0, 0.0), 1e-9);
            assertEquals(0.25, weights.combine(0.0, 1.0, 0.0), 1e-9);
            assertEquals(1.0, weights.combine(1.0, 1.0, 1.0), 1e-9);
        }

        @Test
        void weightsNotSummingToOne_areNormalized() {
            SummaryWeights weights = new SummaryWeights(2.0, 1.0, 1.0);

            assertEquals(0.5, weights.combine(1.0, 0.0, 0.0), 1e-9);
            assertEquals(1.0, weights.combine(1.0, 1.0, 1.0), 1e-9);
            assertEquals(SummaryWeights.defaults().combine(0.8, 0.6, 0.85), weights.combine(0.8, 0.6, 0.85), 1e-9);
        }
    }

    @Nested
    @DisplayName("Weight ordering")
    class Ordering {

        @Test
        void equalWeights_areRejected() {
            assertThrows(IllegalArgumentException.class, () -> new SummaryWeights(0.5, 0.5, 0.5));
        }

        @Test
        void outcomeBelowParties_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> new SummaryWeights(0.2, 0.4, 0.4));
        }

        @Test
        void unequalPartiesAndReferences_areRejected() {
            assertThrows(IllegalArgumentException.class, () -> new SummaryWeights(0.5, 0.3, 0.2));
        }

        @Test
        void outcomeOnly_isAccepted() {
            SummaryWeights weights = new SummaryWeights(1.0, 0.0, 0.0);

            assertEquals(0.7, weights.combine(0.7, 1.0, 1.0), 1e-9);
        }
    }
}
