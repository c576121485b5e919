package com.decisionfacts.taxonomy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PatternTaxonomyTest {

    private static PatternTaxonomy.Builder withAllMethods() {
        PatternTaxonomy.Builder builder = PatternTaxonomy.builder("test-1");
        for (MethodId method : MethodId.values()) {
            builder.method(method, 0.5, 0.5);
        }
        return builder;
    }

    @Nested
    @DisplayName("Default taxonomy")
    class DefaultTaxonomyTests {

        @Test
        void defaultTaxonomy_buildsWithRulesInEveryCategory() {
            PatternTaxonomy taxonomy = DefaultTaxonomy.create();

            assertEquals(DefaultTaxonomy.VERSION, taxonomy.version());
            for (PatternCategory category : PatternCategory.values()) {
                assertFalse(taxonomy.rules(category).isEmpty(), "no rules for " + category);
            }
            assertTrue(taxonomy.patternCount() > 50);
        }

        @Test
        void fingerprint_isStableAcrossBuilds() {
            assertEquals(DefaultTaxonomy.create().fingerprint(), DefaultTaxonomy.create().fingerprint());
        }

        @Test
        void profiles_haveMaxContributionOfWeightTimesCeiling() {
            PatternTaxonomy taxonomy = DefaultTaxonomy.create();
            MethodProfile direct = taxonomy.profile(MethodId.DIRECT_PATTERN);

            assertEquals(direct.weight() * direct.ceiling(), direct.maxContribution(), 1e-9);
            assertEquals(direct.ceiling(), direct.cap(5.0), 1e-9);
        }
    }

    @Nested
    @DisplayName("Fail-fast validation")
    class Validation {

        @Test
        void invalidRegex_isRejectedAtBuildTime() {
            TaxonomyException ex = assertThrows(TaxonomyException.class, () ->
                withAllMethods().rule("fav.broken", PatternCategory.FAVORABLE, Polarity.FAVORABLE, 0.9, "(unclosed"));
            assertTrue(ex.getMessage().contains("fav.broken"));
        }

        @Test
        void duplicateId_isRejected() {
            PatternTaxonomy.Builder builder = withAllMethods()
                .rule("fav.a", PatternCategory.FAVORABLE, Polarity.FAVORABLE, 0.9, "procedente");

            assertThrows(TaxonomyException.class, () ->
                builder.rule("fav.a", PatternCategory.FAVORABLE, Polarity.FAVORABLE, 0.9, "deferido"));
        }

        @Test
        void weightOutsideUnitInterval_isRejected() {
            assertThrows(TaxonomyException.class, () ->
                withAllMethods().rule("fav.a", PatternCategory.FAVORABLE, Polarity.FAVORABLE, 1.5, "procedente"));
            assertThrows(TaxonomyException.class, () ->
                withAllMethods().rule("fav.b", PatternCategory.FAVORABLE, Polarity.FAVORABLE, 0.0, "procedente"));
        }

        @Test
        void locatorCategory_requiresContextPolarity() {
            assertThrows(TaxonomyException.class, () ->
                withAllMethods().rule("ctx.a", PatternCategory.CONTEXTUAL, Polarity.FAVORABLE, 0.9, "dispositivo"));
            assertThrows(TaxonomyException.class, () ->
                withAllMethods().rule("fav.a", PatternCategory.FAVORABLE, Polarity.CONTEXT, 0.9, "procedente"));
        }

        @Test
        void missingMethodProfile_failsBuild() {
            PatternTaxonomy.Builder builder = PatternTaxonomy.builder("test-1")
                .method(MethodId.DIRECT_PATTERN, 1.0, 1.0);

            assertThrows(TaxonomyException.class, builder::build);
        }

        @Test
        void duplicateMethodProfile_isRejected() {
            assertThrows(TaxonomyException.class, () -> withAllMethods().method(MethodId.INFERENCE, 0.5, 0.5));
        }

        @Test
        void blankVersion_isRejected() {
            assertThrows(TaxonomyException.class, () -> PatternTaxonomy.builder(" "));
        }
    }
}
