package com.locode.resolution.match;

import com.locode.resolution.core.model.CodeType;
import com.locode.resolution.similarity.NameScoringWeights;
import com.locode.resolution.testutil.CatalogFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchingOptions Tests")
class MatchingOptionsTest {

    @Test
    @DisplayName("Defaults")
    void defaults() {
        MatchingOptions options = MatchingOptions.defaults();

        assertEquals(1.0, options.getNameWeight());
        assertEquals(0.25, options.getHintWeight());
        assertEquals(1.0, options.getProximityRadius());
        assertEquals(NameScoringWeights.defaults(), options.getNameScoringWeights());
    }

    @Test
    @DisplayName("Invalid weights are rejected")
    void invalidWeights() {
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().nameWeight(0));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().hintWeight(-0.1));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().proximityRadius(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().nameScoringWeights(null));
    }

    @Test
    @DisplayName("Custom weights flow into matcher scores")
    void customWeightsApplied() {
        MatchingOptions options = MatchingOptions.builder().nameWeight(2.0).hintWeight(0.5).build();
        CodeMatcher matcher = CatalogFixtures.standardBuilder().matchingOptions(options).build()
                .getParser(CodeType.LOCODE, null, false);

        assertEquals(2.5, matcher.analyse(QueryParser.parse("Paris [CO] FR")).score(), 1e-9);
    }

    @Test
    @DisplayName("Scope label names type and state")
    void scopeLabel() {
        assertEquals("ALL", MatcherScope.all().label());
        assertEquals("LOCODE@US", new MatcherScope(CodeType.LOCODE, "US", true).label());
    }
}
