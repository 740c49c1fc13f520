package com.locode.resolution.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TokenSortSimilarity Tests")
class TokenSortSimilarityTest {

    private final TokenSortSimilarity similarity = new TokenSortSimilarity();

    @ParameterizedTest
    @CsvSource({
            "New York, York New, 100",
            "'New York,', new york, 100",
            "Springfield, Springfeld, 95",
            "kitten, sitting, 62",
            "Boston, qqqq, 0"
    })
    @DisplayName("ratio should compare sorted tokens on a 0..100 scale")
    void ratio(String s1, String s2, int expected) {
        assertEquals(expected, similarity.ratio(s1, s2));
    }

    @Test
    @DisplayName("Empty or null input scores zero")
    void emptyInput() {
        assertEquals(0, similarity.ratio("", "Boston"));
        assertEquals(0, similarity.ratio("!!", "Boston"));
        assertEquals(0, similarity.ratio(null, "Boston"));
    }

    @Test
    @DisplayName("ratio should be symmetric")
    void symmetric() {
        assertEquals(similarity.ratio("Saint Louis", "St Louis"), similarity.ratio("St Louis", "Saint Louis"));
    }

    @Test
    @DisplayName("sortTokens should strip punctuation, lower-case and sort")
    void sortTokens() {
        assertEquals("br paulo são", TokenSortSimilarity.sortTokens("São Paulo, BR"));
        assertEquals("", TokenSortSimilarity.sortTokens(" -- "));
    }

    @Test
    @DisplayName("compute should return the ratio as a fraction")
    void compute() {
        assertEquals(0.95, similarity.compute("Springfield", "Springfeld"), 1e-9);
    }
}
