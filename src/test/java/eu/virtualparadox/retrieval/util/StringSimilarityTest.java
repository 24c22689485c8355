package eu.virtualparadox.retrieval.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StringSimilarityTest {

    @Test
    @DisplayName("Levenshtein counts inserts, deletes and substitutions")
    void testLevenshtein() {
        assertThat(StringSimilarity.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(StringSimilarity.levenshtein("abc", "abc")).isZero();
        assertThat(StringSimilarity.levenshtein("", "abc")).isEqualTo(3);
        assertThat(StringSimilarity.levenshtein("abc", "")).isEqualTo(3);
    }

    @Test
    @DisplayName("Similarity is normalized by the longer string")
    void testSimilarity() {
        assertThat(StringSimilarity.similarity("xolo", "solo")).isCloseTo(0.75, within(1e-9));
        assertThat(StringSimilarity.similarity("colour", "color")).isCloseTo(5.0 / 6.0, within(1e-9));
        assertThat(StringSimilarity.similarity("abc", "")).isZero();
    }

    @Test
    @DisplayName("Two empty strings are identical")
    void testEmptyStrings() {
        assertThat(StringSimilarity.similarity("", "")).isEqualTo(1.0);
    }
}
