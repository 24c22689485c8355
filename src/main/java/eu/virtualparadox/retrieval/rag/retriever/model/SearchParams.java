package eu.virtualparadox.retrieval.rag.retriever.model;

import lombok.Builder;

/**
 * Per-call fusion and selection parameters. Invalid combinations are rejected on construction.
 * <p>
 * Keyword-only and vector-only search are the {@code vectorWeight = 0} and {@code keywordWeight = 0}
 * cases of the same weighted fusion.
 *
 * @param keywordWeight weight of the normalized lexical score, in [0,1]
 * @param vectorWeight  weight of the semantic score, in [0,1]
 * @param massFraction  share of the total fused score the selected prefix must reach, in (0,1]
 * @param minChunks     result floor (may push past the mass target), {@code null} for the scope default
 * @param maxChunks     hard result ceiling, at least 1
 */
@Builder(toBuilder = true)
public record SearchParams(double keywordWeight,
                           double vectorWeight,
                           double massFraction,
                           Integer minChunks,
                           int maxChunks) {

    public static final double DEFAULT_KEYWORD_WEIGHT = 0.5;
    public static final double DEFAULT_VECTOR_WEIGHT = 0.5;
    public static final double DEFAULT_MASS_FRACTION = 0.3;
    public static final int DEFAULT_MAX_CHUNKS = 8;

    public SearchParams {
        requireUnitInterval(keywordWeight, "keywordWeight");
        requireUnitInterval(vectorWeight, "vectorWeight");
        if (keywordWeight == 0.0 && vectorWeight == 0.0) {
            throw new IllegalArgumentException("keywordWeight and vectorWeight must not both be 0");
        }
        if (!(massFraction > 0.0 && massFraction <= 1.0)) {
            throw new IllegalArgumentException("massFraction must be in (0,1], got " + massFraction);
        }
        if (maxChunks < 1) {
            throw new IllegalArgumentException("maxChunks must be >= 1, got " + maxChunks);
        }
        if (minChunks != null && (minChunks < 1 || minChunks > maxChunks)) {
            throw new IllegalArgumentException(
                    "minChunks must be in [1, maxChunks=" + maxChunks + "], got " + minChunks);
        }
    }

    /**
     * Built-in defaults: equal weights, 30% mass target, scope-dependent floor, at most 8 chunks.
     */
    public static SearchParams defaults() {
        return new SearchParams(DEFAULT_KEYWORD_WEIGHT, DEFAULT_VECTOR_WEIGHT, DEFAULT_MASS_FRACTION, null, DEFAULT_MAX_CHUNKS);
    }

    private static void requireUnitInterval(final double value, final String name) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0,1], got " + value);
        }
    }
}
