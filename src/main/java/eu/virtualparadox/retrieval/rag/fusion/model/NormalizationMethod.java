package eu.virtualparadox.retrieval.rag.fusion.model;

public enum NormalizationMethod {
    /** Fewer than two scores: nothing to compare against, raw scores pass through. */
    IDENTITY,
    /** Tightly clustered scores. */
    MIN_MAX,
    /** Heavy-tailed scores: clipped z-score squashed by a sigmoid. */
    Z_SCORE_SIGMOID
}
