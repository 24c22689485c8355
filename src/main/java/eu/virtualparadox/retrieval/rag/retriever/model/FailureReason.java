package eu.virtualparadox.retrieval.rag.retriever.model;

/**
 * Why a search produced no ranking.
 */
public enum FailureReason {
    CHUNK_STORE_UNAVAILABLE,
    EMBEDDING_UNAVAILABLE,
    /** The provider answered with a vector of the wrong length or with non-finite values. */
    EMBEDDING_REJECTED,
    TIMEOUT,
    INTERRUPTED,
    /** A scoring task failed or the worker pool refused it. */
    SCORING_FAILED
}
