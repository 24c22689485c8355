package eu.virtualparadox.retrieval.rag.embed;

/**
 * Computes dense vector embeddings for query text.
 * <p>Must be the same model (and dimension) that embedded the stored chunks.</p>
 */
public interface EmbeddingService {

    /**
     * Embeds a single query string into dense vector space.
     *
     * @param text the query string (non-null, non-blank)
     * @return a dense vector representation of the query
     * @throws IllegalStateException if the provider cannot produce an embedding
     */
    float[] embedQuery(final String text);
}
