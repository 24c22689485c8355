package eu.virtualparadox.retrieval.store.model;

/**
 * Immutable chunk record as read from the chunk store.
 * <p>Produced by ingestion (outside this module) and only read here. The embedding may be
 * {@code null} or malformed for legacy rows; semantic scoring skips such chunks.</p>
 *
 * @param documentId parent document identifier
 * @param chunkIndex position of the chunk inside its document, unique per document
 * @param content    chunk text, never blank
 * @param embedding  dense vector produced by the embedding provider at ingestion time
 * @param ownerId    owner the chunk is visible to
 */
public record Chunk(String documentId, int chunkIndex, String content, float[] embedding, String ownerId) {

    public ChunkKey key() {
        return new ChunkKey(documentId, chunkIndex);
    }
}
