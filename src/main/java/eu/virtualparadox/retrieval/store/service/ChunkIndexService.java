package eu.virtualparadox.retrieval.store.service;

import eu.virtualparadox.retrieval.store.model.Chunk;

import java.io.IOException;
import java.util.List;

/**
 * Write side of the chunk storage, used by the ingestion pipeline.
 * <p>
 * Notes:
 * <ul>
 *   <li>All embeddings supplied to {@link #upsert(String, List)} MUST have the same dimension.</li>
 *   <li>Dimension must remain consistent across the entire index lifetime.</li>
 * </ul>
 */
public interface ChunkIndexService {

    /**
     * Adds or replaces the stored chunks of a document.
     * <p>
     * Implementations treat this as a transactional unit: delete existing chunks for
     * {@code documentId}, insert the new ones, and make the change visible to readers.
     *
     * @param documentId the parent document identifier (non-null, non-blank)
     * @param chunks     chunks of that document (non-null, non-empty)
     * @throws IOException              if writing to the underlying index fails
     * @throws IllegalArgumentException if chunks are inconsistent (foreign document, duplicate
     *                                  index, blank content, mixed owners or dimensions)
     */
    void upsert(final String documentId, final List<Chunk> chunks) throws IOException;

    /**
     * Removes all stored chunks belonging to the specified document.
     *
     * @param documentId the parent document identifier (non-null, non-blank)
     * @throws IOException if the underlying index update fails
     */
    void deleteByDocumentId(final String documentId) throws IOException;
}
