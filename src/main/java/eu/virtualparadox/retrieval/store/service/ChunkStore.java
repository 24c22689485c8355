package eu.virtualparadox.retrieval.store.service;

import eu.virtualparadox.retrieval.store.model.Chunk;
import eu.virtualparadox.retrieval.store.model.SearchScope;

import java.io.IOException;
import java.util.List;

/**
 * Read side of the chunk storage.
 */
public interface ChunkStore {

    /**
     * Bulk-reads every chunk visible in the given scope in a single pass.
     *
     * @param scope owner plus optional document allow-list
     * @return chunks ordered by document id and chunk index, never null
     * @throws IOException if the underlying storage cannot be read
     */
    List<Chunk> listChunks(final SearchScope scope) throws IOException;
}
