package eu.virtualparadox.retrieval.store.model;

import java.util.Comparator;

/**
 * Identity of a chunk across scorers: document id plus chunk index.
 */
public record ChunkKey(String documentId, int chunkIndex) implements Comparable<ChunkKey> {

    private static final Comparator<ChunkKey> ORDER = Comparator
            .comparing(ChunkKey::documentId)
            .thenComparingInt(ChunkKey::chunkIndex);

    @Override
    public int compareTo(final ChunkKey other) {
        return ORDER.compare(this, other);
    }

    public String asString() {
        return documentId + "#" + chunkIndex;
    }
}
