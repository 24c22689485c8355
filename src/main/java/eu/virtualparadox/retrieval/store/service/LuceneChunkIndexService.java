package eu.virtualparadox.retrieval.store.service;

import eu.virtualparadox.retrieval.store.model.Chunk;
import eu.virtualparadox.retrieval.util.FloatVectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.*;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.SearcherManager;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static eu.virtualparadox.retrieval.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link ChunkIndexService}.
 * <p>
 * Each chunk is stored as one Lucene {@link Document}:
 * <ul>
 *   <li>{@code ownerId}, {@code docId} – {@link StringField}: exact-match scoping and deletion</li>
 *   <li>{@code chunkIndex} – {@link StoredField}: position inside the document</li>
 *   <li>{@code text} – {@link StoredField}: the chunk content, stored only (scoring tokenizes it in memory)</li>
 *   <li>{@code embedding} – {@link StoredField} (binary): the dense vector, read back in bulk at query time</li>
 * </ul>
 *
 * <p><b>Vector dimensions:</b> the first-seen dimension is cached and later writes are validated against it.
 * Changing the embedding model requires a fresh index directory.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class LuceneChunkIndexService implements ChunkIndexService {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    private Integer vectorDim;

    @Override
    public synchronized void upsert(final String documentId, final List<Chunk> chunks) throws IOException {
        requireNonNullOrEmpty(documentId, "documentId");
        requireNonNullOrEmpty(chunks, "chunks");
        validate(documentId, chunks);

        // 1) delete previous chunks for this doc
        writer.deleteDocuments(new Term(FIELD_DOC_ID, documentId));

        // 2) add new chunks
        for (final Chunk chunk : chunks) {
            writer.addDocument(buildLuceneDocument(chunk));
        }

        // 3) commit and refresh for NRT visibility
        writer.commit();
        searcherManager.maybeRefreshBlocking();
        log.info("Stored {} chunks for document {}", chunks.size(), documentId);
    }

    @Override
    public synchronized void deleteByDocumentId(final String documentId) throws IOException {
        requireNonNullOrEmpty(documentId, "documentId");
        writer.deleteDocuments(new Term(FIELD_DOC_ID, documentId));
        writer.commit();
        searcherManager.maybeRefreshBlocking();
        log.info("Deleted chunks of document {}", documentId);
    }

    private void validate(final String documentId, final List<Chunk> chunks) {
        final String ownerId = chunks.get(0).ownerId();
        requireNonNullOrEmpty(ownerId, "ownerId");

        final int dim = chunks.get(0).embedding() == null ? 0 : chunks.get(0).embedding().length;
        final Set<Integer> seenIndexes = new HashSet<>();
        for (final Chunk chunk : chunks) {
            if (!documentId.equals(chunk.documentId())) {
                throw new IllegalArgumentException("Chunk " + chunk.key().asString() + " does not belong to " + documentId);
            }
            if (!ownerId.equals(chunk.ownerId())) {
                throw new IllegalArgumentException("All chunks of a document must share one owner");
            }
            if (!seenIndexes.add(chunk.chunkIndex())) {
                throw new IllegalArgumentException("Duplicate chunkIndex " + chunk.chunkIndex() + " in " + documentId);
            }
            requireNonNullOrEmpty(chunk.content(), "content");
            if (!FloatVectors.isWellFormed(chunk.embedding())) {
                throw new IllegalArgumentException("Chunk " + chunk.key().asString() + " has no usable embedding");
            }
            if (chunk.embedding().length != dim) {
                throw new IllegalArgumentException("All embeddings must be of length " + dim);
            }
        }
        ensureConsistentDimension(dim);
    }

    /**
     * Ensures an internal, stable notion of the vector dimension.
     *
     * @param dim proposed dimension
     * @throws IllegalArgumentException if a different dimension has already been established
     */
    private void ensureConsistentDimension(final int dim) {
        if (vectorDim == null) {
            vectorDim = dim;
        } else if (!vectorDim.equals(dim)) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch. Existing=" + vectorDim + ", new=" + dim +
                            " (reindex into a fresh index if you changed the embedder)");
        }
    }

    private Document buildLuceneDocument(final Chunk chunk) {
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_OWNER_ID, chunk.ownerId(), Field.Store.YES));
        d.add(new StringField(FIELD_DOC_ID, chunk.documentId(), Field.Store.YES));
        d.add(new StoredField(FIELD_CHUNK_INDEX, chunk.chunkIndex()));

        // Text content, stored only
        d.add(new StoredField(FIELD_TEXT, chunk.content()));

        // Vector, stored only; scoring reads it back per candidate
        d.add(new StoredField(FIELD_EMBEDDING, FloatVectors.toBytes(chunk.embedding())));

        return d;
    }

    private void requireNonNullOrEmpty(final Object value, final String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }

        if (value instanceof String s && s.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }

        if (value instanceof List<?> list && list.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
