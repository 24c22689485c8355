package eu.virtualparadox.retrieval.store.service;

import eu.virtualparadox.retrieval.store.model.Chunk;
import eu.virtualparadox.retrieval.store.model.SearchScope;
import eu.virtualparadox.retrieval.util.FloatVectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.*;
import org.apache.lucene.util.BytesRef;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static eu.virtualparadox.retrieval.util.LuceneConstants.*;

/**
 * Reads chunk records from the Lucene index written by {@link LuceneChunkIndexService}.
 * <p>
 * Steps:
 * <ol>
 *   <li>Build a filter-only query on {@code ownerId} and, if given, the document allow-list</li>
 *   <li>Collect every matching document in one search on a single acquired searcher</li>
 *   <li>Convert stored fields into {@link Chunk} records, ordered by document and chunk index</li>
 * </ol>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class LuceneChunkStore implements ChunkStore {

    private final SearcherManager searcherManager;

    @Override
    public List<Chunk> listChunks(final SearchScope scope) throws IOException {
        final Query query = buildScopeQuery(scope);

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final int total = searcher.count(query);
            if (total == 0) {
                return List.of();
            }

            final TopDocs topDocs = searcher.search(query, total);
            final StoredFields storedFields = searcher.storedFields();

            final List<Chunk> chunks = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                chunks.add(toChunk(storedFields.document(sd.doc)));
            }
            chunks.sort(Comparator.comparing(Chunk::key));

            log.debug("Loaded {} chunks for owner {} (allow-list size {})",
                    chunks.size(), scope.ownerId(), scope.documentIdAllowList().size());
            return chunks;
        } finally {
            searcherManager.release(searcher);
        }
    }

    private Query buildScopeQuery(final SearchScope scope) {
        final BooleanQuery.Builder builder = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(FIELD_OWNER_ID, scope.ownerId())), BooleanClause.Occur.FILTER);

        if (scope.isDocumentScoped()) {
            final List<BytesRef> ids = scope.documentIdAllowList().stream()
                    .map(BytesRef::new)
                    .toList();
            builder.add(new TermInSetQuery(FIELD_DOC_ID, ids), BooleanClause.Occur.FILTER);
        }
        return builder.build();
    }

    private Chunk toChunk(final Document doc) {
        final IndexableField chunkIndex = doc.getField(FIELD_CHUNK_INDEX);
        final BytesRef embedding = doc.getBinaryValue(FIELD_EMBEDDING);

        return new Chunk(
                doc.get(FIELD_DOC_ID),
                chunkIndex == null ? 0 : chunkIndex.numericValue().intValue(),
                doc.get(FIELD_TEXT),
                embedding == null ? null : FloatVectors.fromBytes(embedding.bytes, embedding.offset, embedding.length),
                doc.get(FIELD_OWNER_ID));
    }
}
