package eu.virtualparadox.retrieval.rag.fusion.model;

import eu.virtualparadox.retrieval.store.model.Chunk;
import eu.virtualparadox.retrieval.store.model.ChunkKey;

import java.util.List;

/**
 * Per-query view of one chunk: its raw lexical score and its semantic score, either of which may be absent.
 *
 * @param chunk           the chunk
 * @param lexicalScoreRaw raw BM25 score, 0 when no query term matched
 * @param matchedTerms    query terms that matched the chunk lexically
 * @param semanticScore   boosted cosine score, {@code null} when semantic scoring did not run or skipped the chunk
 */
public record MatchCandidate(Chunk chunk,
                             double lexicalScoreRaw,
                             List<String> matchedTerms,
                             Double semanticScore) {

    public MatchCandidate {
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
    }

    public ChunkKey key() {
        return chunk.key();
    }

    /**
     * @return {@code true} if the semantic score is absent or exactly zero
     */
    public boolean hasNoSemanticScore() {
        return semanticScore == null || semanticScore == 0.0;
    }
}
