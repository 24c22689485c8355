package eu.virtualparadox.retrieval.rag.fusion.model;

import eu.virtualparadox.retrieval.store.model.ChunkKey;

/**
 * A candidate after fusion.
 *
 * @param candidate         the underlying match
 * @param lexicalScore      normalized lexical score in [0,1]
 * @param semanticScore     semantic score used in fusion, including the floor when it applied
 * @param finalScore        {@code lexicalScore * keywordWeight + semanticScore * vectorWeight}
 */
public record FusedCandidate(MatchCandidate candidate,
                             double lexicalScore,
                             double semanticScore,
                             double finalScore) {

    public ChunkKey key() {
        return candidate.key();
    }
}
