package eu.virtualparadox.retrieval.rag.lexical.model;

import eu.virtualparadox.retrieval.store.model.Chunk;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A candidate chunk with its tokens and per-token counts, computed once per query.
 */
public record TokenizedChunk(Chunk chunk, List<String> tokens, Map<String, Integer> counts) {

    public static TokenizedChunk of(final Chunk chunk, final List<String> tokens) {
        final Map<String, Integer> counts = new HashMap<>();
        for (final String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return new TokenizedChunk(chunk, List.copyOf(tokens), Map.copyOf(counts));
    }

    public int length() {
        return tokens.size();
    }
}
