package eu.virtualparadox.retrieval.rag.text.model;

import java.util.List;

/**
 * A query as seen by the scorers.
 *
 * @param rawText          the caller's query text, unchanged; used for embedding and literal boosts
 * @param normalizedTokens lexical terms; a term may hold several words separated by single spaces (quoted phrase)
 */
public record SearchQuery(String rawText, List<String> normalizedTokens) {

    public SearchQuery {
        rawText = rawText == null ? "" : rawText;
        normalizedTokens = normalizedTokens == null ? List.of() : List.copyOf(normalizedTokens);
    }

    public boolean isEmpty() {
        return normalizedTokens.isEmpty();
    }
}
