package eu.virtualparadox.retrieval.rag.lexical.model;

import java.util.List;

/**
 * @param score        BM25-family score, always positive
 * @param matchedTerms query terms that contributed, in query order
 */
public record LexicalMatch(double score, List<String> matchedTerms) {

    public LexicalMatch {
        matchedTerms = List.copyOf(matchedTerms);
    }
}
