package eu.virtualparadox.retrieval.rag.retriever.model;

import java.util.List;

/**
 * One selected chunk.
 *
 * @param documentId    parent document identifier
 * @param chunkIndex    position of the chunk within its document
 * @param content       chunk text, for prompt assembly and citation
 * @param finalScore    fused score the ranking is ordered by
 * @param lexicalScore  normalized lexical score in [0,1]
 * @param semanticScore semantic score that entered fusion (cosine plus literal boost, or the floor)
 * @param matchedTerms  query terms that matched the chunk lexically
 */
public record RankedResult(String documentId,
                           int chunkIndex,
                           String content,
                           double finalScore,
                           double lexicalScore,
                           double semanticScore,
                           List<String> matchedTerms) {

    public RankedResult {
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
    }
}
