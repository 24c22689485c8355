package eu.virtualparadox.retrieval.rag.retriever.service;

import eu.virtualparadox.retrieval.rag.retriever.model.SearchOutcome;
import eu.virtualparadox.retrieval.rag.retriever.model.SearchParams;
import eu.virtualparadox.retrieval.store.model.SearchScope;

public interface RetrieverService {

    /**
     * Ranks the chunks in {@code scope} against {@code query}.
     *
     * @throws IllegalArgumentException if {@code scope} or {@code params} is missing
     */
    SearchOutcome search(final String query, final SearchScope scope, final SearchParams params);

}
