package eu.virtualparadox.retrieval.application.config;

import eu.virtualparadox.retrieval.rag.retriever.model.SearchParams;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Defaults and limits of the hybrid search. Per-call {@link SearchParams} override the fusion
 * and selection values; everything else is fixed per deployment.
 */
@Configuration
@ConfigurationProperties(prefix = "retrieval.search")
@Getter @Setter
public class SearchConfig {

    private double keywordWeight = SearchParams.DEFAULT_KEYWORD_WEIGHT;
    private double vectorWeight = SearchParams.DEFAULT_VECTOR_WEIGHT;
    private double massFraction = SearchParams.DEFAULT_MASS_FRACTION;
    private int maxChunks = SearchParams.DEFAULT_MAX_CHUNKS;

    /** Minimum result count when the caller restricted the search to specific documents. */
    private int scopedMinChunks = 5;

    /** Minimum result count for owner-wide searches. */
    private int unscopedMinChunks = 2;

    /** Whole-query budget; a query exceeding it returns no results. */
    private Duration queryTimeout = Duration.ofSeconds(30);

    /** Budget for the embedding provider call. */
    private Duration embeddingTimeout = Duration.ofSeconds(10);

    /** Required query embedding length, 0 accepts whatever the provider returns. */
    private int expectedDimension = 0;

    /** BM25 term-frequency saturation. */
    private double bm25K1 = 1.2;

    /** BM25 document-length normalization. */
    private double bm25B = 0.75;

    /**
     * Share of the mean positive semantic score granted to lexical hits whose semantic score is zero.
     */
    private double semanticFloorRatio = 0.1;

    public SearchParams defaultParams() {
        return SearchParams.builder()
                .keywordWeight(keywordWeight)
                .vectorWeight(vectorWeight)
                .massFraction(massFraction)
                .maxChunks(maxChunks)
                .build();
    }

    /**
     * Resolves the effective result floor for a call. An explicit value wins; otherwise the scope-dependent
     * default applies, lowered to the ceiling if needed.
     */
    public int resolveMinChunks(final SearchParams params, final boolean documentScoped) {
        if (params.minChunks() != null) {
            return params.minChunks();
        }
        final int fallback = documentScoped ? scopedMinChunks : unscopedMinChunks;
        return Math.min(fallback, params.maxChunks());
    }
}
