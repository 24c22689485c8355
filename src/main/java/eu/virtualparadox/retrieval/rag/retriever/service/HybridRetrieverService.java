package eu.virtualparadox.retrieval.rag.retriever.service;

import eu.virtualparadox.retrieval.application.config.SearchConfig;
import eu.virtualparadox.retrieval.application.executor.RetrievalExecutor;
import eu.virtualparadox.retrieval.rag.embed.EmbeddingService;
import eu.virtualparadox.retrieval.rag.fusion.FusionSelector;
import eu.virtualparadox.retrieval.rag.fusion.model.FusedCandidate;
import eu.virtualparadox.retrieval.rag.fusion.model.MatchCandidate;
import eu.virtualparadox.retrieval.rag.lexical.Bm25Scorer;
import eu.virtualparadox.retrieval.rag.lexical.model.LexicalMatch;
import eu.virtualparadox.retrieval.rag.retriever.model.FailureReason;
import eu.virtualparadox.retrieval.rag.retriever.model.RankedResult;
import eu.virtualparadox.retrieval.rag.retriever.model.SearchOutcome;
import eu.virtualparadox.retrieval.rag.retriever.model.SearchParams;
import eu.virtualparadox.retrieval.rag.semantic.SemanticScorer;
import eu.virtualparadox.retrieval.rag.text.QueryAnalyzer;
import eu.virtualparadox.retrieval.rag.text.model.SearchQuery;
import eu.virtualparadox.retrieval.store.model.Chunk;
import eu.virtualparadox.retrieval.store.model.ChunkKey;
import eu.virtualparadox.retrieval.store.model.SearchScope;
import eu.virtualparadox.retrieval.store.service.ChunkStore;
import eu.virtualparadox.retrieval.util.FloatVectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Hybrid retriever: combines fuzzy BM25 keyword scoring with embedding similarity over the chunks of one scope.
 * <p>
 * Steps:
 * <ol>
 *   <li>Analyze the query into lexical terms (Thai segmentation, quoted phrases, stop words)</li>
 *   <li>Fetch every chunk in scope with a single chunk store read</li>
 *   <li>Score lexically on the {@link RetrievalExecutor} while the query is embedded and scored semantically</li>
 *   <li>Normalize the lexical scores, fuse both signals and cut the ranking by score mass</li>
 * </ol>
 * Upstream failures and timeouts produce a failed {@link SearchOutcome} without results, never a partial ranking.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class HybridRetrieverService implements RetrieverService {

    private final QueryAnalyzer queryAnalyzer;
    private final ChunkStore chunkStore;
    private final Bm25Scorer bm25Scorer;
    private final EmbeddingService embeddingService;
    private final SemanticScorer semanticScorer;
    private final FusionSelector fusionSelector;
    private final RetrievalExecutor executor;
    private final SearchConfig config;

    @Override
    public SearchOutcome search(final String query, final SearchScope scope, final SearchParams params) {
        if (scope == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
        if (params == null) {
            throw new IllegalArgumentException("params must not be null");
        }
        if (StringUtils.isBlank(query)) {
            return SearchOutcome.empty();
        }

        final long deadline = System.nanoTime() + config.getQueryTimeout().toNanos();
        try {
            return SearchOutcome.success(run(query, scope, params, deadline));
        } catch (final SearchAbortedException e) {
            log.error("Search aborted ({}) for owner {}: {}", e.reason, scope.ownerId(), e.getMessage(), e.getCause());
            return SearchOutcome.failed(e.reason, e.getMessage());
        }
    }

    private List<RankedResult> run(final String query,
                                   final SearchScope scope,
                                   final SearchParams params,
                                   final long deadline) throws SearchAbortedException {
        final SearchQuery searchQuery = queryAnalyzer.analyze(query);
        log.debug("Query terms: {}", searchQuery.normalizedTokens());

        final List<Chunk> chunks = loadChunks(scope);
        if (chunks.isEmpty()) {
            log.debug("No chunks in scope for owner {}", scope.ownerId());
            return List.of();
        }

        final CompletableFuture<Map<ChunkKey, LexicalMatch>> lexicalFuture = submit(
                () -> bm25Scorer.score(searchQuery.normalizedTokens(), chunks), "Lexical scoring");

        final Map<ChunkKey, Double> semanticScores;
        final Map<ChunkKey, LexicalMatch> lexicalScores;
        try {
            semanticScores = params.vectorWeight() > 0.0
                    ? semanticScores(searchQuery.rawText(), chunks, deadline)
                    : Map.of();
            lexicalScores = await(lexicalFuture, deadline);
        } catch (final SearchAbortedException e) {
            lexicalFuture.cancel(true);
            throw e;
        }

        final List<MatchCandidate> candidates = new ArrayList<>();
        for (final Chunk chunk : chunks) {
            final LexicalMatch lexical = lexicalScores.get(chunk.key());
            final Double semantic = semanticScores.get(chunk.key());
            if (lexical == null && semantic == null) {
                continue;
            }
            candidates.add(new MatchCandidate(
                    chunk,
                    lexical == null ? 0.0 : lexical.score(),
                    lexical == null ? List.of() : lexical.matchedTerms(),
                    semantic));
        }

        final List<FusedCandidate> ranked = fusionSelector.fuse(candidates, params.keywordWeight(), params.vectorWeight());
        final int minChunks = config.resolveMinChunks(params, scope.isDocumentScoped());
        final List<FusedCandidate> selected = fusionSelector.select(ranked, params.massFraction(), minChunks, params.maxChunks());

        printDebug(chunks.size(), ranked, selected);

        return selected.stream().map(HybridRetrieverService::toRankedResult).toList();
    }

    private List<Chunk> loadChunks(final SearchScope scope) throws SearchAbortedException {
        try {
            return chunkStore.listChunks(scope);
        } catch (final IOException | RuntimeException e) {
            throw new SearchAbortedException(FailureReason.CHUNK_STORE_UNAVAILABLE,
                    "Chunk store read failed: " + e.getMessage(), e);
        }
    }

    /**
     * Embeds the query within the embedding budget and scores every chunk against it.
     */
    private Map<ChunkKey, Double> semanticScores(final String rawQuery,
                                                 final List<Chunk> chunks,
                                                 final long deadline) throws SearchAbortedException {
        final CompletableFuture<float[]> embeddingFuture = submit(
                () -> embeddingService.embedQuery(rawQuery), "Query embedding");

        final long remaining = deadline - System.nanoTime();
        final long embeddingBudget = config.getEmbeddingTimeout().toNanos();
        final float[] queryEmbedding;
        try {
            queryEmbedding = embeddingFuture.get(Math.max(0L, Math.min(remaining, embeddingBudget)), TimeUnit.NANOSECONDS);
        } catch (final TimeoutException e) {
            embeddingFuture.cancel(true);
            if (embeddingBudget < remaining) {
                throw new SearchAbortedException(FailureReason.EMBEDDING_UNAVAILABLE,
                        "Embedding provider did not answer within " + config.getEmbeddingTimeout(), e);
            }
            throw new SearchAbortedException(FailureReason.TIMEOUT,
                    "Query exceeded " + config.getQueryTimeout(), e);
        } catch (final ExecutionException e) {
            throw new SearchAbortedException(FailureReason.EMBEDDING_UNAVAILABLE,
                    "Embedding provider failed: " + e.getCause().getMessage(), e.getCause());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            embeddingFuture.cancel(true);
            throw new SearchAbortedException(FailureReason.INTERRUPTED, "Interrupted while embedding the query", e);
        }

        validate(queryEmbedding);
        return semanticScorer.score(rawQuery, queryEmbedding, chunks);
    }

    private void validate(final float[] queryEmbedding) throws SearchAbortedException {
        if (!FloatVectors.isWellFormed(queryEmbedding)) {
            throw new SearchAbortedException(FailureReason.EMBEDDING_REJECTED,
                    "Query embedding is empty or contains non-finite values", null);
        }
        final int expected = config.getExpectedDimension();
        if (expected > 0 && queryEmbedding.length != expected) {
            throw new SearchAbortedException(FailureReason.EMBEDDING_REJECTED,
                    "Query embedding has dimension " + queryEmbedding.length + ", expected " + expected, null);
        }
    }

    private <T> T await(final CompletableFuture<T> future, final long deadline) throws SearchAbortedException {
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (final TimeoutException e) {
            throw new SearchAbortedException(FailureReason.TIMEOUT, "Query exceeded " + config.getQueryTimeout(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchAbortedException(FailureReason.INTERRUPTED, "Interrupted while scoring", e);
        } catch (final ExecutionException e) {
            throw new SearchAbortedException(FailureReason.SCORING_FAILED,
                    "Lexical scoring failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private <T> CompletableFuture<T> submit(final Supplier<T> task, final String name) throws SearchAbortedException {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (final RejectedExecutionException e) {
            throw new SearchAbortedException(FailureReason.SCORING_FAILED, name + " rejected by the worker pool", e);
        }
    }

    private static RankedResult toRankedResult(final FusedCandidate fused) {
        final Chunk chunk = fused.candidate().chunk();
        return new RankedResult(
                chunk.documentId(),
                chunk.chunkIndex(),
                chunk.content(),
                fused.finalScore(),
                fused.lexicalScore(),
                fused.semanticScore(),
                fused.candidate().matchedTerms());
    }

    private void printDebug(final int inScope, final List<FusedCandidate> ranked, final List<FusedCandidate> selected) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("Fusion: {} chunks in scope, {} with positive score, {} selected", inScope, ranked.size(), selected.size());
        for (final FusedCandidate c : selected) {
            log.debug("  {} final={} lexical={} (raw {}) semantic={} terms={}",
                    c.key().asString(),
                    String.format("%.4f", c.finalScore()),
                    String.format("%.4f", c.lexicalScore()),
                    String.format("%.4f", c.candidate().lexicalScoreRaw()),
                    String.format("%.4f", c.semanticScore()),
                    c.candidate().matchedTerms());
        }
    }

    /**
     * Ends a search early with a failure reason.
     */
    private static final class SearchAbortedException extends Exception {

        private final FailureReason reason;

        SearchAbortedException(final FailureReason reason, final String message, final Throwable cause) {
            super(message, cause);
            this.reason = reason;
        }
    }
}
