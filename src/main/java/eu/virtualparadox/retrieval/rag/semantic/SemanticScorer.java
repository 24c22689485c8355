package eu.virtualparadox.retrieval.rag.semantic;

import eu.virtualparadox.retrieval.store.model.Chunk;
import eu.virtualparadox.retrieval.store.model.ChunkKey;
import eu.virtualparadox.retrieval.util.FloatVectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cosine similarity between the query embedding and each candidate's stored embedding, plus the
 * literal boost for curated terms shared by query and chunk (capped at 1.0).
 * <p>
 * Chunks whose embedding is missing, non-finite, zero or of a different dimension than the query
 * are skipped and therefore absent from the result. No per-document deduplication happens here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SemanticScorer {

    private final LiteralBoost literalBoost;

    /**
     * @param rawQuery       query text, used only for literal boosts
     * @param queryEmbedding query vector
     * @param candidates     chunks in scope
     * @return semantic score per chunk, in candidate order
     */
    public Map<ChunkKey, Double> score(final String rawQuery,
                                      final float[] queryEmbedding,
                                      final List<Chunk> candidates) {
        final List<LiteralBoost.ActiveTerm> activeTerms = literalBoost.activeTerms(rawQuery);

        final Map<ChunkKey, Double> scores = new LinkedHashMap<>();
        int skipped = 0;
        for (final Chunk chunk : candidates) {
            final Double cosine = cosine(queryEmbedding, chunk.embedding());
            if (cosine == null) {
                skipped++;
                log.debug("Skipping semantic scoring of {}: unusable embedding", chunk.key().asString());
                continue;
            }

            final double boost = literalBoost.boostFor(activeTerms, chunk.content());
            final double score = boost > 0.0 ? Math.min(1.0, cosine + boost) : cosine;
            if (boost > 0.0) {
                log.debug("Literal boost for {}: {} -> {}", chunk.key().asString(), cosine, score);
            }
            scores.put(chunk.key(), score);
        }

        if (skipped > 0) {
            log.warn("{} of {} chunks had unusable embeddings and got no semantic score", skipped, candidates.size());
        }
        return scores;
    }

    /**
     * @return cosine similarity, or {@code null} when the pair cannot be compared
     */
    static Double cosine(final float[] a, final float[] b) {
        if (!FloatVectors.isWellFormed(a) || !FloatVectors.isWellFormed(b) || a.length != b.length) {
            return null;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return null;
        }
        final double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}
