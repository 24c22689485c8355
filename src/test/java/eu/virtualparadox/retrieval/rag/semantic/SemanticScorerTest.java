package eu.virtualparadox.retrieval.rag.semantic;

import eu.virtualparadox.retrieval.application.config.BoostConfig;
import eu.virtualparadox.retrieval.store.model.Chunk;
import eu.virtualparadox.retrieval.store.model.ChunkKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SemanticScorerTest {

    private static final float[] QUERY = {1f, 0f};

    private SemanticScorer scorer;

    @BeforeEach
    void setUp() {
        final BoostConfig config = new BoostConfig();
        config.setTerms(List.of(new BoostConfig.BoostTerm(List.of("xolo"), true)));
        scorer = new SemanticScorer(new LiteralBoost(config));
    }

    private static Chunk chunk(final String documentId, final String content, final float[] embedding) {
        return new Chunk(documentId, 0, content, embedding, "owner");
    }

    @Test
    @DisplayName("Cosine similarity of comparable vectors")
    void testCosine() {
        assertThat(SemanticScorer.cosine(new float[]{1f, 0f}, new float[]{2f, 0f})).isCloseTo(1.0, within(1e-9));
        assertThat(SemanticScorer.cosine(new float[]{1f, 0f}, new float[]{0f, 3f})).isCloseTo(0.0, within(1e-9));
        assertThat(SemanticScorer.cosine(new float[]{1f, 0f}, new float[]{-1f, 0f})).isCloseTo(-1.0, within(1e-9));
        assertThat(SemanticScorer.cosine(new float[]{1f, 0f}, new float[]{0.6f, 0.8f})).isCloseTo(0.6, within(1e-6));
    }

    @Test
    @DisplayName("Vectors that cannot be compared have no cosine")
    void testIncomparableVectors() {
        assertThat(SemanticScorer.cosine(new float[]{1f, 0f}, new float[]{1f, 0f, 0f})).isNull();
        assertThat(SemanticScorer.cosine(new float[]{1f, 0f}, new float[]{0f, 0f})).isNull();
        assertThat(SemanticScorer.cosine(new float[]{1f, 0f}, null)).isNull();
        assertThat(SemanticScorer.cosine(new float[]{1f, 0f}, new float[]{Float.NaN, 1f})).isNull();
    }

    @Test
    @DisplayName("Chunks with unusable embeddings are skipped, the others are scored")
    void testUnusableEmbeddingsSkipped() {
        final Chunk good = chunk("a", "menu", new float[]{0.6f, 0.8f});
        final Chunk wrongDimension = chunk("b", "menu", new float[]{1f, 0f, 0f});
        final Chunk missing = chunk("c", "menu", null);

        final Map<ChunkKey, Double> scores = scorer.score("menu", QUERY, List.of(good, wrongDimension, missing));

        assertThat(scores).containsOnlyKeys(good.key());
        assertThat(scores.get(good.key())).isCloseTo(0.6, within(1e-6));
    }

    @Test
    @DisplayName("Literal boosts are added to the cosine and capped at 1.0")
    void testBoostCapped() {
        final Chunk strong = chunk("a", "XOLO menu", new float[]{0.6f, 0.8f});
        final Chunk weak = chunk("b", "about xolo", new float[]{0.1f, 1f});
        final Chunk plain = chunk("c", "drinks", new float[]{0.6f, 0.8f});

        final Map<ChunkKey, Double> scores = scorer.score("xolo", QUERY, List.of(strong, weak, plain));

        assertThat(scores.get(strong.key())).isEqualTo(1.0);
        final double weakCosine = 0.1 / Math.sqrt(0.01 + 1.0);
        assertThat(scores.get(weak.key())).isCloseTo(weakCosine + 0.8, within(1e-6));
        assertThat(scores.get(plain.key())).isCloseTo(0.6, within(1e-6));
    }

    @Test
    @DisplayName("Boosts apply only when the query mentions the literal")
    void testNoBoostWithoutQueryLiteral() {
        final Chunk chunk = chunk("a", "XOLO menu", new float[]{0.6f, 0.8f});

        assertThat(scorer.score("menu", QUERY, List.of(chunk)).get(chunk.key())).isCloseTo(0.6, within(1e-6));
    }
}
