package eu.virtualparadox.retrieval.rag.fusion;

import eu.virtualparadox.retrieval.application.config.SearchConfig;
import eu.virtualparadox.retrieval.rag.fusion.model.FusedCandidate;
import eu.virtualparadox.retrieval.rag.fusion.model.MatchCandidate;
import eu.virtualparadox.retrieval.store.model.Chunk;
import eu.virtualparadox.retrieval.store.model.ChunkKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FusionSelectorTest {

    private final FusionSelector selector = new FusionSelector(new ScoreNormalizer(), new SearchConfig());

    private static MatchCandidate candidate(final String documentId, final double lexical, final Double semantic) {
        final Chunk chunk = new Chunk(documentId, 0, "content of " + documentId, new float[]{1f}, "owner");
        return new MatchCandidate(chunk, lexical, lexical > 0 ? List.of("term") : List.of(), semantic);
    }

    private static List<FusedCandidate> ranked(final double... scores) {
        final List<FusedCandidate> ranked = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            final MatchCandidate c = candidate(String.format("doc-%02d", i), 0.0, scores[i]);
            ranked.add(new FusedCandidate(c, 0.0, scores[i], scores[i]));
        }
        return ranked;
    }

    private static List<String> documentIds(final List<FusedCandidate> fused) {
        return fused.stream().map(FusedCandidate::key).map(ChunkKey::documentId).toList();
    }

    @Test
    @DisplayName("Vector-only weights rank by semantic score alone")
    void testVectorOnlyRanking() {
        final List<MatchCandidate> candidates = List.of(
                candidate("a", 9.0, 0.2),
                candidate("b", 0.0, 0.9),
                candidate("c", 3.0, 0.5),
                candidate("d", 5.0, null));

        final List<FusedCandidate> fused = selector.fuse(candidates, 0.0, 1.0);

        assertThat(documentIds(fused)).containsExactly("b", "c", "a");
        assertThat(fused.get(0).finalScore()).isCloseTo(0.9, within(1e-12));
        assertThat(fused.get(2).finalScore()).isCloseTo(0.2, within(1e-12));
    }

    @Test
    @DisplayName("Raising the keyword weight never lowers the rank of the strongest lexical match")
    void testKeywordWeightMonotonic() {
        final List<MatchCandidate> candidates = List.of(
                candidate("a", 3.0, 0.1),
                candidate("b", 1.0, 0.7),
                candidate("c", 2.0, 0.4));

        int previousRank = Integer.MAX_VALUE;
        for (int step = 1; step <= 10; step++) {
            final List<String> order = documentIds(selector.fuse(candidates, step / 10.0, 0.5));
            final int rank = order.indexOf("a");
            assertThat(rank).as("rank of a at keyword weight %.1f", step / 10.0).isLessThanOrEqualTo(previousRank);
            previousRank = rank;
        }
        assertThat(documentIds(selector.fuse(candidates, 0.1, 0.5)).get(0)).isEqualTo("b");
        assertThat(documentIds(selector.fuse(candidates, 1.0, 0.5)).get(0)).isEqualTo("a");
    }

    @Test
    @DisplayName("Clustered lexical scores without semantic signal rank by lexical score")
    void testLexicalOnlySignal() {
        final List<MatchCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            candidates.add(candidate(String.format("lex-%02d", i), 0.20 + i * 0.005, 0.0));
        }
        for (int i = 0; i < 5; i++) {
            candidates.add(candidate(String.format("none-%02d", i), 0.0, 0.0));
        }

        final List<FusedCandidate> fused = selector.fuse(candidates, 0.5, 0.5);

        assertThat(fused).hasSize(14);
        assertThat(fused.get(0).key().documentId()).isEqualTo("lex-14");
        assertThat(fused.get(0).lexicalScore()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("Lexical hits without a semantic score get a floor from the mean semantic score")
    void testSemanticFloor() {
        final List<MatchCandidate> candidates = List.of(
                candidate("a", 2.0, 0.8),
                candidate("b", 1.0, null),
                candidate("c", 0.0, 0.4));

        final List<FusedCandidate> fused = selector.fuse(candidates, 0.5, 0.5);

        final FusedCandidate b = fused.stream().filter(f -> f.key().documentId().equals("b")).findFirst().orElseThrow();
        assertThat(b.semanticScore()).isCloseTo(0.06, within(1e-9));
        assertThat(b.finalScore()).isCloseTo(0.03, within(1e-6));
        assertThat(documentIds(fused)).containsExactly("a", "c", "b");
    }

    @Test
    @DisplayName("No floor applies when keywords carry no weight")
    void testNoFloorForVectorOnly() {
        final List<MatchCandidate> candidates = List.of(
                candidate("a", 2.0, 0.8),
                candidate("b", 1.0, 0.0));

        assertThat(documentIds(selector.fuse(candidates, 0.0, 1.0))).containsExactly("a");
    }

    @Test
    @DisplayName("Equal scores are ordered by chunk key")
    void testTieBreak() {
        final List<MatchCandidate> candidates = List.of(
                candidate("b", 0.0, 0.5),
                candidate("a", 0.0, 0.5),
                candidate("c", 0.0, 0.5));

        assertThat(documentIds(selector.fuse(candidates, 0.5, 0.5))).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("Negative cosine similarities are dropped")
    void testNonPositiveDropped() {
        final List<MatchCandidate> candidates = List.of(
                candidate("a", 0.0, -0.3),
                candidate("b", 0.0, 0.1));

        assertThat(documentIds(selector.fuse(candidates, 0.5, 0.5))).containsExactly("b");
    }

    @Test
    @DisplayName("The ceiling wins over the mass target")
    void testCeilingWins() {
        final double[] scores = new double[20];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = 1.0 - i * 0.01;
        }

        assertThat(selector.select(ranked(scores), 1.0, 1, 8)).hasSize(8);
    }

    @Test
    @DisplayName("Selection stops once the mass target is reached")
    void testMassTarget() {
        final List<FusedCandidate> selected = selector.select(ranked(5, 4, 3, 2, 1), 0.5, 1, 8);

        // 5/15 < 0.5 <= 9/15
        assertThat(documentIds(selected)).containsExactly("doc-00", "doc-01");
    }

    @Test
    @DisplayName("The floor extends selection past the mass target")
    void testMinimumExtendsSelection() {
        final List<FusedCandidate> selected = selector.select(ranked(10, 1, 1, 1, 1, 1), 0.3, 3, 8);

        assertThat(selected).hasSize(3);
    }

    @Test
    @DisplayName("Fewer candidates than the floor are all returned")
    void testFewerThanMinimum() {
        assertThat(selector.select(ranked(0.4, 0.2), 0.3, 5, 8)).hasSize(2);
    }

    @Test
    @DisplayName("Selection keeps the ranked order and returns a prefix")
    void testPrefix() {
        final List<FusedCandidate> ranked = ranked(0.9, 0.7, 0.5, 0.3);

        final List<FusedCandidate> selected = selector.select(ranked, 0.8, 2, 8);

        assertThat(selected).isEqualTo(ranked.subList(0, selected.size()));
        assertThat(selected.stream().mapToDouble(FusedCandidate::finalScore).sum() / 2.4).isGreaterThanOrEqualTo(0.8);
    }

    @Test
    @DisplayName("Nothing is selected when there is no score mass")
    void testEmpty() {
        assertThat(selector.select(List.of(), 0.3, 2, 8)).isEmpty();
    }
}
