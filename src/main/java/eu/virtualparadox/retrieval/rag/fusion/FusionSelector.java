package eu.virtualparadox.retrieval.rag.fusion;

import eu.virtualparadox.retrieval.application.config.SearchConfig;
import eu.virtualparadox.retrieval.rag.fusion.model.FusedCandidate;
import eu.virtualparadox.retrieval.rag.fusion.model.LexicalNormalization;
import eu.virtualparadox.retrieval.rag.fusion.model.MatchCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fuses lexical and semantic scores into one ranking and cuts it by cumulative score mass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FusionSelector {

    static final Comparator<FusedCandidate> RANKING = Comparator
            .comparingDouble(FusedCandidate::finalScore).reversed()
            .thenComparing(FusedCandidate::key);

    private final ScoreNormalizer scoreNormalizer;
    private final SearchConfig searchConfig;

    /**
     * Computes the final score of every candidate.
     * <ol>
     *   <li>Normalizes the raw lexical scores with a method fitted to this query</li>
     *   <li>When keywords carry weight, gives lexically matching chunks without a semantic score a floor
     *       proportional to the mean positive semantic score of the others</li>
     *   <li>Combines the two with the given weights</li>
     *   <li>Drops candidates whose final score is not positive and sorts the rest descending,
     *       breaking ties by chunk key</li>
     * </ol>
     *
     * @param candidates    all candidates of the query
     * @param keywordWeight weight of the lexical signal
     * @param vectorWeight  weight of the semantic signal
     * @return ranked candidates with a positive final score
     */
    public List<FusedCandidate> fuse(final List<MatchCandidate> candidates,
                                     final double keywordWeight,
                                     final double vectorWeight) {
        final LexicalNormalization normalization = scoreNormalizer.fit(
                candidates.stream().map(MatchCandidate::lexicalScoreRaw).toList());

        final double semanticFloor = keywordWeight > 0.0 ? semanticFloor(candidates) : 0.0;

        final List<FusedCandidate> fused = new ArrayList<>();
        for (final MatchCandidate c : candidates) {
            final double lexical = normalization.apply(c.lexicalScoreRaw());

            double semantic = c.semanticScore() == null ? 0.0 : c.semanticScore();
            if (semanticFloor > 0.0 && c.lexicalScoreRaw() > 0.0 && c.hasNoSemanticScore()) {
                semantic = semanticFloor;
            }

            final double finalScore = lexical * keywordWeight + semantic * vectorWeight;
            if (finalScore > 0.0) {
                fused.add(new FusedCandidate(c, lexical, semantic, finalScore));
            }
        }

        fused.sort(RANKING);
        return fused;
    }

    /**
     * Takes ranked candidates from the top until the accumulated share of total score reaches
     * {@code massFraction} and at least {@code minChunks} are taken, never exceeding {@code maxChunks}.
     *
     * @param ranked       candidates sorted by {@link #fuse}
     * @param massFraction share of total score to cover, in (0,1]
     * @param minChunks    floor on the result size, unless fewer candidates exist
     * @param maxChunks    ceiling on the result size
     * @return prefix of {@code ranked}
     */
    public List<FusedCandidate> select(final List<FusedCandidate> ranked,
                                       final double massFraction,
                                       final int minChunks,
                                       final int maxChunks) {
        final double total = ranked.stream().mapToDouble(FusedCandidate::finalScore).sum();
        if (total <= 0.0) {
            return List.of();
        }

        final List<FusedCandidate> selected = new ArrayList<>();
        double accumulated = 0.0;
        for (final FusedCandidate c : ranked) {
            if (selected.size() >= maxChunks) {
                log.debug("Mass selection stopped at max chunks ({})", maxChunks);
                break;
            }
            selected.add(c);
            accumulated += c.finalScore();
            if (accumulated / total >= massFraction && selected.size() >= minChunks) {
                log.debug("Mass selection reached {} of total with {} chunks",
                        String.format("%.3f", accumulated / total), selected.size());
                break;
            }
        }
        return List.copyOf(selected);
    }

    /**
     * @return {@code semanticFloorRatio} times the mean of the positive semantic scores, or 0 if there are none
     */
    private double semanticFloor(final List<MatchCandidate> candidates) {
        final double[] positive = candidates.stream()
                .map(MatchCandidate::semanticScore)
                .filter(s -> s != null && s > 0.0)
                .mapToDouble(Double::doubleValue)
                .toArray();
        if (positive.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (final double s : positive) {
            sum += s;
        }
        return searchConfig.getSemanticFloorRatio() * (sum / positive.length);
    }
}
