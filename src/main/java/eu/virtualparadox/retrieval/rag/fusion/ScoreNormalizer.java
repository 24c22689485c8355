package eu.virtualparadox.retrieval.rag.fusion;

import eu.virtualparadox.retrieval.rag.fusion.model.LexicalNormalization;
import eu.virtualparadox.retrieval.rag.fusion.model.NormalizationMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Chooses how to rescale the unbounded lexical scores of one query into [0,1].
 * <p>
 * BM25 score distributions depend on how rare the query terms are, so the method is picked per query:
 * <ul>
 *   <li>fewer than two positive scores: identity</li>
 *   <li>coefficient of variation above 1, or range above three means: z-score clipped to [-3,3], then sigmoid</li>
 *   <li>otherwise: min-max</li>
 * </ul>
 */
@Component
@Slf4j
public class ScoreNormalizer {

    static final double MAX_COEFFICIENT_OF_VARIATION = 1.0;
    static final double MAX_RANGE_TO_MEAN = 3.0;

    /**
     * Fits a normalization to the given raw lexical scores. Non-positive values are ignored.
     */
    public LexicalNormalization fit(final Collection<Double> rawScores) {
        final double[] positive = rawScores.stream()
                .mapToDouble(Double::doubleValue)
                .filter(s -> s > 0.0)
                .toArray();

        if (positive.length < 2) {
            log.debug("Lexical normalization: identity ({} positive scores)", positive.length);
            return LexicalNormalization.identity();
        }

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        double sum = 0.0;
        for (final double s : positive) {
            min = Math.min(min, s);
            max = Math.max(max, s);
            sum += s;
        }
        final double mean = sum / positive.length;

        double squares = 0.0;
        for (final double s : positive) {
            squares += (s - mean) * (s - mean);
        }
        final double std = Math.sqrt(squares / positive.length);

        final double cv = std / (mean + LexicalNormalization.EPSILON);
        final NormalizationMethod method = cv > MAX_COEFFICIENT_OF_VARIATION || (max - min) > MAX_RANGE_TO_MEAN * mean
                ? NormalizationMethod.Z_SCORE_SIGMOID
                : NormalizationMethod.MIN_MAX;

        log.debug("Lexical normalization: {} (n={}, min={}, max={}, mean={}, std={}, cv={})",
                method, positive.length, min, max, mean, std, cv);
        return new LexicalNormalization(method, min, max, mean, std);
    }
}
