package eu.virtualparadox.retrieval.rag.fusion.model;

/**
 * A normalization fitted to the positive lexical scores of one query.
 *
 * @param method chosen method
 * @param min    smallest positive score
 * @param max    largest positive score
 * @param mean   mean of the positive scores
 * @param std    population standard deviation of the positive scores
 */
public record LexicalNormalization(NormalizationMethod method, double min, double max, double mean, double std) {

    public static final double EPSILON = 1e-8;
    public static final double Z_CLIP = 3.0;

    public static LexicalNormalization identity() {
        return new LexicalNormalization(NormalizationMethod.IDENTITY, 0, 0, 0, 0);
    }

    /**
     * Maps a raw lexical score into the fused scale. Non-positive input maps to 0.
     */
    public double apply(final double raw) {
        if (!(raw > 0.0)) {
            return 0.0;
        }
        switch (method) {
            case MIN_MAX -> {
                final double range = max - min;
                if (range <= EPSILON) {
                    // all scores equal: equally relevant
                    return 1.0;
                }
                return clamp((raw - min) / (range + EPSILON));
            }
            case Z_SCORE_SIGMOID -> {
                final double z = (raw - mean) / (std + EPSILON);
                final double clipped = Math.max(-Z_CLIP, Math.min(Z_CLIP, z));
                return 1.0 / (1.0 + Math.exp(-clipped));
            }
            default -> {
                return raw;
            }
        }
    }

    public double coefficientOfVariation() {
        return std / (mean + EPSILON);
    }

    private static double clamp(final double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
