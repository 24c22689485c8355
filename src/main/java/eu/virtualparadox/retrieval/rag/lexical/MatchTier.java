package eu.virtualparadox.retrieval.rag.lexical;

/**
 * Match tiers of the lexical cascade, strongest first. The discount scales a term's BM25
 * contribution by how loosely it matched.
 */
public enum MatchTier {
    EXACT(1.0),
    LANGUAGE_FUZZY(0.9),
    GENERIC_FUZZY(0.8),
    PARTIAL(0.7),
    SUBSTRING(0.6);

    private final double discount;

    MatchTier(final double discount) {
        this.discount = discount;
    }

    public double discount() {
        return discount;
    }
}
