package eu.virtualparadox.retrieval.rag.lexical.model;

import eu.virtualparadox.retrieval.rag.lexical.MatchTier;

/**
 * Outcome of matching one query term against one chunk.
 *
 * @param tier          the cascade tier that produced the match
 * @param quality       match quality in (0,1], 1.0 for exact matches
 * @param termFrequency number of chunk tokens (or token sequences for phrases) matched at that tier
 */
public record TermMatch(MatchTier tier, double quality, int termFrequency) {

    public double weight() {
        return quality * tier.discount();
    }
}
