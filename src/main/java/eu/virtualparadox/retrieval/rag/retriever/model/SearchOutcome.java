package eu.virtualparadox.retrieval.rag.retriever.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of one search: either a ranking (possibly empty) or a failure with an empty ranking.
 *
 * @param results ranked results, descending by final score; empty on failure
 * @param failure failure reason, {@code null} on success
 * @param message human readable failure detail, {@code null} on success
 */
public record SearchOutcome(List<RankedResult> results, FailureReason failure, String message) {

    public SearchOutcome {
        results = results == null ? List.of() : List.copyOf(results);
        if (failure != null && !results.isEmpty()) {
            throw new IllegalArgumentException("A failed search carries no results");
        }
    }

    public static SearchOutcome success(final List<RankedResult> results) {
        return new SearchOutcome(results, null, null);
    }

    public static SearchOutcome empty() {
        return success(List.of());
    }

    public static SearchOutcome failed(final FailureReason reason, final String message) {
        return new SearchOutcome(List.of(), reason, message);
    }

    public boolean isFailed() {
        return failure != null;
    }

    public Optional<FailureReason> failureReason() {
        return Optional.ofNullable(failure);
    }
}
