package eu.virtualparadox.retrieval.store.model;

import java.util.List;
import java.util.Objects;

/**
 * Visibility scope of a single search call.
 * <p>An empty allow-list means "all documents of the owner", the same as no list at all.</p>
 *
 * @param ownerId              owner whose chunks are searched (non-blank)
 * @param documentIdAllowList  documents the search is restricted to, never null
 */
public record SearchScope(String ownerId, List<String> documentIdAllowList) {

    public SearchScope {
        Objects.requireNonNull(ownerId, "ownerId");
        if (ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        documentIdAllowList = documentIdAllowList == null ? List.of() : List.copyOf(documentIdAllowList);
    }

    public static SearchScope ofOwner(final String ownerId) {
        return new SearchScope(ownerId, List.of());
    }

    public static SearchScope ofDocuments(final String ownerId, final List<String> documentIds) {
        return new SearchScope(ownerId, documentIds);
    }

    /**
     * @return {@code true} when the caller narrowed the search to specific documents
     */
    public boolean isDocumentScoped() {
        return !documentIdAllowList.isEmpty();
    }
}
