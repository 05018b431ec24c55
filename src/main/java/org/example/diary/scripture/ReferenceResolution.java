package org.example.diary.scripture;

import java.util.Optional;

/**
 * Outcome of a single resolution call. Anything other than {@link Status#RESOLVED}
 * means "no enrichment available", never a system error.
 */
public record ReferenceResolution(
    Status status,
    Citation citation,
    ResolvedReference reference
) {
    public enum Status {
        RESOLVED,
        NO_CITATION,
        BOOK_NOT_FOUND,
        VERSE_RANGE_NOT_FOUND
    }

    public static ReferenceResolution resolved(Citation citation, ResolvedReference reference) {
        return new ReferenceResolution(Status.RESOLVED, citation, reference);
    }

    public static ReferenceResolution noCitation() {
        return new ReferenceResolution(Status.NO_CITATION, null, null);
    }

    public static ReferenceResolution bookNotFound(Citation citation) {
        return new ReferenceResolution(Status.BOOK_NOT_FOUND, citation, null);
    }

    public static ReferenceResolution verseRangeNotFound(Citation citation) {
        return new ReferenceResolution(Status.VERSE_RANGE_NOT_FOUND, citation, null);
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }

    public Optional<ResolvedReference> asOptional() {
        return Optional.ofNullable(reference);
    }
}
