package org.example.diary.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.example.diary.scripture.ResolvedReference;

import java.util.Optional;

/**
 * One day's reading as supplied by the upstream collaborator.
 * Optional fields are null when absent; use the accessors returning {@link Optional}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadingContent(
    String date,
    String sourceUrl,
    String citation,       // nullable
    String citationLink,   // nullable
    String body,
    ResolvedReference resolvedReference   // nullable
) {
    public ReadingContent {
        date = date == null ? "" : date;
        sourceUrl = sourceUrl == null ? "" : sourceUrl;
        body = body == null ? "" : body;
    }

    public static ReadingContent of(String date, String sourceUrl, String citation, String citationLink, String body) {
        return new ReadingContent(date, sourceUrl, citation, citationLink, body, null);
    }

    public Optional<String> citationText() {
        return Optional.ofNullable(citation).filter(value -> !value.isBlank());
    }

    public Optional<String> citationLinkUrl() {
        return Optional.ofNullable(citationLink).filter(value -> !value.isBlank());
    }

    public Optional<ResolvedReference> resolved() {
        return Optional.ofNullable(resolvedReference);
    }

    /**
     * Copy of this reading carrying the given resolved reference.
     */
    public ReadingContent withResolvedReference(ResolvedReference reference) {
        return new ReadingContent(date, sourceUrl, citation, citationLink, body, reference);
    }
}
