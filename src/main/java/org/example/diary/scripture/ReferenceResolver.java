package org.example.diary.scripture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a citation found in free text into verse text from the reference corpus.
 *
 * <p>Resolution never throws for a missing book or verse range: callers get an empty
 * result (or a {@link ReferenceResolution} explaining why) and carry on without enrichment.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final CitationExtractor citationExtractor;
    private final BookNameTable bookNameTable;
    private final VerseStore verseStore;

    public ReferenceResolver(CitationExtractor citationExtractor, BookNameTable bookNameTable, VerseStore verseStore) {
        this.citationExtractor = citationExtractor;
        this.bookNameTable = bookNameTable;
        this.verseStore = verseStore;
    }

    public Optional<ResolvedReference> resolve(String referenceText) {
        return resolveDetailed(referenceText).asOptional();
    }

    public Optional<ResolvedReference> resolve(Citation citation) {
        return resolveDetailed(citation).asOptional();
    }

    public ReferenceResolution resolveDetailed(String referenceText) {
        List<Citation> citations = citationExtractor.extract(referenceText);
        if (citations.isEmpty()) {
            log.warn("Could not parse reference: {}", referenceText);
            return ReferenceResolution.noCitation();
        }
        return resolveDetailed(citations.get(0));
    }

    public ReferenceResolution resolveDetailed(Citation citation) {
        if (citation == null) {
            return ReferenceResolution.noCitation();
        }

        Optional<Integer> bookNumber = findBookNumber(citation.bookToken());
        if (bookNumber.isEmpty()) {
            log.warn("Book not found: {}", citation.bookToken());
            return ReferenceResolution.bookNotFound(citation);
        }

        int verseEnd = citation.effectiveVerseEnd();
        Optional<String> text = verseStore.getVerses(bookNumber.get(), citation.chapter(), citation.verseStart(), verseEnd);
        if (text.isEmpty()) {
            log.warn("Verse range not found: {}", citation.rawText());
            return ReferenceResolution.verseRangeNotFound(citation);
        }

        BookEntry book = describeBook(bookNumber.get(), citation.bookToken());
        ResolvedReference reference = new ResolvedReference(
                book, citation.chapter(), citation.verseStart(), verseEnd, text.get());
        log.debug("Resolved '{}' to {}", citation.rawText(), reference.reference());
        return ReferenceResolution.resolved(citation, reference);
    }

    /**
     * Tries the normalized name first, then the token as written, then the names of the
     * first table entry the token is an alias fragment of.
     */
    private Optional<Integer> findBookNumber(String bookToken) {
        Set<String> candidates = new LinkedHashSet<>();
        bookNameTable.normalize(bookToken).ifPresent(candidates::add);
        candidates.add(bookToken.trim());
        bookNameTable.lookupAlias(bookToken).ifPresent(entry -> {
            candidates.add(entry.longName());
            candidates.add(entry.shortName());
        });

        for (String candidate : candidates) {
            Optional<Integer> bookNumber = verseStore.findBookNumber(candidate);
            if (bookNumber.isPresent()) {
                return bookNumber;
            }
        }
        return Optional.empty();
    }

    private BookEntry describeBook(int bookNumber, String bookToken) {
        BookEntry stored = verseStore.findBook(bookNumber)
                .orElseGet(() -> BookEntry.of(bookNumber, bookToken, bookToken));
        return bookNameTable.findById(bookNumber)
                .map(entry -> stored.withAliases(entry.aliases()))
                .orElse(stored);
    }
}
