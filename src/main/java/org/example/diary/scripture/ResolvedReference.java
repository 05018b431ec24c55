package org.example.diary.scripture;

/**
 * A citation matched to actual verse text from the corpus.
 */
public record ResolvedReference(
    BookEntry book,
    int chapter,
    int verseStart,
    int verseEnd,
    String text
) {
    /**
     * Canonical reference string, e.g. "Mátthêu 5:3-8" or "Mátthêu 5:3".
     */
    public String reference() {
        String range = verseEnd != verseStart ? verseStart + "-" + verseEnd : String.valueOf(verseStart);
        return book.longName() + " " + chapter + ":" + range;
    }
}
