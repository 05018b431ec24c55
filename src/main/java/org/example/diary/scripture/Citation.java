package org.example.diary.scripture;

/**
 * A parsed, unresolved reference to a scripture passage as it appeared in free text.
 *
 * @param rawText   the matched text, e.g. "Matthew 5:3-8"
 * @param bookToken the book part exactly as written
 * @param verseEnd  last verse of the range, or null for a single verse
 */
public record Citation(
    String rawText,
    String bookToken,
    int chapter,
    int verseStart,
    Integer verseEnd
) {
    public Citation {
        if (bookToken == null || bookToken.isBlank()) {
            throw new IllegalArgumentException("Citation needs a book token");
        }
        if (chapter < 1) {
            throw new IllegalArgumentException("Chapter must be >= 1: " + chapter);
        }
        if (verseStart < 1) {
            throw new IllegalArgumentException("Verse must be >= 1: " + verseStart);
        }
        if (verseEnd != null && verseEnd < verseStart) {
            throw new IllegalArgumentException("Verse range ends before it starts: " + verseStart + "-" + verseEnd);
        }
    }

    public static Citation of(String bookToken, int chapter, int verseStart, Integer verseEnd) {
        String raw = bookToken + " " + chapter + ":" + verseStart + (verseEnd != null ? "-" + verseEnd : "");
        return new Citation(raw, bookToken, chapter, verseStart, verseEnd);
    }

    public int effectiveVerseEnd() {
        return verseEnd != null ? verseEnd : verseStart;
    }
}
