package org.example.diary.scripture;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * Strips MyBible markup from verse text.
 *
 * <p>Strong's numbers ({@code <S>}, {@code <G>}, {@code <H>}), morphology ({@code <m>}), notes
 * ({@code <n>}), footnotes ({@code <f>}) and headings ({@code <h>}) are removed with their content;
 * formatting tags such as {@code <i>} or {@code <J>} keep their text.
 */
public class VerseTextCleaner {

    private static final String REMOVED_ELEMENTS = "s, g, h, m, n, f";

    private final boolean stripMarkup;

    public VerseTextCleaner(boolean stripMarkup) {
        this.stripMarkup = stripMarkup;
    }

    public String clean(String rawText) {
        if (rawText == null) {
            return "";
        }
        if (!stripMarkup || rawText.indexOf('<') < 0) {
            return collapseWhitespace(rawText);
        }

        Document fragment = Jsoup.parseBodyFragment(rawText.replace("<pb/>", " "));
        fragment.select(REMOVED_ELEMENTS).remove();
        return collapseWhitespace(fragment.body().text());
    }

    private static String collapseWhitespace(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
