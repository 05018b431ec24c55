package org.example.diary.scripture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds citation-shaped substrings such as "Matthew 5:3-8" or "1 Cor 13, 4-8" in arbitrary text.
 */
@Component
public class CitationExtractor {

    private static final Logger log = LoggerFactory.getLogger(CitationExtractor.class);

    // "Matthew 5:3-4", "1 Cor 13:4", "2Tim 1:8"
    private static final Pattern COLON_PATTERN = Pattern.compile(
        "(\\d?\\s?[\\p{L}\\-]+)\\s+(\\d+):(\\d+)(?:-(\\d+))?"
    );

    // "Matthew 5, 3-4", "1 Cor 13,4-8"
    private static final Pattern COMMA_PATTERN = Pattern.compile(
        "(\\d?\\s?[\\p{L}\\-]+)\\s+(\\d+),\\s*(\\d+)(?:-(\\d+))?"
    );

    private static final List<Pattern> PATTERNS = List.of(COLON_PATTERN, COMMA_PATTERN);

    /**
     * Every citation found in the text, in pattern order and then by position.
     * A citation matched by more than one pattern is reported once per pattern.
     */
    public List<Citation> extract(String text) {
        List<Citation> citations = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return citations;
        }

        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                Citation citation = toCitation(matcher);
                if (citation != null) {
                    citations.add(citation);
                }
            }
        }
        return citations;
    }

    /**
     * Like {@link #extract(String)} but keeps only the first occurrence of each
     * (book, chapter, first verse, last verse) combination.
     */
    public List<Citation> extractDistinct(String text) {
        Map<String, Citation> distinct = new LinkedHashMap<>();
        for (Citation citation : extract(text)) {
            String key = citation.bookToken().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ")
                + "|" + citation.chapter()
                + "|" + citation.verseStart()
                + "|" + citation.effectiveVerseEnd();
            distinct.putIfAbsent(key, citation);
        }
        return new ArrayList<>(distinct.values());
    }

    private Citation toCitation(Matcher matcher) {
        String book = matcher.group(1).trim();
        try {
            int chapter = Integer.parseInt(matcher.group(2));
            int verseStart = Integer.parseInt(matcher.group(3));
            Integer verseEnd = matcher.group(4) != null ? Integer.valueOf(matcher.group(4)) : null;
            return new Citation(matcher.group(0).trim(), book, chapter, verseStart, verseEnd);
        } catch (IllegalArgumentException e) {
            // NumberFormatException included: overflowing or out-of-range numbers drop the match
            log.debug("Skipping malformed citation '{}': {}", matcher.group(0).trim(), e.getMessage());
            return null;
        }
    }
}
