package org.example.diary.scripture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CitationExtractorTest {

    private CitationExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new CitationExtractor();
    }

    @Test
    void extract_parsesChapterAndVerseRange() {
        List<Citation> citations = extractor.extract("John 3:16-17");

        assertEquals(1, citations.size());
        Citation citation = citations.get(0);
        assertEquals("John", citation.bookToken());
        assertEquals(3, citation.chapter());
        assertEquals(16, citation.verseStart());
        assertEquals(17, citation.verseEnd());
        assertEquals("John 3:16-17", citation.rawText());
    }

    @Test
    void extract_singleVerseHasNoEnd() {
        Citation citation = extractor.extract("Gospel: John 3:16").get(0);

        assertNull(citation.verseEnd());
        assertEquals(16, citation.effectiveVerseEnd());
    }

    @Test
    void extract_findsCitationInsideSentence() {
        Citation citation = extractor.extract("Today's Gospel reading is from Matthew 5:3-8").get(0);

        assertEquals("Matthew", citation.bookToken());
        assertEquals(5, citation.chapter());
        assertEquals(3, citation.verseStart());
        assertEquals(8, citation.verseEnd());
    }

    @Test
    void extract_keepsNumberedBookPrefix() {
        Citation citation = extractor.extract("1 Corinthians 13:4-8 speaks about love").get(0);

        assertEquals("1 Corinthians", citation.bookToken());
        assertEquals(13, citation.chapter());
    }

    @Test
    void extract_commaSeparatedVerse() {
        List<Citation> citations = extractor.extract("1 Cor 13,4-8");

        assertEquals(1, citations.size());
        assertEquals("1 Cor", citations.get(0).bookToken());
        assertEquals(13, citations.get(0).chapter());
        assertEquals(4, citations.get(0).verseStart());
        assertEquals(8, citations.get(0).verseEnd());
    }

    @Test
    void extract_returnsAllMatchesInPositionOrder() {
        List<Citation> citations = extractor.extract("First Reading: Genesis 1:1-5, Psalm 23:1-6");

        assertEquals(2, citations.size());
        assertEquals("Genesis", citations.get(0).bookToken());
        assertEquals("Psalm", citations.get(1).bookToken());
        assertEquals(23, citations.get(1).chapter());
    }

    @Test
    void extract_colonPatternResultsComeBeforeCommaPatternResults() {
        List<Citation> citations = extractor.extract("Mark 2, 1-4 and Luke 4:16");

        assertEquals(2, citations.size());
        assertEquals("Luke", citations.get(0).bookToken());
        assertEquals("Mark", citations.get(1).bookToken());
    }

    @Test
    void extract_acceptsVietnameseBookNames() {
        Citation citation = extractor.extract("Mátthêu 5:3").get(0);

        assertEquals("Mátthêu", citation.bookToken());
    }

    @Test
    void extract_dropsMalformedNumbers() {
        assertTrue(extractor.extract("John 99999999999:1").isEmpty());
        assertTrue(extractor.extract("John 3:0").isEmpty());
        assertTrue(extractor.extract("John 3:17-16").isEmpty());
    }

    @Test
    void extract_malformedMatchDoesNotHideOthers() {
        List<Citation> citations = extractor.extract("John 3:0 and Luke 1:5");

        assertEquals(1, citations.size());
        assertEquals("Luke", citations.get(0).bookToken());
    }

    @Test
    void extract_blankOrCitationFreeTextYieldsNothing() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("   ").isEmpty());
        assertTrue(extractor.extract("Blessed are the poor in spirit").isEmpty());
    }

    @Test
    void extract_isRestartable() {
        String text = "Matthew 5:3-8";

        assertEquals(extractor.extract(text), extractor.extract(text));
    }

    @Test
    void extractDistinct_dropsRepeatedCitations() {
        String text = "John 3:16 ... as john 3:16 says, and John 3:16-16 again";

        assertEquals(3, extractor.extract(text).size());
        List<Citation> distinct = extractor.extractDistinct(text);
        assertEquals(1, distinct.size());
        assertEquals("John 3:16", distinct.get(0).rawText());
    }
}
