package org.example.diary.scripture;

import org.example.diary.scripture.BookNameTable.BookNameRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BookNameTableTest {

    private BookNameTable table;

    @BeforeEach
    void setUp() {
        table = new BookNameTable();
    }

    @Test
    void normalize_mapsAbbreviationsOfTheSameBookToOneName() {
        assertEquals(Optional.of("Mt"), table.normalize("mt"));
        assertEquals(table.normalize("mt"), table.normalize("matt"));
    }

    @Test
    void normalize_mapsFullEnglishNameToVietnameseLongName() {
        assertEquals(Optional.of("Mátthêu"), table.normalize("Matthew"));
        assertEquals(Optional.of("Gioan"), table.normalize("JOHN"));
        assertEquals(Optional.of("Thư 1 Côrintô"), table.normalize("1  Corinthians"));
    }

    @Test
    void normalize_unknownTokenIsAbsent() {
        assertTrue(table.normalize("unknown-book").isEmpty());
        assertTrue(table.normalize("").isEmpty());
        assertTrue(table.normalize(null).isEmpty());
    }

    @Test
    void lookupAlias_matchesSubstringOfAliasesIgnoringCase() {
        Optional<BookEntry> entry = table.lookupAlias("MATTH");

        assertTrue(entry.isPresent());
        assertEquals(470, entry.get().canonicalId());
        assertEquals("Mt", entry.get().shortName());
    }

    @Test
    void lookupAlias_matchesVietnameseNames() {
        assertEquals(500, table.lookupAlias("gioan").orElseThrow().canonicalId());
    }

    @Test
    void lookupAlias_firstEntryInTableOrderWins() {
        // "phil" is part of both Philippians and Philemon
        assertEquals(570, table.lookupAlias("phil").orElseThrow().canonicalId());
    }

    @Test
    void lookupAlias_blankOrUnknownIsAbsent() {
        assertTrue(table.lookupAlias("  ").isEmpty());
        assertTrue(table.lookupAlias("zzz").isEmpty());
    }

    @Test
    void entries_keepTableOrderAndLowerCaseAliases() {
        List<BookEntry> entries = table.entries();

        assertEquals(10, entries.get(0).canonicalId());
        assertTrue(entries.get(0).aliases().contains("genesis"));
        assertEquals(500, table.findById(500).orElseThrow().canonicalId());
        assertTrue(table.findById(9999).isEmpty());
    }

    @Test
    void duplicateAliasFailsLoading() {
        List<BookNameRow> rows = List.of(
                new BookNameRow(1, "A", "Alpha", List.of("same"), List.of()),
                new BookNameRow(2, "B", "Beta", List.of("same"), List.of())
        );

        assertThrows(IllegalStateException.class, () -> new BookNameTable(rows));
    }

    @Test
    void missingResourceFailsLoading() {
        assertThrows(IllegalStateException.class, () -> new BookNameTable("/scripture/missing.json"));
    }
}
