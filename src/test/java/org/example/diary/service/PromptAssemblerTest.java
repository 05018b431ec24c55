package org.example.diary.service;

import org.example.diary.model.ReadingContent;
import org.example.diary.scripture.BookEntry;
import org.example.diary.scripture.ResolvedReference;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PromptAssemblerTest {

    private static final String TEMPLATE = "Write a diary entry for {date}.\n\n{body}\n\nEnd.";

    private final PromptAssembler assembler = new PromptAssembler(TEMPLATE, 5000);

    @Test
    void assemble_fullReadingListsSectionsInOrder() {
        ReadingContent reading = ReadingContent.of(
                "Monday, June 3, 2024",
                "https://bible.usccb.org/bible/readings/060324.cfm",
                "Mark 12:1-12",
                "https://bible.usccb.org/bible/mark/12?1",
                "Jesus began to speak to the chief priests in parables.")
                .withResolvedReference(new ResolvedReference(
                        BookEntry.of(480, "Mc", "Máccô"), 12, 1, 12, "Đức Giê-su bắt đầu nói dụ ngôn."));

        String prompt = assembler.assemble(reading);

        assertEquals("""
                Write a diary entry for Monday, June 3, 2024.

                Date: Monday, June 3, 2024

                Gospel: Mark 12:1-12 (https://bible.usccb.org/bible/mark/12?1)

                Jesus began to speak to the chief priests in parables.

                Vietnamese text (Máccô 12:1-12):
                Đức Giê-su bắt đầu nói dụ ngôn.

                End.""", prompt);
    }

    @Test
    void assemble_absentOptionalFieldsAreOmitted() {
        ReadingContent reading = ReadingContent.of("2024-06-03", "", null, null, "Body text");

        String block = assembler.formatReading(reading);

        assertEquals("Date: 2024-06-03\n\nBody text", block);
        assertFalse(block.contains("Gospel"));
        assertFalse(block.contains("Vietnamese text"));
    }

    @Test
    void assemble_citationWithoutLink() {
        ReadingContent reading = ReadingContent.of("2024-06-03", "", "John 3:16", " ", "");

        assertEquals("Date: 2024-06-03\n\nGospel: John 3:16", assembler.formatReading(reading));
    }

    @Test
    void assemble_bodyWhitespaceIsNormalized() {
        ReadingContent reading = ReadingContent.of("d", "", null, null, "  line   one \t\n\n\n\n line two  ");

        assertEquals("Date: d\n\nline one\n\nline two", assembler.formatReading(reading));
    }

    @Test
    void assemble_longBodyIsCapped() {
        PromptAssembler small = new PromptAssembler(TEMPLATE, 10);
        ReadingContent reading = ReadingContent.of("d", "", null, null, "abcdefghijklmnop");

        assertEquals("Date: d\n\nabcdefghij...", small.formatReading(reading));
    }

    @Test
    void assemble_bodyCapDoesNotSplitSurrogatePair() {
        PromptAssembler small = new PromptAssembler(TEMPLATE, 10);
        ReadingContent reading = ReadingContent.of("d", "", null, null, "abcdefghi\uD83D\uDE4Fxyz");

        assertEquals("Date: d\n\nabcdefghi...", small.formatReading(reading));
    }

    @Test
    void assemble_placeholderTextInsideReadingIsNotExpanded() {
        ReadingContent reading = ReadingContent.of("d", "", null, null, "literal {date} and $1");

        String prompt = assembler.assemble(reading);

        assertTrue(prompt.contains("literal {date} and $1"));
        assertTrue(prompt.startsWith("Write a diary entry for d."));
    }

    @Test
    void assemble_withCustomTemplate() {
        ReadingContent reading = ReadingContent.of("d", "", null, null, "b");

        assertEquals("[d] Date: d\n\nb [d]", assembler.assemble(reading, "[{date}] {body} [{date}]"));
    }

    @Test
    void templateMissingPlaceholderIsRejected() {
        assertThrows(PromptTemplateException.class, () -> new PromptAssembler("no placeholders", 100));
        assertThrows(PromptTemplateException.class, () -> new PromptAssembler("{date} only", 100));
        assertThrows(PromptTemplateException.class, () -> new PromptAssembler(" ", 100));
        assertThrows(PromptTemplateException.class,
                () -> assembler.assemble(ReadingContent.of("d", "", null, null, "b"), "{body} only"));
    }
}
