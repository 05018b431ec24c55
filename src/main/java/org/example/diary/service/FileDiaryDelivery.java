package org.example.diary.service;

import org.example.diary.model.ReadingContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes each diary entry as a Markdown file named after the reading date.
 */
public class FileDiaryDelivery implements DiaryDelivery {

    private static final Logger log = LoggerFactory.getLogger(FileDiaryDelivery.class);

    private final Path outputDir;

    public FileDiaryDelivery(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public boolean deliver(ReadingContent reading, String diaryText) {
        Path target = outputDir.resolve(fileNameFor(reading));
        try {
            Files.createDirectories(outputDir);
            Files.writeString(target, render(reading, diaryText), StandardCharsets.UTF_8);
            log.info("Diary entry written to {}", target);
            return true;
        } catch (IOException e) {
            log.error("Failed to write diary entry to {}: {}", target, e.getMessage());
            return false;
        }
    }

    String render(ReadingContent reading, String diaryText) {
        StringBuilder out = new StringBuilder();
        out.append("# Daily Bible Diary - ").append(reading.date()).append("\n\n");
        reading.citationText().ifPresent(citation -> {
            out.append("## ").append(citation);
            reading.citationLinkUrl().ifPresent(link -> out.append(" ([link](").append(link).append("))"));
            out.append("\n\n");
        });
        if (!reading.body().isBlank()) {
            out.append(reading.body().trim()).append("\n\n");
        }
        reading.resolved().ifPresent(reference -> out
                .append("> ").append(reference.reference()).append(": ").append(reference.text()).append("\n\n"));
        out.append("---\n\n").append(diaryText.trim()).append('\n');
        if (!reading.sourceUrl().isBlank()) {
            out.append("\nSource: ").append(reading.sourceUrl()).append('\n');
        }
        return out.toString();
    }

    static String fileNameFor(ReadingContent reading) {
        String slug = reading.date().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        return (slug.isEmpty() ? "diary" : "diary-" + slug) + ".md";
    }
}
