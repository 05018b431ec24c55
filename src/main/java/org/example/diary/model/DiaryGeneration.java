package org.example.diary.model;

import org.example.diary.scripture.ReferenceResolution;

/**
 * Everything produced for one reading: the (possibly enriched) content, how enrichment went,
 * and the generation result.
 */
public record DiaryGeneration(
    ReadingContent reading,
    ReferenceResolution.Status enrichment,
    GenerationResult generation
) {
    public boolean success() {
        return generation.success();
    }

    public String diaryText() {
        return generation.text();
    }
}
