package org.example.diary.service;

import org.example.diary.model.DiaryGeneration;
import org.example.diary.model.GenerationResult;
import org.example.diary.model.ReadingContent;
import org.example.diary.scripture.ReferenceResolution;
import org.example.diary.scripture.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class DailyDiaryService {

    private static final Logger log = LoggerFactory.getLogger(DailyDiaryService.class);

    private final Optional<ReferenceResolver> referenceResolver;
    private final PromptAssembler promptAssembler;
    private final GenerationPipeline generationPipeline;

    public DailyDiaryService(
            Optional<ReferenceResolver> referenceResolver,
            PromptAssembler promptAssembler,
            GenerationPipeline generationPipeline) {
        this.referenceResolver = referenceResolver;
        this.promptAssembler = promptAssembler;
        this.generationPipeline = generationPipeline;
    }

    public DiaryGeneration generateDiary(ReadingContent reading) {
        log.info("Generating diary entry for {}", reading.date());

        ReferenceResolution resolution = enrich(reading);
        ReadingContent enriched = resolution.asOptional()
                .map(reading::withResolvedReference)
                .orElse(reading);

        String prompt = promptAssembler.assemble(enriched);
        GenerationResult result = generationPipeline.generate(prompt);
        if (result.success()) {
            log.info("Successfully generated diary entry for {}", reading.date());
        } else {
            log.error("Failed to generate diary entry for {}: {}", reading.date(), result.message());
        }
        return new DiaryGeneration(enriched, resolution.status(), result);
    }

    /**
     * Looks up the Vietnamese text for the reading's citation, falling back to a citation
     * found in the body. Any failure just means the prompt goes out without it.
     */
    ReferenceResolution enrich(ReadingContent reading) {
        if (referenceResolver.isEmpty()) {
            return ReferenceResolution.noCitation();
        }
        if (reading.resolved().isPresent()) {
            return ReferenceResolution.resolved(null, reading.resolvedReference());
        }

        String source = reading.citationText().orElse(reading.body());
        ReferenceResolution resolution = referenceResolver.get().resolveDetailed(source);
        if (resolution.isResolved()) {
            log.info("Enriched reading with {}", resolution.reference().reference());
        } else {
            log.info("No enrichment for {}: {}", reading.date(), resolution.status());
        }
        return resolution;
    }
}
