package org.example.diary.cli;

import org.example.diary.model.DiaryGeneration;
import org.example.diary.model.ReadingContent;
import org.example.diary.service.DailyDiaryService;
import org.example.diary.service.DiaryDelivery;
import org.example.diary.service.ReadingContentLoader;
import org.example.diary.service.llm.LlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line runner for the daily diary cycle: load readings, generate, deliver.
 *
 * Run with: mvn spring-boot:run -Dspring-boot.run.profiles=daily-run
 * Or: java -jar target/scripture-diary.jar --spring.profiles.active=daily-run [readings.json]
 */
@Component
@Profile("daily-run")
public class DailyDiaryRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(DailyDiaryRunner.class);

    private final ReadingContentLoader readingContentLoader;
    private final DailyDiaryService dailyDiaryService;
    private final DiaryDelivery diaryDelivery;
    private final LlmProvider diaryLlmProvider;

    @Value("${diary.readings.path:readings.json}")
    private String readingsPath;

    private int exitCode = 0;

    public DailyDiaryRunner(
            ReadingContentLoader readingContentLoader,
            DailyDiaryService dailyDiaryService,
            DiaryDelivery diaryDelivery,
            @Qualifier("diaryLlmProvider") LlmProvider diaryLlmProvider) {
        this.readingContentLoader = readingContentLoader;
        this.dailyDiaryService = dailyDiaryService;
        this.diaryDelivery = diaryDelivery;
        this.diaryLlmProvider = diaryLlmProvider;
    }

    @Override
    public void run(String... args) {
        Path source = Path.of(args.length > 0 && !args[0].startsWith("--") ? args[0] : readingsPath);
        log.info("========================================");
        log.info("Daily Bible Diary Runner");
        log.info("========================================");
        log.info("Reading source: {}", source.toAbsolutePath());
        log.info("Generation backend: {}", diaryLlmProvider.getProviderName());

        if (!diaryLlmProvider.isAvailable()) {
            log.error("Generation backend {} is not available, no diary entries generated",
                    diaryLlmProvider.getProviderName());
            exitCode = 1;
            return;
        }

        List<ReadingContent> readings;
        try {
            readings = readingContentLoader.load(source);
        } catch (RuntimeException e) {
            log.error("Failed to fetch Bible content: {}", e.getMessage(), e);
            exitCode = 1;
            return;
        }

        int delivered = 0;
        int failed = 0;
        for (ReadingContent reading : readings) {
            if (processReading(reading)) {
                delivered++;
            } else {
                failed++;
            }
        }

        log.info("========================================");
        log.info("Finished: {} delivered, {} failed", delivered, failed);
        log.info("========================================");
        exitCode = failed > 0 ? 1 : 0;
    }

    boolean processReading(ReadingContent reading) {
        try {
            DiaryGeneration generation = dailyDiaryService.generateDiary(reading);
            if (!generation.success()) {
                log.error("Skipping {}: {}", reading.date(), generation.generation().message());
                return false;
            }
            if (!diaryDelivery.deliver(generation.reading(), generation.diaryText())) {
                log.error("Failed to deliver diary entry for {}", reading.date());
                return false;
            }
            log.info("Daily Bible diary for {} delivered", reading.date());
            return true;
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {}: {}", reading.date(), e.getMessage(), e);
            return false;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
