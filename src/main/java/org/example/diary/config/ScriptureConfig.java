package org.example.diary.config;

import org.example.diary.scripture.BookNameTable;
import org.example.diary.scripture.CitationExtractor;
import org.example.diary.scripture.ReferenceResolver;
import org.example.diary.scripture.VerseStore;
import org.example.diary.scripture.VerseTextCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the reference corpus and the resolver. Disabled with
 * {@code scripture.enrichment.enabled=false}, in which case readings go out without Vietnamese text.
 *
 * <p>A missing or unreadable corpus fails startup while enrichment is enabled.
 */
@Configuration
@ConditionalOnProperty(prefix = "scripture.enrichment", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScriptureConfig {

    private static final Logger log = LoggerFactory.getLogger(ScriptureConfig.class);

    @Value("${scripture.store.path:database/RVV.SQLite3}")
    private String storePath;

    @Value("${scripture.store.strip-markup:true}")
    private boolean stripMarkup;

    @Bean(destroyMethod = "close")
    public VerseStore verseStore() {
        log.info("Opening reference corpus at {}", storePath);
        return new VerseStore(Path.of(storePath), new VerseTextCleaner(stripMarkup));
    }

    @Bean
    public ReferenceResolver referenceResolver(
            CitationExtractor citationExtractor,
            BookNameTable bookNameTable,
            VerseStore verseStore) {
        return new ReferenceResolver(citationExtractor, bookNameTable, verseStore);
    }
}
