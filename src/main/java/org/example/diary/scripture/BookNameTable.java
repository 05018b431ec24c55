package org.example.diary.scripture;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static mapping between the corpus' canonical book names and the English aliases
 * that show up in free text.
 *
 * <p>Table order is significant: {@link #lookupAlias(String)} returns the first entry
 * whose names contain the query, so entries earlier in {@code book-names.json} win ties.
 */
@Component
public class BookNameTable {

    private static final Logger log = LoggerFactory.getLogger(BookNameTable.class);
    static final String DEFAULT_RESOURCE = "/scripture/book-names.json";

    private final List<BookEntry> entries;
    private final Map<Integer, BookEntry> entriesById;
    private final Map<String, String> canonicalByAlias;

    public BookNameTable() {
        this(DEFAULT_RESOURCE);
    }

    public BookNameTable(String resourcePath) {
        this(loadRows(resourcePath));
    }

    BookNameTable(List<BookNameRow> rows) {
        List<BookEntry> loadedEntries = new ArrayList<>();
        Map<Integer, BookEntry> byId = new HashMap<>();
        Map<String, String> aliasMap = new LinkedHashMap<>();

        for (BookNameRow row : rows) {
            Set<String> aliases = new LinkedHashSet<>();
            for (String alias : row.longAliases()) {
                registerAlias(aliasMap, alias, row.longName(), row.id());
                aliases.add(alias);
            }
            for (String alias : row.shortAliases()) {
                registerAlias(aliasMap, alias, row.shortName(), row.id());
                aliases.add(alias);
            }

            BookEntry entry = new BookEntry(row.id(), row.shortName(), row.longName(), aliases);
            if (byId.putIfAbsent(entry.canonicalId(), entry) != null) {
                throw new IllegalStateException("Duplicate book id in name table: " + entry.canonicalId());
            }
            loadedEntries.add(entry);
        }

        this.entries = Collections.unmodifiableList(loadedEntries);
        this.entriesById = Collections.unmodifiableMap(byId);
        this.canonicalByAlias = Collections.unmodifiableMap(aliasMap);
        log.debug("Loaded {} books with {} aliases", entries.size(), canonicalByAlias.size());
    }

    /**
     * Find the first book (in table order) whose short name, long name or any alias
     * contains the given text, ignoring case.
     */
    public Optional<BookEntry> lookupAlias(String text) {
        String query = normalizeKey(text);
        if (query.isEmpty()) {
            return Optional.empty();
        }
        for (BookEntry entry : entries) {
            if (containsIgnoreCase(entry.shortName(), query) || containsIgnoreCase(entry.longName(), query)) {
                return Optional.of(entry);
            }
            for (String alias : entry.aliases()) {
                if (alias.contains(query)) {
                    return Optional.of(entry);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Exact alias lookup. Returns the canonical name the alias stands for, or empty when the
     * token is not a known alias and should be passed through unchanged.
     */
    public Optional<String> normalize(String token) {
        String key = normalizeKey(token);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(canonicalByAlias.get(key));
    }

    public Optional<BookEntry> findById(int canonicalId) {
        return Optional.ofNullable(entriesById.get(canonicalId));
    }

    public List<BookEntry> entries() {
        return entries;
    }

    private static boolean containsIgnoreCase(String candidate, String loweredQuery) {
        return candidate.toLowerCase(Locale.ROOT).contains(loweredQuery);
    }

    private static String normalizeKey(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static void registerAlias(Map<String, String> aliasMap, String alias, String canonical, int bookId) {
        String key = normalizeKey(alias);
        String previous = aliasMap.putIfAbsent(key, canonical);
        if (previous != null) {
            throw new IllegalStateException("Alias '" + key + "' of book " + bookId + " is already mapped to " + previous);
        }
    }

    private static List<BookNameRow> loadRows(String resourcePath) {
        try (InputStream is = BookNameTable.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IllegalStateException("Book name table not found on classpath: " + resourcePath);
            }
            return new ObjectMapper().readValue(is, new TypeReference<List<BookNameRow>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load book name table from " + resourcePath, e);
        }
    }

    record BookNameRow(
        int id,
        String shortName,
        String longName,
        List<String> longAliases,
        List<String> shortAliases
    ) {
        BookNameRow {
            longAliases = longAliases == null ? List.of() : longAliases;
            shortAliases = shortAliases == null ? List.of() : shortAliases;
        }
    }
}
