package org.example.diary.scripture;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * A canonical book of the reference corpus together with the free-text aliases used to refer to it.
 */
public record BookEntry(
    int canonicalId,
    String shortName,
    String longName,
    Set<String> aliases
) {
    public BookEntry {
        if (shortName == null || longName == null) {
            throw new IllegalArgumentException("Book " + canonicalId + " needs both a short and a long name");
        }
        Set<String> lowered = new LinkedHashSet<>();
        if (aliases != null) {
            for (String alias : aliases) {
                lowered.add(alias.toLowerCase(Locale.ROOT));
            }
        }
        aliases = Collections.unmodifiableSet(lowered);
    }

    /**
     * Create an entry as it is stored in the corpus, without any aliases.
     */
    public static BookEntry of(int canonicalId, String shortName, String longName) {
        return new BookEntry(canonicalId, shortName, longName, Set.of());
    }

    public BookEntry withAliases(Set<String> extraAliases) {
        Set<String> merged = new LinkedHashSet<>(aliases);
        merged.addAll(extraAliases);
        return new BookEntry(canonicalId, shortName, longName, merged);
    }
}
