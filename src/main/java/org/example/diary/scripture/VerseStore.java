package org.example.diary.scripture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only access to a MyBible-format SQLite module ({@code books} and {@code verses} tables).
 *
 * <p>The store owns a single connection, opened in the constructor and released by
 * {@link #close()}. Query failures are logged and reported as absent results; only failing
 * to open the corpus is an error.
 */
public class VerseStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VerseStore.class);

    private static final String BOOKS_SQL =
        "SELECT book_number, short_name, long_name FROM books";
    private static final String BOOKS_ORDERED_SQL = BOOKS_SQL + " ORDER BY book_number";
    private static final String BOOK_BY_NUMBER_SQL = BOOKS_SQL + " WHERE book_number = ?";
    private static final String VERSES_SQL =
        "SELECT verse, text FROM verses WHERE book_number = ? AND chapter = ? AND verse >= ? AND verse <= ? " +
        "ORDER BY verse";

    private final Path databasePath;
    private final VerseTextCleaner textCleaner;
    private Connection connection;

    public VerseStore(Path databasePath) {
        this(databasePath, new VerseTextCleaner(true));
    }

    public VerseStore(Path databasePath, VerseTextCleaner textCleaner) {
        this.databasePath = databasePath;
        this.textCleaner = textCleaner;

        if (databasePath == null || !Files.isRegularFile(databasePath)) {
            throw new VerseStoreUnavailableException("Bible database not found: " + databasePath);
        }
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath.toAbsolutePath());
            log.info("Connected to Bible database: {}", databasePath);
        } catch (SQLException e) {
            throw new VerseStoreUnavailableException("Failed to open Bible database: " + databasePath, e);
        }
    }

    /**
     * First book, in corpus order, whose short or long name contains {@code name} ignoring case.
     */
    public synchronized Optional<Integer> findBookNumber(String name) {
        if (name == null || name.isBlank() || connection == null) {
            return Optional.empty();
        }
        String needle = name.trim().toLowerCase(Locale.ROOT);

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(BOOKS_SQL)) {
            while (rs.next()) {
                if (containsIgnoreCase(rs.getString("short_name"), needle)
                        || containsIgnoreCase(rs.getString("long_name"), needle)) {
                    return Optional.of(rs.getInt("book_number"));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            log.error("Error finding book number for '{}': {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    public synchronized Optional<BookEntry> findBook(int bookNumber) {
        if (connection == null) {
            return Optional.empty();
        }
        try (PreparedStatement pstmt = connection.prepareStatement(BOOK_BY_NUMBER_SQL)) {
            pstmt.setInt(1, bookNumber);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(toBookEntry(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            log.error("Error loading book {}: {}", bookNumber, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Verse texts {@code verseStart..verseEnd} of one chapter joined by single spaces.
     * Verses without text are skipped; an empty result is reported as absent.
     */
    public synchronized Optional<String> getVerses(int bookNumber, int chapter, int verseStart, int verseEnd) {
        if (connection == null) {
            return Optional.empty();
        }
        List<String> texts = new ArrayList<>();
        try (PreparedStatement pstmt = connection.prepareStatement(VERSES_SQL)) {
            pstmt.setInt(1, bookNumber);
            pstmt.setInt(2, chapter);
            pstmt.setInt(3, verseStart);
            pstmt.setInt(4, verseEnd);

            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    String text = textCleaner.clean(rs.getString("text"));
                    if (!text.isEmpty()) {
                        texts.add(text);
                    }
                }
            }
        } catch (SQLException e) {
            log.error("Error reading verses {} {}:{}-{}: {}", bookNumber, chapter, verseStart, verseEnd, e.getMessage());
            return Optional.empty();
        }

        if (texts.isEmpty()) {
            log.warn("No verses found for book_number={}, chapter={}, verses={}-{}",
                    bookNumber, chapter, verseStart, verseEnd);
            return Optional.empty();
        }
        return Optional.of(String.join(" ", texts));
    }

    public synchronized List<BookEntry> listBooks() {
        List<BookEntry> books = new ArrayList<>();
        if (connection == null) {
            return books;
        }
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(BOOKS_ORDERED_SQL)) {
            while (rs.next()) {
                books.add(toBookEntry(rs));
            }
        } catch (SQLException e) {
            log.error("Error listing books: {}", e.getMessage());
            return new ArrayList<>();
        }
        return books;
    }

    @Override
    public synchronized void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
            log.info("Bible database connection closed");
        } catch (SQLException e) {
            log.warn("Failed to close Bible database {}: {}", databasePath, e.getMessage());
        } finally {
            connection = null;
        }
    }

    private static BookEntry toBookEntry(ResultSet rs) throws SQLException {
        return BookEntry.of(rs.getInt("book_number"), nullToEmpty(rs.getString("short_name")),
                nullToEmpty(rs.getString("long_name")));
    }

    private static boolean containsIgnoreCase(String value, String loweredNeedle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(loweredNeedle);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
