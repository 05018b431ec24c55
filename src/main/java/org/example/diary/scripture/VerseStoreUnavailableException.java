package org.example.diary.scripture;

/**
 * Thrown when the reference-text corpus cannot be opened.
 */
public class VerseStoreUnavailableException extends RuntimeException {

    public VerseStoreUnavailableException(String message) {
        super(message);
    }

    public VerseStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
