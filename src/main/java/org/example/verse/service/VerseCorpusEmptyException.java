package org.example.verse.service;

/**
 * Thrown when the verse corpus has not been loaded.
 */
public class VerseCorpusEmptyException extends RuntimeException {

    public VerseCorpusEmptyException(String message) {
        super(message);
    }
}
