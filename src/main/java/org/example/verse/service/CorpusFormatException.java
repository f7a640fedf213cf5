package org.example.verse.service;

/**
 * Thrown when verse import input is malformed.
 */
public class CorpusFormatException extends RuntimeException {

    public CorpusFormatException(String message) {
        super(message);
    }

    public CorpusFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
