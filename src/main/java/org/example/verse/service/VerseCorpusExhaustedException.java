package org.example.verse.service;

import java.time.LocalDate;

/**
 * Thrown when every verse in the corpus has already been selected for some date.
 * Recovery means resetting the selection history or extending the corpus.
 */
public class VerseCorpusExhaustedException extends RuntimeException {

    private final LocalDate date;

    public VerseCorpusExhaustedException(LocalDate date) {
        super("All verses have been used; no verse left to select for " + date);
        this.date = date;
    }

    public LocalDate getDate() {
        return date;
    }
}
