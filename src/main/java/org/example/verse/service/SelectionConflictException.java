package org.example.verse.service;

import java.time.LocalDate;

/**
 * Thrown by the selection store when a selection for the date is already committed.
 */
public class SelectionConflictException extends RuntimeException {

    private final LocalDate date;

    public SelectionConflictException(LocalDate date) {
        super("A selection already exists for " + date);
        this.date = date;
    }

    public SelectionConflictException(LocalDate date, Throwable cause) {
        super("A selection already exists for " + date, cause);
        this.date = date;
    }

    public LocalDate getDate() {
        return date;
    }
}
