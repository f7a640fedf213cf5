package org.example.verse.service;

import org.example.verse.model.Selection;
import org.example.verse.model.Verse;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage boundary for the verse corpus and the per-date selection history.
 */
public interface VerseSelectionStore {

    /**
     * All verses, ordered by book, chapter and verse number.
     */
    List<Verse> allVerses();

    Optional<Selection> selectionFor(LocalDate date);

    List<Selection> selectionsOrderedByDate();

    /**
     * Ids of every verse that has been selected for any date.
     */
    Set<String> usedVerseIds();

    /**
     * The selection with the greatest date strictly before {@code date}, if any.
     */
    Optional<Selection> latestSelectionBefore(LocalDate date);

    /**
     * Persists the binding of {@code date} to a verse.
     *
     * @throws SelectionConflictException if a selection for {@code date} already exists
     */
    Selection createSelection(LocalDate date, String verseId);

    /**
     * Deletes the selections dated within {@code [from, to]} and returns how many were removed.
     */
    int discardSelections(LocalDate from, LocalDate to);
}
