package org.example.verse.service;

import org.example.verse.entity.VerseEntity;
import org.example.verse.model.Selection;
import org.example.verse.repository.DailySelectionRepository;
import org.example.verse.repository.VerseRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class JpaVerseSelectionStoreTest {

    @Autowired
    private VerseRepository verseRepository;

    @Autowired
    private DailySelectionRepository selectionRepository;

    private JpaVerseSelectionStore store;

    @BeforeEach
    void setUp() {
        store = new JpaVerseSelectionStore(verseRepository, selectionRepository);
    }

    @Test
    void allVerses_returnsCanonicalOrder() {
        verseRepository.save(new VerseEntity("Genesis", 2, 1, "Thus the heavens and the earth were finished."));
        verseRepository.save(new VerseEntity("Exodus", 1, 1, "Now these are the names of the children of Israel."));
        verseRepository.save(new VerseEntity("Genesis", 1, 2, "And the earth was without form, and void."));
        verseRepository.save(new VerseEntity("Genesis", 1, 1, "In the beginning God created the heaven and the earth."));

        List<String> references = store.allVerses().stream().map(v -> v.reference()).toList();

        assertEquals(List.of("Exodus 1:1", "Genesis 1:1", "Genesis 1:2", "Genesis 2:1"), references);
    }

    @Test
    void createSelection_secondWriteForSameDate_throwsConflict() {
        VerseEntity first = verseRepository.save(new VerseEntity("Genesis", 1, 1, "In the beginning."));
        VerseEntity second = verseRepository.save(new VerseEntity("Exodus", 1, 1, "Now these are the names."));
        LocalDate date = LocalDate.of(2026, 1, 1);

        store.createSelection(date, first.getId());

        SelectionConflictException conflict = assertThrows(SelectionConflictException.class,
                () -> store.createSelection(date, second.getId()));
        assertEquals(date, conflict.getDate());
        assertEquals(1, selectionRepository.count());
        assertEquals("Genesis 1:1", store.selectionFor(date).orElseThrow().verse().reference());
    }

    @Test
    void createSelection_unknownVerse_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> store.createSelection(LocalDate.of(2026, 1, 1), "missing-verse"));
    }

    @Test
    void latestSelectionBefore_skipsLaterDatesAndSpansGaps() {
        VerseEntity genesis = verseRepository.save(new VerseEntity("Genesis", 1, 1, "In the beginning."));
        VerseEntity exodus = verseRepository.save(new VerseEntity("Exodus", 1, 1, "Now these are the names."));
        store.createSelection(LocalDate.of(2026, 1, 1), genesis.getId());
        store.createSelection(LocalDate.of(2026, 1, 20), exodus.getId());

        Optional<Selection> beforeTenth = store.latestSelectionBefore(LocalDate.of(2026, 1, 10));
        Optional<Selection> beforeFirst = store.latestSelectionBefore(LocalDate.of(2026, 1, 1));
        Optional<Selection> beforeMarch = store.latestSelectionBefore(LocalDate.of(2026, 3, 1));

        assertEquals(LocalDate.of(2026, 1, 1), beforeTenth.orElseThrow().date());
        assertFalse(beforeFirst.isPresent());
        assertEquals("Exodus 1:1", beforeMarch.orElseThrow().verse().reference());
    }

    @Test
    void usedVerseIdsAndOrderedHistory_reflectSelections() {
        VerseEntity genesis = verseRepository.save(new VerseEntity("Genesis", 1, 1, "In the beginning."));
        VerseEntity exodus = verseRepository.save(new VerseEntity("Exodus", 1, 1, "Now these are the names."));
        verseRepository.save(new VerseEntity("Leviticus", 1, 1, "And the LORD called unto Moses."));
        store.createSelection(LocalDate.of(2026, 2, 2), exodus.getId());
        store.createSelection(LocalDate.of(2026, 2, 1), genesis.getId());

        List<Selection> history = store.selectionsOrderedByDate();

        assertEquals(2, history.size());
        assertEquals(LocalDate.of(2026, 2, 1), history.get(0).date());
        assertEquals(LocalDate.of(2026, 2, 2), history.get(1).date());
        assertTrue(store.usedVerseIds().contains(genesis.getId()));
        assertTrue(store.usedVerseIds().contains(exodus.getId()));
        assertEquals(2, store.usedVerseIds().size());
    }

    @Test
    void discardSelections_removesOnlyDatesInRange() {
        VerseEntity a = verseRepository.save(new VerseEntity("Genesis", 1, 1, "In the beginning."));
        VerseEntity b = verseRepository.save(new VerseEntity("Exodus", 1, 1, "Now these are the names."));
        VerseEntity c = verseRepository.save(new VerseEntity("Leviticus", 1, 1, "And the LORD called unto Moses."));
        store.createSelection(LocalDate.of(2026, 4, 1), a.getId());
        store.createSelection(LocalDate.of(2026, 4, 2), b.getId());
        store.createSelection(LocalDate.of(2026, 4, 3), c.getId());

        int discarded = store.discardSelections(LocalDate.of(2026, 4, 2), LocalDate.of(2026, 4, 3));

        assertEquals(2, discarded);
        assertTrue(store.selectionFor(LocalDate.of(2026, 4, 1)).isPresent());
        assertFalse(store.selectionFor(LocalDate.of(2026, 4, 2)).isPresent());
        assertFalse(store.selectionFor(LocalDate.of(2026, 4, 3)).isPresent());
    }
}
