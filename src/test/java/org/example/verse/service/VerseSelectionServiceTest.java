package org.example.verse.service;

import org.example.verse.entity.VerseEntity;
import org.example.verse.model.Verse;
import org.example.verse.repository.DailySelectionRepository;
import org.example.verse.repository.VerseRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
class VerseSelectionServiceTest {

    private static final LocalDate DAY_ONE = LocalDate.of(2026, 1, 1);

    @Autowired
    private VerseRepository verseRepository;

    @Autowired
    private DailySelectionRepository selectionRepository;

    private JpaVerseSelectionStore store;
    private VerseSelectionService service;

    @BeforeEach
    void setUp() {
        store = new JpaVerseSelectionStore(verseRepository, selectionRepository);
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneId.of("UTC"));
        service = new VerseSelectionService(store, clock, new Random(42));
    }

    @Test
    void resolveVerseForDate_calledTwice_returnsSameVerseAndPersistsOnce() {
        seedChapter("Psalms", 23, 6);
        seedChapter("Psalms", 91, 6);

        Verse first = service.resolveVerseForDate(DAY_ONE);
        Verse second = service.resolveVerseForDate(DAY_ONE);

        assertEquals(first, second);
        assertEquals(1, selectionRepository.count());
    }

    @Test
    void resolveVerseForDate_afterGenesisOneOne_picksExodusOverSameChapter() {
        VerseEntity gen11 = verseRepository.save(new VerseEntity("Genesis", 1, 1,
                "In the beginning God created the heaven and the earth."));
        verseRepository.save(new VerseEntity("Genesis", 1, 2,
                "And the earth was without form, and void."));
        verseRepository.save(new VerseEntity("Exodus", 1, 1,
                "Now these are the names of the children of Israel, which came into Egypt."));
        store.createSelection(DAY_ONE, gen11.getId());

        Verse dayTwo = service.resolveVerseForDate(DAY_ONE.plusDays(1));

        assertEquals("Exodus 1:1", dayTwo.reference());
    }

    @Test
    void resolveVerseForDate_onlyPreviousChapterLeft_fallsBackToThatChapter() {
        verseRepository.save(new VerseEntity("Genesis", 1, 1, "In the beginning God created the heaven and the earth."));
        verseRepository.save(new VerseEntity("Genesis", 1, 2, "And the earth was without form, and void."));
        VerseEntity exodus = verseRepository.save(new VerseEntity("Exodus", 1, 1,
                "Now these are the names of the children of Israel."));
        store.createSelection(DAY_ONE, exodus.getId());

        Verse dayTwo = service.resolveVerseForDate(DAY_ONE.plusDays(1));
        Verse dayThree = service.resolveVerseForDate(DAY_ONE.plusDays(2));

        assertEquals("Genesis", dayTwo.book());
        assertEquals("Genesis", dayThree.book());
        assertEquals(1, dayThree.chapter());
        assertNotEquals(dayTwo.verseNumber(), dayThree.verseNumber());
    }

    @Test
    void resolveVerseForDate_acrossWholeCorpus_neverRepeatsThenExhausts() {
        seedChapter("Matthew", 5, 4);
        seedChapter("Mark", 1, 4);
        seedChapter("Luke", 2, 4);
        int corpusSize = 12;

        Set<String> seen = new HashSet<>();
        for (int day = 0; day < corpusSize; day++) {
            Verse verse = service.resolveVerseForDate(DAY_ONE.plusDays(day));
            assertFalse(seen.contains(verse.id()), "verse repeated: " + verse.reference());
            seen.add(verse.id());
        }
        assertEquals(corpusSize, seen.size());

        LocalDate nextDay = DAY_ONE.plusDays(corpusSize);
        VerseCorpusExhaustedException exhausted = assertThrows(VerseCorpusExhaustedException.class,
                () -> service.resolveVerseForDate(nextDay));
        assertEquals(nextDay, exhausted.getDate());
        assertFalse(store.selectionFor(nextDay).isPresent());
        assertEquals(corpusSize, selectionRepository.count());
    }

    @Test
    void resolveVerseForDate_consecutiveDays_avoidPreviousChapterWhenAlternativeExists() {
        seedChapter("Genesis", 1, 5);
        seedChapter("Genesis", 2, 3);
        seedChapter("Exodus", 3, 2);
        List<Verse> corpus = store.allVerses();

        List<Verse> resolved = new ArrayList<>();
        for (int day = 0; day < corpus.size(); day++) {
            resolved.add(service.resolveVerseForDate(DAY_ONE.plusDays(day)));
        }

        for (int day = 1; day < resolved.size(); day++) {
            Verse previous = resolved.get(day - 1);
            Set<String> usedBefore = new HashSet<>();
            resolved.subList(0, day).forEach(v -> usedBefore.add(v.id()));
            boolean alternativeExisted = corpus.stream()
                    .filter(v -> !usedBefore.contains(v.id()))
                    .anyMatch(v -> !v.isSameChapterAs(previous));
            if (alternativeExisted) {
                assertFalse(resolved.get(day).isSameChapterAs(previous),
                        "day " + day + " repeated chapter of " + previous.reference());
            }
        }
    }

    @Test
    void resolveVerseForDate_comparesWithLatestEarlierSelectionAcrossGaps() {
        VerseEntity gen11 = verseRepository.save(new VerseEntity("Genesis", 1, 1, "In the beginning."));
        VerseEntity ex11 = verseRepository.save(new VerseEntity("Exodus", 1, 1, "Now these are the names."));
        verseRepository.save(new VerseEntity("Genesis", 1, 2, "And the earth was without form, and void."));
        verseRepository.save(new VerseEntity("Exodus", 1, 2, "Reuben, Simeon, Levi, and Judah."));
        store.createSelection(LocalDate.of(2026, 1, 1), gen11.getId());
        store.createSelection(LocalDate.of(2026, 1, 20), ex11.getId());

        // Jan 1 is the latest earlier selection even though Jan 20 was written last
        Verse backfilled = service.resolveVerseForDate(LocalDate.of(2026, 1, 10));

        assertEquals("Exodus 1:2", backfilled.reference());
    }

    @Test
    void resolveVerseForDate_sameSeed_reproducesChoice() {
        seedChapter("Proverbs", 3, 10);
        seedChapter("Proverbs", 4, 10);
        LocalDate date = LocalDate.of(2026, 5, 5);

        Verse first = service.resolveVerseForDate(date, new Random(7));
        store.discardSelections(date, date);
        Verse second = service.resolveVerseForDate(date, new Random(7));

        assertEquals(first.reference(), second.reference());
    }

    @Test
    void pickRandomVerse_doesNotTouchHistory() {
        seedChapter("John", 3, 3);

        Verse verse = service.pickRandomVerse();

        assertEquals("John", verse.book());
        assertEquals(0, selectionRepository.count());
    }

    @Test
    void pickRandomVerse_emptyCorpus_throws() {
        assertThrows(VerseCorpusEmptyException.class, () -> service.pickRandomVerse());
    }

    @Test
    void resolveToday_usesClockDate() {
        seedChapter("Ruth", 1, 2);

        var selection = service.resolveToday();

        assertEquals(DAY_ONE, selection.date());
        assertEquals(selection.verse(), store.selectionFor(DAY_ONE).orElseThrow().verse());
    }

    private void seedChapter(String book, int chapter, int verses) {
        for (int verse = 1; verse <= verses; verse++) {
            verseRepository.save(new VerseEntity(book, chapter, verse,
                    book + " chapter " + chapter + " verse " + verse + " text."));
        }
    }
}
