package org.example.verse.service;

import org.example.verse.model.Selection;
import org.example.verse.model.Verse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Resolves the verse of the day.
 *
 * <p>Rules:
 * <ul>
 *   <li>No verse repeats until every verse in the corpus has been selected once.</li>
 *   <li>A date avoids the book and chapter of the selection immediately preceding it,
 *       unless only verses from that chapter remain.</li>
 * </ul>
 *
 * <p>A date is resolved at most once. The store's unique date constraint decides the
 * winner when two requests resolve the same date concurrently; the loser returns the
 * committed verse.
 */
@Service
public class VerseSelectionService {

    private static final Logger log = LoggerFactory.getLogger(VerseSelectionService.class);

    private static final int MAX_ATTEMPTS = 3;

    private final VerseSelectionStore store;
    private final Clock clock;
    private final Random random;

    @Autowired
    public VerseSelectionService(
            VerseSelectionStore store,
            Clock clock,
            @Value("${verse.selection.seed:#{null}}") Long seed) {
        this(store, clock, seed == null ? new Random() : new Random(seed));
        if (seed != null) {
            log.info("Verse selection using fixed seed {}", seed);
        }
    }

    VerseSelectionService(VerseSelectionStore store, Clock clock, Random random) {
        this.store = store;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Resolves the verse for the current date of the configured clock.
     */
    public Selection resolveToday() {
        LocalDate today = LocalDate.now(clock);
        return new Selection(today, resolveVerseForDate(today));
    }

    public Verse resolveVerseForDate(LocalDate date) {
        return resolveVerseForDate(date, random);
    }

    /**
     * Returns the verse bound to {@code date}, choosing and persisting one if the date
     * has not been resolved yet.
     *
     * @param random source of randomness for the choice among eligible verses
     * @throws VerseCorpusExhaustedException if every verse has already been selected
     */
    public Verse resolveVerseForDate(LocalDate date, Random random) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(random, "random");

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Optional<Selection> existing = store.selectionFor(date);
            if (existing.isPresent()) {
                return existing.get().verse();
            }

            Verse chosen = chooseEligibleVerse(date, random);
            try {
                store.createSelection(date, chosen.id());
                log.info("Selected {} for {}", chosen.reference(), date);
                return chosen;
            } catch (SelectionConflictException e) {
                log.debug("Selection for {} already committed (race condition handled, attempt {})", date, attempt);
                Optional<Selection> committed = store.selectionFor(date);
                if (committed.isPresent()) {
                    return committed.get().verse();
                }
            }
        }
        throw new IllegalStateException("Could not resolve a verse for " + date + " after "
                + MAX_ATTEMPTS + " attempts");
    }

    /**
     * Uniform choice over the whole corpus. Selection history is neither read nor written.
     *
     * @throws VerseCorpusEmptyException if no verses are loaded
     */
    public Verse pickRandomVerse() {
        List<Verse> verses = store.allVerses();
        if (verses.isEmpty()) {
            throw new VerseCorpusEmptyException("No verses loaded");
        }
        return verses.get(random.nextInt(verses.size()));
    }

    private Verse chooseEligibleVerse(LocalDate date, Random random) {
        Set<String> usedIds = store.usedVerseIds();
        List<Verse> unused = store.allVerses().stream()
                .filter(verse -> !usedIds.contains(verse.id()))
                .toList();
        if (unused.isEmpty()) {
            throw new VerseCorpusExhaustedException(date);
        }

        List<Verse> pool = unused;
        Optional<Selection> previous = store.latestSelectionBefore(date);
        if (previous.isPresent()) {
            Verse previousVerse = previous.get().verse();
            List<Verse> otherChapters = unused.stream()
                    .filter(verse -> !verse.isSameChapterAs(previousVerse))
                    .toList();
            if (!otherChapters.isEmpty()) {
                pool = otherChapters;
            } else {
                log.debug("Only {} {} remains unused; repeating chapter for {}",
                        previousVerse.book(), previousVerse.chapter(), date);
            }
        }

        return pool.get(random.nextInt(pool.size()));
    }
}
