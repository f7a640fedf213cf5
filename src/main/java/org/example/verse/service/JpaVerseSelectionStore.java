package org.example.verse.service;

import org.example.verse.entity.DailySelectionEntity;
import org.example.verse.entity.VerseEntity;
import org.example.verse.model.Selection;
import org.example.verse.model.Verse;
import org.example.verse.repository.DailySelectionRepository;
import org.example.verse.repository.VerseRepository;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class JpaVerseSelectionStore implements VerseSelectionStore {

    private final VerseRepository verseRepository;
    private final DailySelectionRepository selectionRepository;

    public JpaVerseSelectionStore(VerseRepository verseRepository,
                                  DailySelectionRepository selectionRepository) {
        this.verseRepository = verseRepository;
        this.selectionRepository = selectionRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Verse> allVerses() {
        return verseRepository.findAllByOrderByBookAscChapterAscVerseNumberAsc().stream()
            .map(JpaVerseSelectionStore::toVerse)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Selection> selectionFor(LocalDate date) {
        return selectionRepository.findBySelectionDateWithVerse(date)
            .map(JpaVerseSelectionStore::toSelection);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Selection> selectionsOrderedByDate() {
        return selectionRepository.findAllWithVerseOrderBySelectionDate().stream()
            .map(JpaVerseSelectionStore::toSelection)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> usedVerseIds() {
        return new HashSet<>(selectionRepository.findSelectedVerseIds());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Selection> latestSelectionBefore(LocalDate date) {
        return selectionRepository.findLatestBefore(date)
            .map(JpaVerseSelectionStore::toSelection);
    }

    @Override
    @Transactional
    public Selection createSelection(LocalDate date, String verseId) {
        if (selectionRepository.existsBySelectionDate(date)) {
            throw new SelectionConflictException(date);
        }
        VerseEntity verse = verseRepository.findById(verseId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown verse id: " + verseId));

        try {
            DailySelectionEntity saved = selectionRepository.saveAndFlush(new DailySelectionEntity(date, verse));
            return toSelection(saved);
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            // Unique date constraint lost to a concurrent writer
            throw new SelectionConflictException(date, e);
        }
    }

    @Override
    @Transactional
    public int discardSelections(LocalDate from, LocalDate to) {
        return selectionRepository.deleteBySelectionDateBetween(from, to);
    }

    static Verse toVerse(VerseEntity entity) {
        return new Verse(
            entity.getId(),
            entity.getBook(),
            entity.getChapter(),
            entity.getVerseNumber(),
            entity.getTextKjv()
        );
    }

    static Selection toSelection(DailySelectionEntity entity) {
        return new Selection(entity.getSelectionDate(), toVerse(entity.getVerse()));
    }
}
