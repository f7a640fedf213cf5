package org.example.verse.service;

import org.example.verse.entity.DailySelectionEntity;
import org.example.verse.model.CorpusStatistics;
import org.example.verse.model.CorpusStatistics.RecentSelection;
import org.example.verse.repository.DailySelectionRepository;
import org.example.verse.repository.VerseRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Service
public class CorpusStatisticsService {

    private final VerseRepository verseRepository;
    private final DailySelectionRepository selectionRepository;

    public CorpusStatisticsService(VerseRepository verseRepository,
                                   DailySelectionRepository selectionRepository) {
        this.verseRepository = verseRepository;
        this.selectionRepository = selectionRepository;
    }

    public long verseCount() {
        return verseRepository.count();
    }

    @Transactional(readOnly = true)
    public CorpusStatistics snapshot() {
        long verseCount = verseRepository.count();
        long usedVerses = selectionRepository.countDistinctSelectedVerses();

        LocalDate first = selectionRepository.findFirstByOrderBySelectionDateAsc()
            .map(DailySelectionEntity::getSelectionDate)
            .orElse(null);
        LocalDate last = selectionRepository.findFirstByOrderBySelectionDateDesc()
            .map(DailySelectionEntity::getSelectionDate)
            .orElse(null);

        List<RecentSelection> recent = selectionRepository.findTenMostRecentWithVerse().stream()
            .map(s -> new RecentSelection(
                s.getSelectionDate(),
                JpaVerseSelectionStore.toVerse(s.getVerse()).reference()))
            .toList();

        return new CorpusStatistics(
            verseCount,
            verseRepository.countDistinctBooks(),
            selectionRepository.count(),
            Math.max(0, verseCount - usedVerses),
            first,
            last,
            verseRepository.countVersesByBook(),
            recent
        );
    }
}
