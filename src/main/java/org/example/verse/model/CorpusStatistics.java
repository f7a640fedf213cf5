package org.example.verse.model;

import java.time.LocalDate;
import java.util.List;

public record CorpusStatistics(
    long verseCount,
    long bookCount,
    long selectionCount,
    long unusedVerseCount,
    LocalDate firstSelectionDate,
    LocalDate lastSelectionDate,
    List<BookVerseCount> versesPerBook,
    List<RecentSelection> recentSelections
) {
    public record RecentSelection(LocalDate date, String reference) {}
}
