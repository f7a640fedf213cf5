package org.example.verse.service;

import org.example.verse.model.ScheduleReport;
import org.example.verse.model.ScheduleReport.ScheduledVerse;
import org.example.verse.model.ScheduleReport.Status;
import org.example.verse.model.Selection;
import org.example.verse.model.Verse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pre-generates selections for a run of consecutive dates.
 */
@Service
public class VerseScheduleService {

    private static final Logger log = LoggerFactory.getLogger(VerseScheduleService.class);

    private final VerseSelectionService selectionService;
    private final VerseSelectionStore store;

    public VerseScheduleService(VerseSelectionService selectionService, VerseSelectionStore store) {
        this.selectionService = selectionService;
        this.store = store;
    }

    /**
     * Resolves {@code dayCount} dates starting at {@code startDate}.
     *
     * <p>Without {@code overwrite}, dates that already have a selection are reported as
     * {@link Status#EXISTING}. With it, each date's selection is discarded just before that
     * date is recomputed, so each day's chapter rule sees the freshly chosen previous day and
     * dates the run never reaches keep their selection. Exhaustion stops the run; the
     * remaining dates count as failed.
     */
    public ScheduleReport scheduleRange(LocalDate startDate, int dayCount, boolean overwrite) {
        if (startDate == null) {
            throw new IllegalArgumentException("startDate is required");
        }
        if (dayCount <= 0) {
            throw new IllegalArgumentException("dayCount must be positive, got " + dayCount);
        }

        LocalDate endDate = startDate.plusDays(dayCount - 1L);
        List<ScheduledVerse> entries = new ArrayList<>();
        int scheduled = 0;
        int existingCount = 0;
        int failed = 0;
        int discarded = 0;

        for (int offset = 0; offset < dayCount; offset++) {
            LocalDate date = startDate.plusDays(offset);

            Optional<Selection> existing = Optional.empty();
            if (overwrite) {
                discarded += store.discardSelections(date, date);
            } else {
                existing = store.selectionFor(date);
            }
            if (existing.isPresent()) {
                entries.add(new ScheduledVerse(date, existing.get().verse(), Status.EXISTING));
                existingCount++;
                continue;
            }

            try {
                Verse verse = selectionService.resolveVerseForDate(date);
                entries.add(new ScheduledVerse(date, verse, Status.SCHEDULED));
                scheduled++;
            } catch (VerseCorpusExhaustedException e) {
                failed = dayCount - offset;
                log.warn("Verse corpus exhausted at {}; {} of {} dates not scheduled", date, failed, dayCount);
                break;
            }
        }

        log.info("Schedule {}..{}: {} scheduled, {} existing, {} failed, {} replaced",
                startDate, endDate, scheduled, existingCount, failed, discarded);
        return new ScheduleReport(startDate, dayCount, List.copyOf(entries), scheduled, existingCount, failed);
    }
}
