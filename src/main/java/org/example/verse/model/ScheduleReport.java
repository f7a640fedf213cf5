package org.example.verse.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of scheduling a consecutive range of dates.
 *
 * @param entries        resolved dates in ascending order; dates after an exhaustion are absent
 * @param scheduledCount dates that received a newly computed selection
 * @param existingCount  dates left untouched because they were already resolved
 * @param failedCount    the date that hit exhaustion plus every later date in the range
 */
public record ScheduleReport(
    LocalDate startDate,
    int dayCount,
    List<ScheduledVerse> entries,
    int scheduledCount,
    int existingCount,
    int failedCount
) {
    public boolean complete() {
        return failedCount == 0;
    }

    public record ScheduledVerse(LocalDate date, Verse verse, Status status) {}

    public enum Status {
        SCHEDULED,
        EXISTING
    }
}
