package org.example.verse.cli;

import org.example.verse.csv.ScheduleCsvWriter;
import org.example.verse.model.ScheduleReport;
import org.example.verse.service.VerseScheduleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Pre-generates verse selections for a date range and exports them to CSV.
 *
 * Run with: java -jar target/daily-verse.jar --spring.profiles.active=schedule
 *     --schedule.start=2025-01-01 --schedule.days=30 --schedule.out=data/schedule.csv
 * Add --schedule.overwrite=true to recompute dates that already have a selection.
 */
@Component
@Profile("schedule")
@Order(2)
public class VerseScheduleRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(VerseScheduleRunner.class);

    private final VerseScheduleService verseScheduleService;
    private final ScheduleCsvWriter scheduleCsvWriter;
    private final Clock clock;

    @Value("${schedule.start:}")
    private String start;

    @Value("${schedule.days:30}")
    private int days;

    @Value("${schedule.overwrite:false}")
    private boolean overwrite;

    @Value("${schedule.out:}")
    private String out;

    public VerseScheduleRunner(
            VerseScheduleService verseScheduleService,
            ScheduleCsvWriter scheduleCsvWriter,
            Clock clock) {
        this.verseScheduleService = verseScheduleService;
        this.scheduleCsvWriter = scheduleCsvWriter;
        this.clock = clock;
    }

    @Override
    public void run(String... args) throws Exception {
        if (out == null || out.isBlank()) {
            throw new IllegalStateException("schedule.out must name the CSV file to write");
        }
        LocalDate startDate = resolveStartDate();
        Path output = Path.of(out.trim());

        log.info("Scheduling {} days from {} (overwrite: {})", days, startDate, overwrite);
        ScheduleReport report = verseScheduleService.scheduleRange(startDate, days, overwrite);
        int rows = scheduleCsvWriter.write(report, output);

        log.info("Schedule written to {} ({} rows)", output.toAbsolutePath(), rows);
        log.info("  - Scheduled: {}", report.scheduledCount());
        log.info("  - Already present: {}", report.existingCount());
        if (!report.complete()) {
            log.warn("  - Failed: {} (verse corpus exhausted; reset history or extend the corpus)",
                    report.failedCount());
        }
    }

    private LocalDate resolveStartDate() {
        if (start == null || start.isBlank()) {
            return LocalDate.now(clock);
        }
        try {
            return LocalDate.parse(start.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("schedule.start must be an ISO date (YYYY-MM-DD): " + start, e);
        }
    }
}
