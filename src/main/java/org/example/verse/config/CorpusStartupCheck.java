package org.example.verse.config;

import org.example.verse.model.CorpusStatistics;
import org.example.verse.service.CorpusStatisticsService;
import org.example.verse.service.VerseCorpusEmptyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Reports the corpus state once at startup. An empty corpus is a configuration error,
 * fatal when {@code verse.corpus.require-non-empty} is set.
 */
@Component
@Order(10) // Run after the sample and import runners
public class CorpusStartupCheck implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CorpusStartupCheck.class);

    private final CorpusStatisticsService statisticsService;
    private final boolean requireNonEmpty;

    public CorpusStartupCheck(
            CorpusStatisticsService statisticsService,
            @Value("${verse.corpus.require-non-empty:false}") boolean requireNonEmpty) {
        this.statisticsService = statisticsService;
        this.requireNonEmpty = requireNonEmpty;
    }

    @Override
    public void run(String... args) {
        CorpusStatistics stats = statisticsService.snapshot();
        if (stats.verseCount() == 0) {
            String message = "Verse corpus is empty; load it with the 'import-verses' profile";
            if (requireNonEmpty) {
                throw new VerseCorpusEmptyException(message);
            }
            log.error(message);
            return;
        }

        log.info("Verse corpus: {} verses across {} books; {} selections recorded, {} verses unused",
                stats.verseCount(), stats.bookCount(), stats.selectionCount(), stats.unusedVerseCount());
        if (stats.unusedVerseCount() == 0) {
            log.warn("Every verse has been selected; new dates will fail until history is reset or the corpus is extended");
        }
    }
}
