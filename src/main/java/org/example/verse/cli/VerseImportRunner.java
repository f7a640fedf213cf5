package org.example.verse.cli;

import org.example.verse.service.VerseImportService;
import org.example.verse.service.VerseImportService.ImportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Loads the verse corpus from a CSV file with columns {@code book,chapter,verse,text_kjv}.
 *
 * Run with: java -jar target/daily-verse.jar --spring.profiles.active=import-verses
 *     --verses.import.csv-path=data/kjv.csv
 */
@Component
@Profile("import-verses")
@Order(1)
public class VerseImportRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(VerseImportRunner.class);

    private final VerseImportService verseImportService;

    @Value("${verses.import.csv-path:}")
    private String csvPath;

    public VerseImportRunner(VerseImportService verseImportService) {
        this.verseImportService = verseImportService;
    }

    @Override
    public void run(String... args) throws Exception {
        if (csvPath == null || csvPath.isBlank()) {
            throw new IllegalStateException("verses.import.csv-path must point to a verse CSV file");
        }

        Path path = Path.of(csvPath.trim());
        log.info("Importing verses from {}", path.toAbsolutePath());
        ImportResult result = verseImportService.importCsv(path);
        log.info("Inserted {} verses ({} already present, {} duplicate rows skipped)",
                result.inserted(), result.skippedExisting(), result.skippedDuplicate());
    }
}
