package org.example.verse.service;

import org.example.verse.csv.VerseCsvParser;
import org.example.verse.csv.VerseCsvParser.ParsedVerse;
import org.example.verse.entity.VerseEntity;
import org.example.verse.repository.VerseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Bulk-loads the verse corpus. A verse is identified by book, chapter and verse number;
 * rows matching a stored verse or an earlier row of the same file are skipped.
 */
@Service
public class VerseImportService {

    private static final Logger log = LoggerFactory.getLogger(VerseImportService.class);

    private final VerseCsvParser csvParser;
    private final VerseRepository verseRepository;

    public VerseImportService(VerseCsvParser csvParser, VerseRepository verseRepository) {
        this.csvParser = csvParser;
        this.verseRepository = verseRepository;
    }

    public record ImportResult(
        int inserted,
        int skippedExisting,
        int skippedDuplicate
    ) {}

    @Transactional
    public ImportResult importCsv(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new CorpusFormatException("Verse CSV not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ImportResult result = importCsv(reader);
            log.info("Imported verses from {}: {} inserted, {} already present, {} duplicate rows",
                    path, result.inserted(), result.skippedExisting(), result.skippedDuplicate());
            return result;
        }
    }

    /**
     * Parses the whole input before writing, so a malformed row leaves the corpus untouched.
     *
     * @throws CorpusFormatException if the input is missing columns or has an invalid row
     */
    @Transactional
    public ImportResult importCsv(Reader reader) throws IOException {
        List<ParsedVerse> parsed = csvParser.parse(reader);

        Set<VerseKey> stored = new HashSet<>();
        for (VerseEntity verse : verseRepository.findAll()) {
            stored.add(new VerseKey(verse.getBook(), verse.getChapter(), verse.getVerseNumber()));
        }

        Set<VerseKey> seenInFile = new HashSet<>();
        List<VerseEntity> toInsert = new ArrayList<>();
        int skippedExisting = 0;
        int skippedDuplicate = 0;

        for (ParsedVerse row : parsed) {
            VerseKey key = new VerseKey(row.book(), row.chapter(), row.verseNumber());
            if (stored.contains(key)) {
                skippedExisting++;
                continue;
            }
            if (!seenInFile.add(key)) {
                log.debug("Line {}: duplicate of an earlier row for {} {}:{}",
                        row.lineNumber(), row.book(), row.chapter(), row.verseNumber());
                skippedDuplicate++;
                continue;
            }
            toInsert.add(new VerseEntity(row.book(), row.chapter(), row.verseNumber(), row.text()));
        }

        verseRepository.saveAll(toInsert);
        return new ImportResult(toInsert.size(), skippedExisting, skippedDuplicate);
    }

    private record VerseKey(String book, int chapter, int verseNumber) {}
}
