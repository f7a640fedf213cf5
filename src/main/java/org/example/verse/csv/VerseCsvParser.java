package org.example.verse.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.example.verse.service.CorpusFormatException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads verse rows from CSV with a header line naming {@code book, chapter, verse, text_kjv}.
 * Extra columns are ignored.
 */
@Service
public class VerseCsvParser {

    static final List<String> REQUIRED_COLUMNS = List.of("book", "chapter", "verse", "text_kjv");

    private static final int MAX_BOOK_LENGTH = 64;
    // Matches the text_kjv column length
    static final int MAX_TEXT_LENGTH = 2000;

    private final CsvMapper csvMapper = CsvMapper.builder()
        .enable(CsvParser.Feature.TRIM_SPACES)
        .build();

    public record ParsedVerse(int lineNumber, String book, int chapter, int verseNumber, String text) {}

    public List<ParsedVerse> parse(Reader reader) throws IOException {
        CsvSchema headerSchema = CsvSchema.emptySchema().withHeader();
        List<ParsedVerse> verses = new ArrayList<>();

        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
                .with(headerSchema)
                .readValues(reader)) {
            boolean hasRows = rows.hasNextValue();
            requireColumns((CsvSchema) rows.getParserSchema());

            while (hasRows) {
                // Line where the record starts; quoted text may span several lines
                int lineNumber = rows.getCurrentLocation().getLineNr();
                Map<String, String> row = rows.nextValue();
                verses.add(toVerse(row, lineNumber));
                hasRows = rows.hasNextValue();
            }
        } catch (JsonProcessingException e) {
            throw new CorpusFormatException("Malformed verse CSV: " + e.getOriginalMessage(), e);
        }
        return verses;
    }

    private void requireColumns(CsvSchema schema) {
        List<String> missing = new ArrayList<>();
        for (String column : REQUIRED_COLUMNS) {
            if (schema == null || schema.column(column) == null) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new CorpusFormatException("Verse CSV must contain columns " + REQUIRED_COLUMNS
                    + "; missing " + missing);
        }
    }

    private ParsedVerse toVerse(Map<String, String> row, int lineNumber) {
        String book = requireText(row, "book", lineNumber);
        if (book.length() > MAX_BOOK_LENGTH) {
            throw new CorpusFormatException("Line " + lineNumber + ": book name longer than "
                    + MAX_BOOK_LENGTH + " characters");
        }
        int chapter = requirePositiveInt(row, "chapter", lineNumber);
        int verseNumber = requirePositiveInt(row, "verse", lineNumber);
        String text = requireText(row, "text_kjv", lineNumber);
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new CorpusFormatException("Line " + lineNumber + ": text_kjv longer than "
                    + MAX_TEXT_LENGTH + " characters");
        }
        return new ParsedVerse(lineNumber, book, chapter, verseNumber, text);
    }

    private String requireText(Map<String, String> row, String column, int lineNumber) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new CorpusFormatException("Line " + lineNumber + ": " + column + " is blank");
        }
        return value.trim();
    }

    private int requirePositiveInt(Map<String, String> row, String column, int lineNumber) {
        String value = requireText(row, column, lineNumber);
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new CorpusFormatException("Line " + lineNumber + ": " + column + " is not a number: '"
                    + value + "'", e);
        }
        if (parsed <= 0) {
            throw new CorpusFormatException("Line " + lineNumber + ": " + column + " must be positive, got "
                    + parsed);
        }
        return parsed;
    }
}
