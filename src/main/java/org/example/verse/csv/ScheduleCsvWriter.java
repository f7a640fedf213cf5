package org.example.verse.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.example.verse.model.ScheduleReport;
import org.example.verse.model.ScheduleReport.ScheduledVerse;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a schedule as {@code date,reference,kjv} rows in date order.
 */
@Service
public class ScheduleCsvWriter {

    private final CsvMapper csvMapper = new CsvMapper();

    @JsonPropertyOrder({"date", "reference", "kjv"})
    record ScheduleRow(String date, String reference, String kjv) {}

    public int write(ScheduleReport report, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            return write(report, writer);
        }
    }

    public int write(ScheduleReport report, Writer writer) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(ScheduleRow.class).withHeader();
        int rows = 0;
        try (SequenceWriter sequence = csvMapper.writer(schema).writeValues(writer)) {
            for (ScheduledVerse entry : report.entries()) {
                sequence.write(new ScheduleRow(
                    entry.date().toString(),
                    entry.verse().reference(),
                    entry.verse().text()
                ));
                rows++;
            }
        }
        return rows;
    }
}
