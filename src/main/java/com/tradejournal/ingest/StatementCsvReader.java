package com.tradejournal.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits statement text into a normalized header and one {@link RawRecord} per data row.
 *
 * <p>Each line is parsed on its own. Quoted fields may contain commas and doubled quotes but
 * not line breaks. Blank lines are skipped and a leading byte-order mark is dropped. A line
 * that does not parse is skipped without affecting the lines around it.
 */
@Component
public class StatementCsvReader {

    private static final Logger log = LoggerFactory.getLogger(StatementCsvReader.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();

    private static final ObjectReader ROW_READER = CSV_MAPPER.readerFor(String[].class);

    public List<RawRecord> read(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String content = text.startsWith("\uFEFF") ? text.substring(1) : text;

        List<RawRecord> records = new ArrayList<>();
        List<String> headers = null;
        int skipped = 0;
        String[] lines = LINE_BREAK.split(content);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            Optional<String[]> cells = parseLine(lines[i], i + 1);
            if (cells.isEmpty()) {
                skipped++;
                continue;
            }
            if (headers == null) {
                headers = Arrays.stream(cells.get()).map(HeaderNormalizer::normalize).toList();
                continue;
            }
            records.add(RawRecord.of(headers, Arrays.asList(cells.get())));
        }
        log.debug("Read statement CSV: columns={}, rows={}, skippedLines={}", headers, records.size(), skipped);
        return records;
    }

    private static Optional<String[]> parseLine(String line, int lineNumber) {
        try (MappingIterator<String[]> rows = ROW_READER.readValues(line)) {
            if (!rows.hasNextValue()) {
                return Optional.empty();
            }
            String[] cells = rows.nextValue();
            if (Arrays.stream(cells).allMatch(cell -> cell == null || cell.isBlank())) {
                return Optional.empty();
            }
            return Optional.of(cells);
        } catch (IOException e) {
            log.debug("Skipping malformed statement line: line={}, error={}", lineNumber, e.getMessage());
            return Optional.empty();
        }
    }
}
