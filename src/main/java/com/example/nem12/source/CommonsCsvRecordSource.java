package com.example.nem12.source;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;

/**
 * Apache Commons CSV implementation (alternative).
 */
@Slf4j
public class CommonsCsvRecordSource implements RecordSource {

    @Data
    public static class Config {
        private char delimiter = ',';
        private char quoteChar = '"';
    }

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private long lineNumber = 0;
    private boolean stopped = false;

    public CommonsCsvRecordSource(Reader inputReader, Config cfg) {
        CSVFormat format = CSVFormat.DEFAULT
                .withDelimiter(cfg.getDelimiter())
                .withQuote(cfg.getQuoteChar())
                .withIgnoreEmptyLines(false)
                .withIgnoreSurroundingSpaces();
        try {
            this.parser = format.parse(inputReader);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to open CSV input", e);
        }
        this.records = parser.iterator();
    }

    @Override
    public Nem12Record next() {
        if (stopped || !records.hasNext()) {
            stopped = true;
            return null;
        }
        CSVRecord rec = records.next();
        String[] fields = new String[rec.size()];
        for (int i = 0; i < fields.length; i++) {
            fields[i] = rec.get(i);
        }
        lineNumber++;
        return new Nem12Record(lineNumber, fields);
    }

    @Override
    public void close() {
        stopped = true;
        try {
            parser.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to close CSV input", e);
        }
        log.debug("commons-csv source stopped after {} lines", lineNumber);
    }
}
