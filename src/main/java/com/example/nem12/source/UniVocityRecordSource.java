package com.example.nem12.source;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.Reader;

/**
 * uniVocity parser implementation.
 */
@Slf4j
public class UniVocityRecordSource implements RecordSource {

    @Data
    public static class Config {
        private char delimiter = ',';
        private char quoteChar = '"';
        // 5 minute data carries 288 values plus 7 other fields
        private int maxColumns = 2048;
    }

    private final CsvParser parser;
    private long lineNumber = 0;
    private boolean stopped = false;

    public UniVocityRecordSource(Reader inputReader, Config cfg) {
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setDelimiter(cfg.getDelimiter());
        settings.getFormat().setQuote(cfg.getQuoteChar());
        // no comment lines, every physical line is a record
        settings.getFormat().setComment('\0');
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setIgnoreLeadingWhitespaces(true);
        settings.setIgnoreTrailingWhitespaces(true);
        settings.setSkipEmptyLines(false);
        settings.setReadInputOnSeparateThread(false);
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.setMaxColumns(cfg.getMaxColumns());
        settings.setMaxCharsPerColumn(100_000);

        this.parser = new CsvParser(settings);
        this.parser.beginParsing(inputReader);
    }

    @Override
    public Nem12Record next() {
        if (stopped) {
            return null;
        }
        String[] row = parser.parseNext();
        if (row == null) {
            stopped = true;
            return null;
        }
        lineNumber++;
        return new Nem12Record(lineNumber, row);
    }

    @Override
    public void close() {
        if (!stopped) {
            stopped = true;
            parser.stopParsing();
            log.debug("uniVocity source stopped after {} lines", lineNumber);
        }
    }
}
