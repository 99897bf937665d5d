package com.example.nem12.parser;

import com.example.nem12.model.MeterReading;
import com.example.nem12.source.RecordSourceType;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.Reader;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Streaming parser for NEM12 interval meter data.
 *
 * Threads the context of each 200 record down to the 300 records that follow it and
 * expands every 300 record into timestamped readings, stopping at the 900 record.
 * The parser itself holds only configuration; every call to {@link #parse(Reader)} owns
 * independent state, so one instance can be reused across files.
 *
 * Example:
 * <pre>
 *   try (ReadingIterator readings = new Nem12Parser().parse(reader)) {
 *       while (readings.hasNext()) { ... }
 *   }
 * </pre>
 */
@Slf4j
public class Nem12Parser {

    @Data
    public static class Config {
        private RecordSourceType sourceType = RecordSourceType.UNIVOCITY;
        private char delimiter = ',';
        private char quoteChar = '"';
    }

    private final Config cfg;
    private final IntervalExpander expander = new IntervalExpander();

    public Nem12Parser() {
        this(new Config());
    }

    public Nem12Parser(Config cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    /**
     * Starts a lazy parse of the given input. Records are read as the iterator is pulled.
     * Fatal format errors surface as {@link Nem12FormatException} from hasNext()/next().
     */
    public ReadingIterator parse(Reader reader) {
        Objects.requireNonNull(reader, "reader");
        log.debug("Starting NEM12 parse with {} tokenizer", cfg.getSourceType());
        return new ReadingIterator(cfg.getSourceType().open(reader, cfg.getDelimiter(), cfg.getQuoteChar()), expander);
    }

    /**
     * Same as {@link #parse(Reader)} as a sequential stream. Closing the stream stops the parse.
     */
    public Stream<MeterReading> stream(Reader reader) {
        ReadingIterator it = parse(reader);
        Spliterator<MeterReading> spliterator =
                Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(it::close);
    }
}
