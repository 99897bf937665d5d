package com.example.nem12;

import com.example.nem12.parser.Nem12Parser;
import com.example.nem12.parser.ParseStatistics;
import com.example.nem12.parser.ReadingIterator;
import com.example.nem12.sql.SqlStatementGenerator;
import com.example.nem12.sql.SqlStatementGenerator.StatementIterator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Pipes a NEM12 input through the parser and statement generator into a SQL script,
 * framed by a header and a trailing reading count.
 */
@Slf4j
public class Nem12SqlConverter {

    static final long PROGRESS_EVERY = 100_000;

    private final Nem12Parser parser;
    private final SqlStatementGenerator generator;
    private final Clock clock;

    public Nem12SqlConverter(Nem12Parser parser, SqlStatementGenerator generator) {
        this(parser, generator, Clock.systemDefaultZone());
    }

    Nem12SqlConverter(Nem12Parser parser, SqlStatementGenerator generator, Clock clock) {
        this.parser = parser;
        this.generator = generator;
        this.clock = clock;
    }

    /**
     * Converts one input. Statements already written stay written if the input turns out
     * to be malformed further down.
     *
     * @return number of readings written
     */
    public long convert(String sourceName, Reader input, Writer output) throws IOException {
        long start = System.currentTimeMillis();
        output.write("-- Generated from: " + sourceName + "\n");
        output.write("-- Generated at: " + LocalDateTime.now(clock) + "\n");
        output.write("-- Batch size: " + generator.getBatchSize() + "\n\n");

        ParseStatistics stats;
        StatementIterator statements;
        try (ReadingIterator readings = parser.parse(input)) {
            stats = readings.getStatistics();
            statements = generator.generate(readings);
            long nextProgress = PROGRESS_EVERY;
            while (statements.hasNext()) {
                output.write(statements.next());
                output.write("\n\n");
                if (statements.getReadingCount() >= nextProgress) {
                    log.info("Written {} readings", statements.getReadingCount());
                    output.flush();
                    nextProgress += PROGRESS_EVERY;
                }
            }
        }

        long total = statements.getReadingCount();
        output.write("-- Total readings: " + total + "\n");
        output.flush();

        long end = System.currentTimeMillis();
        log.info("Completed {}. Readings: {}, Statements: {}, Skipped values: {}, Time(s): {}",
                sourceName, total, statements.getStatementCount(), stats.getSkippedValues(), (end - start) / 1000.0);
        if (!stats.isEndOfDataSeen()) {
            log.warn("{} has no 900 end of data record", sourceName);
        }
        return total;
    }
}
