package com.example.nem12.sql;

import com.example.nem12.model.MeterReading;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Generates multi-row INSERT statements for meter readings.
 *
 * Readings are pulled lazily; each statement carries between 1 and batchSize rows and
 * input order is preserved within and across statements.
 */
public class SqlStatementGenerator {

    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final String TABLE_NAME = "meter_readings";
    public static final List<String> COLUMNS = List.of("nmi", "timestamp", "consumption");

    private static final String INSERT_PREFIX = buildInsertPrefix();

    private final int batchSize;

    public SqlStatementGenerator() {
        this(DEFAULT_BATCH_SIZE);
    }

    /**
     * @throws IllegalArgumentException if batchSize is less than 1
     */
    public SqlStatementGenerator(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public StatementIterator generate(Iterable<MeterReading> readings) {
        return generate(Objects.requireNonNull(readings, "readings").iterator());
    }

    public StatementIterator generate(Iterator<MeterReading> readings) {
        return new StatementIterator(Objects.requireNonNull(readings, "readings"));
    }

    private static String buildInsertPrefix() {
        StringBuilder sb = new StringBuilder("INSERT INTO ").append(TABLE_NAME).append(" (");
        for (int i = 0; i < COLUMNS.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append('"').append(COLUMNS.get(i)).append('"');
        }
        return sb.append(") VALUES\n").toString();
    }

    static String buildStatement(List<String> values) {
        return INSERT_PREFIX + String.join(",\n", values) + ";";
    }

    /**
     * Lazy sequence of statements over a reading iterator.
     */
    public class StatementIterator implements Iterator<String> {

        private final Iterator<MeterReading> readings;
        private final List<String> batch = new ArrayList<>();
        private long statementCount;
        private long readingCount;

        private StatementIterator(Iterator<MeterReading> readings) {
            this.readings = readings;
        }

        @Override
        public boolean hasNext() {
            return readings.hasNext();
        }

        @Override
        public String next() {
            if (!readings.hasNext()) {
                throw new NoSuchElementException();
            }
            batch.clear();
            while (batch.size() < batchSize && readings.hasNext()) {
                batch.add(SqlValueFormatter.format(readings.next()));
            }
            statementCount++;
            readingCount += batch.size();
            return buildStatement(batch);
        }

        public long getStatementCount() {
            return statementCount;
        }

        public long getReadingCount() {
            return readingCount;
        }
    }
}
