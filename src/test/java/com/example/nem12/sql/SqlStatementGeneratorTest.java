package com.example.nem12.sql;

import com.example.nem12.model.MeterReading;
import com.example.nem12.sql.SqlStatementGenerator.StatementIterator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SqlStatementGeneratorTest {

    private static List<MeterReading> readings(int n) {
        List<MeterReading> out = new ArrayList<>();
        LocalDateTime base = LocalDateTime.of(2005, 3, 1, 0, 0);
        for (int i = 1; i <= n; i++) {
            out.add(new MeterReading("NEM1201009", base.plusMinutes(30L * i), BigDecimal.valueOf(i)));
        }
        return out;
    }

    private static List<String> collect(Iterator<String> it) {
        List<String> out = new ArrayList<>();
        it.forEachRemaining(out::add);
        return out;
    }

    @Test
    void singleReading() {
        MeterReading reading = new MeterReading("NEM1201009", LocalDateTime.of(2005, 3, 1, 0, 30), new BigDecimal("0.461"));

        List<String> statements = collect(new SqlStatementGenerator(100).generate(List.of(reading)));

        assertThat(statements).containsExactly(
                "INSERT INTO meter_readings (\"nmi\", \"timestamp\", \"consumption\") VALUES\n"
                        + "('NEM1201009', '2005-03-01 00:30:00', 0.461);");
    }

    @Test
    void tuplesAreJoinedWithCommaNewline() {
        List<String> statements = collect(new SqlStatementGenerator().generate(readings(2)));

        assertThat(statements).containsExactly(
                "INSERT INTO meter_readings (\"nmi\", \"timestamp\", \"consumption\") VALUES\n"
                        + "('NEM1201009', '2005-03-01 00:30:00', 1),\n"
                        + "('NEM1201009', '2005-03-01 01:00:00', 2);");
    }

    @ParameterizedTest
    @CsvSource({"5,2,3", "4,2,2", "1,1,1", "3,1000,1", "1000,1000,1", "1001,1000,2", "0,10,0"})
    void statementCountIsCeilOfReadingsOverBatch(int n, int batchSize, int expected) {
        StatementIterator it = new SqlStatementGenerator(batchSize).generate(readings(n));

        List<String> statements = collect(it);

        assertThat(statements).hasSize(expected);
        assertThat(it.getStatementCount()).isEqualTo(expected);
        assertThat(it.getReadingCount()).isEqualTo(n);
    }

    @Test
    void orderIsPreservedAcrossBatches() {
        List<String> statements = collect(new SqlStatementGenerator(2).generate(readings(5)));

        assertThat(statements.get(0)).contains("01:00:00', 2);").doesNotContain("01:30:00");
        assertThat(statements.get(1)).contains("'2005-03-01 01:30:00', 3),\n('NEM1201009', '2005-03-01 02:00:00', 4);");
        assertThat(statements.get(2)).endsWith("VALUES\n('NEM1201009', '2005-03-01 02:30:00', 5);");
    }

    @Test
    void emptyInputYieldsNoStatements() {
        Iterator<String> it = new SqlStatementGenerator().generate(Collections.<MeterReading>emptyList());

        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void readingsArePulledLazily() {
        CountingIterator source = new CountingIterator(readings(10).iterator());
        StatementIterator it = new SqlStatementGenerator(3).generate(source);

        it.next();

        assertThat(source.pulled).isEqualTo(3);
    }

    @Test
    void singleQuotesInNmiAreDoubled() {
        MeterReading reading = new MeterReading("TEST'123", LocalDateTime.of(2005, 3, 1, 0, 30), new BigDecimal("1.0"));

        String statement = collect(new SqlStatementGenerator().generate(List.of(reading))).get(0);

        assertThat(statement).contains("('TEST''123', '2005-03-01 00:30:00', 1.0)");
    }

    @Test
    void columnsAreDoubleQuoted() {
        String statement = collect(new SqlStatementGenerator().generate(readings(1))).get(0);

        assertThat(statement).contains("\"nmi\"", "\"timestamp\"", "\"consumption\"");
    }

    @Test
    void defaultBatchSize() {
        assertThat(new SqlStatementGenerator().getBatchSize()).isEqualTo(1000);
    }

    @Test
    void invalidBatchSize() {
        assertThatThrownBy(() -> new SqlStatementGenerator(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("batchSize must be at least 1");
        assertThatThrownBy(() -> new SqlStatementGenerator(-5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullReadingsAreRejected() {
        SqlStatementGenerator generator = new SqlStatementGenerator(10);

        assertThatThrownBy(() -> generator.generate((Iterable<MeterReading>) null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("readings");
        assertThatThrownBy(() -> generator.generate((Iterator<MeterReading>) null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("readings");
    }

    private static class CountingIterator implements Iterator<MeterReading> {
        private final Iterator<MeterReading> delegate;
        private int pulled;

        CountingIterator(Iterator<MeterReading> delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public MeterReading next() {
            pulled++;
            return delegate.next();
        }
    }
}
