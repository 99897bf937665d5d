package com.example.nem12.parser;

import com.example.nem12.model.MeterContext;
import com.example.nem12.model.MeterReading;
import com.example.nem12.model.RecordType;
import com.example.nem12.source.Nem12Record;
import com.example.nem12.source.RecordSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Forward-only, single-pass sequence of readings for one NEM12 input. Records are pulled
 * from the source only when the readings of the previous interval record are drained.
 * Not thread-safe; each parse gets its own instance.
 */
@Slf4j
public class ReadingIterator implements Iterator<MeterReading>, AutoCloseable {

    private final RecordSource source;
    private final IntervalExpander expander;
    private final ParseStatistics statistics = new ParseStatistics();
    private final Deque<MeterReading> pending = new ArrayDeque<>();

    private ParserState state = ParserState.initial();
    private boolean closed = false;

    ReadingIterator(RecordSource source, IntervalExpander expander) {
        this.source = source;
        this.expander = expander;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty()) {
            if (state.isDone() || closed) {
                return false;
            }
            advance();
        }
        return true;
    }

    @Override
    public MeterReading next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        statistics.incrementReadingsEmitted();
        return pending.poll();
    }

    public ParseStatistics getStatistics() {
        return statistics;
    }

    public ParserState getState() {
        return state;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            source.close();
        }
    }

    private void advance() {
        Nem12Record record;
        try {
            record = source.next();
        } catch (RuntimeException e) {
            close();
            throw e;
        }
        if (record == null) {
            log.debug("Input exhausted without 900 record after {} lines", statistics.getLinesRead());
            state = state.finish();
            return;
        }
        statistics.incrementLinesRead();
        if (record.isBlank()) {
            return;
        }

        Optional<RecordType> type = RecordType.fromCode(record.recordCode());
        if (type.isEmpty()) {
            log.trace("Line {}: ignoring unknown record type '{}'", record.getLineNumber(), record.recordCode());
            return;
        }
        try {
            switch (type.get()) {
                case NMI_DATA_DETAILS:
                    onContextRecord(record);
                    break;
                case INTERVAL_DATA:
                    onIntervalRecord(record);
                    break;
                case END_OF_DATA:
                    onEndOfData(record);
                    break;
                default:
                    // 100, 400 and 500 records carry nothing the readings need
                    break;
            }
        } catch (Nem12FormatException e) {
            pending.clear();
            close();
            throw e;
        }
    }

    private void onContextRecord(Nem12Record record) {
        MeterContext context;
        try {
            context = MeterContext.fromRecord(record.getFields());
        } catch (IllegalArgumentException e) {
            throw new Nem12FormatException(record.getLineNumber(), e.getMessage(), e);
        }
        statistics.incrementContextRecords();
        state = state.withContext(context);
        log.debug("Line {}: NMI {} with {} minute intervals", record.getLineNumber(), context.getNmi(), context.getIntervalMinutes());
    }

    private void onIntervalRecord(Nem12Record record) {
        if (!state.hasContext()) {
            throw new Nem12FormatException(record.getLineNumber(), "300 interval record without preceding 200 record");
        }
        statistics.incrementIntervalRecords();
        expander.expand(state.getContext(), record, pending::add, statistics);
    }

    private void onEndOfData(Nem12Record record) {
        log.debug("Line {}: end of data", record.getLineNumber());
        statistics.setEndOfDataSeen(true);
        state = state.finish();
        close();
    }
}
