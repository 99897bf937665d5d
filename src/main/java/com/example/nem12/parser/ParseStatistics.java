package com.example.nem12.parser;

import lombok.Data;

/**
 * Counters for one parse invocation.
 */
@Data
public class ParseStatistics {
    private long linesRead;
    private long contextRecords;
    private long intervalRecords;
    private long readingsEmitted;
    private long skippedValues;
    private boolean endOfDataSeen;

    void incrementLinesRead() {
        linesRead++;
    }

    void incrementContextRecords() {
        contextRecords++;
    }

    void incrementIntervalRecords() {
        intervalRecords++;
    }

    void incrementReadingsEmitted() {
        readingsEmitted++;
    }

    void incrementSkippedValues() {
        skippedValues++;
    }
}
