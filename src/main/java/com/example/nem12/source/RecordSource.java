package com.example.nem12.source;

import java.io.Closeable;

/**
 * CSV tokenizer strategy interface to allow switching between uniVocity and Commons CSV.
 * Implementations pull one line at a time from the underlying Reader and number every
 * physical line, blank ones included.
 */
public interface RecordSource extends Closeable {

    /**
     * @return the next record, or null when the input is exhausted
     */
    Nem12Record next();

    /**
     * Stops tokenizing. Lines not yet pulled are never read.
     */
    @Override
    void close();
}
