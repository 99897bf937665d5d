package com.example.nem12.source;

import java.io.Reader;
import java.util.Locale;

/**
 * Available tokenizer implementations.
 */
public enum RecordSourceType {
    UNIVOCITY {
        @Override
        public RecordSource open(Reader reader, char delimiter, char quoteChar) {
            UniVocityRecordSource.Config cfg = new UniVocityRecordSource.Config();
            cfg.setDelimiter(delimiter);
            cfg.setQuoteChar(quoteChar);
            return new UniVocityRecordSource(reader, cfg);
        }
    },
    COMMONS {
        @Override
        public RecordSource open(Reader reader, char delimiter, char quoteChar) {
            CommonsCsvRecordSource.Config cfg = new CommonsCsvRecordSource.Config();
            cfg.setDelimiter(delimiter);
            cfg.setQuoteChar(quoteChar);
            return new CommonsCsvRecordSource(reader, cfg);
        }
    };

    public abstract RecordSource open(Reader reader, char delimiter, char quoteChar);

    /**
     * Resolves a command line name; null selects uniVocity.
     *
     * @throws IllegalArgumentException for a name other than "univocity" or "commons"
     */
    public static RecordSourceType fromName(String name) {
        if (name == null) {
            return UNIVOCITY;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "univocity":
                return UNIVOCITY;
            case "commons":
                return COMMONS;
            default:
                throw new IllegalArgumentException("Unknown parser: " + name + " (expected univocity or commons)");
        }
    }
}
