package com.example.nem12.model;

import java.util.Optional;

/**
 * NEM12 record indicators (first field of every record).
 */
public enum RecordType {
    HEADER("100"),
    NMI_DATA_DETAILS("200"),
    INTERVAL_DATA("300"),
    INTERVAL_EVENT("400"),
    B2B_DETAILS("500"),
    END_OF_DATA("900");

    private final String code;

    RecordType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<RecordType> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim();
        for (RecordType t : values()) {
            if (t.code.equals(c)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
