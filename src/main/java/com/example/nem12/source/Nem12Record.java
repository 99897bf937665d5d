package com.example.nem12.source;

import lombok.Value;

/**
 * One tokenized line of a NEM12 file.
 */
@Value
public class Nem12Record {
    long lineNumber;
    String[] fields;

    public boolean isBlank() {
        return fields == null || fields.length == 0 || fields[0] == null || fields[0].trim().isEmpty();
    }

    public String recordCode() {
        return isBlank() ? "" : fields[0].trim();
    }

    public int size() {
        return fields == null ? 0 : fields.length;
    }
}
