package com.example.nem12.parser;

/**
 * Fatal structural error in a NEM12 input. Aborts the whole parse.
 */
public class Nem12FormatException extends RuntimeException {

    private final long lineNumber;

    public Nem12FormatException(long lineNumber, String reason) {
        super("Line " + lineNumber + ": " + reason);
        this.lineNumber = lineNumber;
    }

    public Nem12FormatException(long lineNumber, String reason, Throwable cause) {
        super("Line " + lineNumber + ": " + reason, cause);
        this.lineNumber = lineNumber;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
