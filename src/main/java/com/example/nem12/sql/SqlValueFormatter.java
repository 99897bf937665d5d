package com.example.nem12.sql;

import com.example.nem12.model.MeterReading;

import java.time.format.DateTimeFormatter;

/**
 * Renders a reading as a SQL value tuple: ('nmi', 'yyyy-MM-dd HH:mm:ss', consumption).
 */
public final class SqlValueFormatter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");

    private SqlValueFormatter() {}

    public static String format(MeterReading reading) {
        StringBuilder sb = new StringBuilder(48);
        sb.append("('")
                .append(escape(reading.getNmi()))
                .append("', '")
                .append(TIMESTAMP.format(reading.getTimestamp()))
                .append("', ")
                .append(reading.getConsumption().toPlainString())
                .append(')');
        return sb.toString();
    }

    /**
     * Doubles single quotes so the value can sit inside a SQL string literal.
     */
    public static String escape(String text) {
        return text.replace("'", "''");
    }
}
