package com.example.nem12.parser;

import com.example.nem12.model.MeterContext;
import com.example.nem12.model.MeterReading;
import com.example.nem12.source.Nem12Record;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.function.Consumer;

/**
 * Turns a 300 (interval data) record into one reading per populated interval.
 *
 * 300 record layout (1-based):
 * 1 record indicator, 2 interval date (YYYYMMDD), 3.. one consumption value per interval,
 * followed by quality method, reason code, reason description, update and MSATS load times.
 * Interval i ends at date + i * intervalLength minutes, so the last interval of a full day
 * ends at midnight of the following day.
 */
@Slf4j
public class IntervalExpander {

    static final int MIN_FIELDS = 3;
    private static final int DATE_INDEX = 1;
    private static final int FIRST_VALUE_INDEX = 2;

    private static final DateTimeFormatter INTERVAL_DATE =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    /**
     * Emits the readings of one interval record in interval order.
     *
     * @return number of readings emitted
     * @throws Nem12FormatException if the record is too short, the date is malformed or a
     *                              reading violates its invariants
     */
    public int expand(MeterContext context, Nem12Record record, Consumer<MeterReading> out, ParseStatistics stats) {
        long line = record.getLineNumber();
        String[] fields = record.getFields();
        if (record.size() < MIN_FIELDS) {
            throw new Nem12FormatException(line, "Invalid 300 record - insufficient fields (got " + record.size() + ")");
        }

        LocalDate intervalDate = parseDate(line, fields[DATE_INDEX]);
        LocalDateTime midnight = intervalDate.atStartOfDay();
        int intervalMinutes = context.getIntervalMinutes();
        int end = Math.min(FIRST_VALUE_INDEX + context.intervalsPerDay(), fields.length);

        int emitted = 0;
        for (int idx = FIRST_VALUE_INDEX; idx < end; idx++) {
            int interval = idx - FIRST_VALUE_INDEX + 1;
            String raw = fields[idx] == null ? "" : fields[idx].trim();
            if (raw.isEmpty()) {
                continue;
            }
            BigDecimal consumption = parseConsumption(raw);
            if (consumption == null) {
                log.warn("Line {}: Skipping invalid consumption value '{}' at interval {}", line, raw, interval);
                stats.incrementSkippedValues();
                continue;
            }
            LocalDateTime timestamp = midnight.plusMinutes((long) interval * intervalMinutes);
            MeterReading reading;
            try {
                reading = new MeterReading(context.getNmi(), timestamp, consumption);
            } catch (IllegalArgumentException e) {
                throw new Nem12FormatException(line, e.getMessage(), e);
            }
            out.accept(reading);
            emitted++;
        }
        return emitted;
    }

    private static LocalDate parseDate(long line, String field) {
        String raw = field == null ? "" : field.trim();
        if (raw.length() != 8) {
            throw new Nem12FormatException(line, "Invalid date format '" + raw + "'");
        }
        try {
            return LocalDate.parse(raw, INTERVAL_DATE);
        } catch (DateTimeParseException e) {
            throw new Nem12FormatException(line, "Invalid date format '" + raw + "'", e);
        }
    }

    // null for text that is not a decimal; sign is checked by MeterReading
    private static BigDecimal parseConsumption(String raw) {
        try {
            return new BigDecimal(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
