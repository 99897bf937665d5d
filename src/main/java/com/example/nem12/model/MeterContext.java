package com.example.nem12.model;

import lombok.Value;

/**
 * Meter configuration declared by a 200 (NMI data details) record. Applies to every
 * following 300 record until the next 200 record replaces it.
 *
 * 200 record layout (1-based):
 * 1 record indicator, 2 NMI, 3 NMI configuration, 4 register id, 5 NMI suffix,
 * 6 MDM data stream id, 7 meter serial number, 8 UOM, 9 interval length, 10 next scheduled read date.
 */
@Value
public class MeterContext {

    private static final int MIN_FIELDS = 9;
    private static final int NMI_INDEX = 1;
    private static final int INTERVAL_LENGTH_INDEX = 8;
    private static final int MINUTES_PER_DAY = 24 * 60;

    String nmi;
    int intervalMinutes;

    public MeterContext(String nmi, int intervalMinutes) {
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("Invalid interval length: " + intervalMinutes + " (must be positive)");
        }
        this.nmi = nmi;
        this.intervalMinutes = intervalMinutes;
    }

    /**
     * Builds a context from the tokens of a 200 record.
     *
     * @throws IllegalArgumentException if the record is too short, the NMI is blank or the
     *                                  interval length is not a positive integer
     */
    public static MeterContext fromRecord(String[] fields) {
        if (fields == null || fields.length < MIN_FIELDS) {
            int got = fields == null ? 0 : fields.length;
            throw new IllegalArgumentException("Invalid 200 record: insufficient fields (got " + got + ", need at least " + MIN_FIELDS + ")");
        }
        String nmi = trim(fields[NMI_INDEX]);
        if (nmi.isEmpty()) {
            throw new IllegalArgumentException("Invalid 200 record: empty NMI");
        }
        String rawInterval = trim(fields[INTERVAL_LENGTH_INDEX]);
        int intervalMinutes;
        try {
            intervalMinutes = Integer.parseInt(rawInterval);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid interval length in 200 record: '" + rawInterval + "'", e);
        }
        return new MeterContext(nmi, intervalMinutes);
    }

    /**
     * Number of interval values a 300 record carries for this meter.
     */
    public int intervalsPerDay() {
        return MINUTES_PER_DAY / intervalMinutes;
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }
}
