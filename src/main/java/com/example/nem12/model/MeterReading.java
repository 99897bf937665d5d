package com.example.nem12.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single interval reading: meter identifier, the time the interval ENDS, and
 * the energy consumed during it.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class MeterReading {

    public static final int MAX_NMI_LENGTH = 10;

    private final String nmi;
    private final LocalDateTime timestamp;
    private final BigDecimal consumption;

    public MeterReading(String nmi, LocalDateTime timestamp, BigDecimal consumption) {
        if (nmi == null || nmi.isEmpty() || nmi.length() > MAX_NMI_LENGTH) {
            throw new IllegalArgumentException("Invalid NMI: '" + nmi + "' (must be 1-" + MAX_NMI_LENGTH + " characters)");
        }
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(consumption, "consumption");
        if (consumption.signum() < 0) {
            throw new IllegalArgumentException("Invalid consumption: " + consumption.toPlainString() + " (must be non-negative)");
        }
        this.nmi = nmi;
        this.timestamp = timestamp;
        this.consumption = consumption;
    }
}
