package com.example.nem12;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Random;

/**
 * Test data generator to create large NEM12 files for performance testing.
 *
 * Usage example:
 *   java -cp ... com.example.nem12.Nem12SampleGenerator /tmp/nem12.csv 100 365 30 20240101
 *
 * Writes 100 NMIs with a year of 30 minute data each, every interval populated.
 */
@Slf4j
public class Nem12SampleGenerator {

    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;

    public static void main(String[] args) throws Exception {
        if (args.length < 4) {
            System.out.println("Usage: Nem12SampleGenerator <outputFile> <nmiCount> <days> <intervalMinutes> [startDate=yyyyMMdd]");
            System.out.println("Example: Nem12SampleGenerator /tmp/nem12.csv 100 365 30 20240101");
            return;
        }
        Path out = Paths.get(args[0]);
        int nmiCount = Integer.parseInt(args[1]);
        int days = Integer.parseInt(args[2]);
        int intervalMinutes = Integer.parseInt(args[3]);
        LocalDate start = args.length > 4 ? LocalDate.parse(args[4], DATE) : LocalDate.of(2024, 1, 1);

        long readings = generate(out, nmiCount, days, intervalMinutes, start);
        log.info("Wrote test file {} readings={}", out.toAbsolutePath(), readings);
    }

    /**
     * @return number of interval values written, i.e. the readings a parse should yield
     */
    public static long generate(Path out, int nmiCount, int days, int intervalMinutes, LocalDate start) throws IOException {
        if (intervalMinutes <= 0 || (24 * 60) % intervalMinutes != 0) {
            throw new IllegalArgumentException("intervalMinutes must divide a day: " + intervalMinutes);
        }
        int intervalsPerDay = (24 * 60) / intervalMinutes;
        Random rnd = new Random(12345);
        long readings = 0;

        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            w.write("100,NEM12,200506081149,UNITEDDP,NEMMCO\n");
            for (int n = 0; n < nmiCount; n++) {
                String nmi = String.format("NEM%07d", n);
                w.write("200," + nmi + ",E1E2,1,E1,N1,01009,kWh," + intervalMinutes + ","
                        + DATE.format(start.plusDays(days)) + "\n");
                for (int d = 0; d < days; d++) {
                    StringBuilder sb = new StringBuilder("300,").append(DATE.format(start.plusDays(d)));
                    for (int i = 0; i < intervalsPerDay; i++) {
                        BigDecimal value = BigDecimal.valueOf(rnd.nextInt(100_000)).movePointLeft(3);
                        sb.append(',').append(value.toPlainString());
                    }
                    sb.append(",A,,,20050310121004,20050310182204\n");
                    w.write(sb.toString());
                    readings += intervalsPerDay;
                }
                if ((n & 0xFF) == 0) {
                    log.info("Generated {} NMIs", n);
                }
            }
            w.write("900\n");
        }
        return readings;
    }
}
