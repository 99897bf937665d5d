package com.example.nem12;

import com.example.nem12.parser.Nem12FormatException;
import com.example.nem12.parser.Nem12Parser;
import com.example.nem12.source.RecordSourceType;
import com.example.nem12.sql.SqlStatementGenerator;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.*;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Command line entry point: converts a NEM12 file into SQL INSERT statements for the
 * meter_readings table.
 *
 * Example usage:
 * java -jar nem12-sql-converter.jar sample.csv --output meter_readings.sql --batch-size 5000
 */
@Slf4j
public class Nem12SqlMain {

    public static final int EXIT_OK = 0;
    public static final int EXIT_MALFORMED_INPUT = 1;
    public static final int EXIT_FAILURE = 2;

    @Data
    public static class Options {
        private File inputFile;
        private File outputFile; // stdout when null
        private int batchSize = SqlStatementGenerator.DEFAULT_BATCH_SIZE;
        private String parser = "univocity"; // or "commons"
        private String inputCharset = "UTF-8"; // or "auto"
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 1) {
            printUsage();
            return EXIT_FAILURE;
        }
        Options options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            return EXIT_FAILURE;
        }
        log.info("Options: {}", options);

        File input = options.getInputFile();
        if (!input.exists()) {
            System.err.println("Error: Input file not found: " + input);
            return EXIT_FAILURE;
        }
        if (!input.isFile()) {
            System.err.println("Error: Not a file: " + input);
            return EXIT_FAILURE;
        }

        try {
            long total = process(options);
            System.err.println("Successfully processed " + total + " readings.");
            return EXIT_OK;
        } catch (Nem12FormatException e) {
            log.error("Malformed NEM12 input {}: {}", input, e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_MALFORMED_INPUT;
        } catch (Exception e) {
            log.error("Conversion failed: {}", e.getMessage(), e);
            System.err.println("Unexpected error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static long process(Options options) throws IOException {
        Nem12Parser.Config pcfg = new Nem12Parser.Config();
        pcfg.setSourceType(RecordSourceType.fromName(options.getParser()));
        Nem12SqlConverter converter = new Nem12SqlConverter(
                new Nem12Parser(pcfg), new SqlStatementGenerator(options.getBatchSize()));

        File input = options.getInputFile();
        Charset inCharset = InputCharsets.resolve(options.getInputCharset(), input.toPath());

        try (Reader reader = Files.newBufferedReader(input.toPath(), inCharset)) {
            if (options.getOutputFile() == null) {
                // System.out stays open for whoever owns it
                Writer writer = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
                long total = converter.convert(input.getName(), reader, writer);
                writer.flush();
                return total;
            }
            try (Writer writer = Files.newBufferedWriter(options.getOutputFile().toPath(), StandardCharsets.UTF_8)) {
                return converter.convert(input.getName(), reader, writer);
            }
        }
    }

    static Options parseArgs(String[] args) {
        Options options = new Options();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o":
                case "--output":
                    options.setOutputFile(new File(value(args, ++i, arg)));
                    break;
                case "-b":
                case "--batch-size":
                    String raw = value(args, ++i, arg);
                    try {
                        options.setBatchSize(Integer.parseInt(raw));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid batch size: " + raw, e);
                    }
                    if (options.getBatchSize() < 1) {
                        throw new IllegalArgumentException("batchSize must be at least 1");
                    }
                    break;
                case "-p":
                case "--parser":
                    String parser = value(args, ++i, arg);
                    RecordSourceType.fromName(parser);
                    options.setParser(parser);
                    break;
                case "-c":
                case "--charset":
                    options.setInputCharset(value(args, ++i, arg));
                    break;
                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (options.getInputFile() != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    options.setInputFile(new File(arg));
            }
        }
        if (options.getInputFile() == null) {
            throw new IllegalArgumentException("Missing input file");
        }
        return options;
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[i];
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar nem12-sql-converter.jar <inputFile> [-o|--output <file>] [-b|--batch-size <n>] [-p|--parser univocity|commons] [-c|--charset <name>|auto]");
        System.err.println("Example: java -jar nem12-sql-converter.jar sample.csv --output meter_readings.sql --batch-size 5000");
    }
}
