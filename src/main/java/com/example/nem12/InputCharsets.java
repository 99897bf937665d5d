package com.example.nem12;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the charset of a NEM12 input file.
 * "auto" sniffs the file with ICU4J; other names go through Charset.forName with a few
 * IBM/Cp aliases, falling back to UTF-8.
 */
@Slf4j
public final class InputCharsets {

    public static final String AUTO = "auto";
    static final int SNIFF_BYTES = 64 * 1024;

    private InputCharsets() {}

    public static Charset resolve(String name, Path file) throws IOException {
        if (name == null || name.trim().isEmpty()) return StandardCharsets.UTF_8;
        String n = name.trim();
        if (AUTO.equalsIgnoreCase(n)) {
            return detect(file);
        }
        return forName(n);
    }

    static Charset detect(Path file) throws IOException {
        byte[] head;
        try (InputStream in = Files.newInputStream(file)) {
            head = in.readNBytes(SNIFF_BYTES);
        }
        if (head.length == 0) {
            return StandardCharsets.UTF_8;
        }
        CharsetDetector detector = new CharsetDetector();
        detector.setText(head);
        CharsetMatch match = detector.detect();
        if (match == null) {
            log.warn("Unable to detect charset of {}, using UTF-8", file);
            return StandardCharsets.UTF_8;
        }
        log.info("Detected charset {} (confidence {}) for {}", match.getName(), match.getConfidence(), file);
        return forName(match.getName());
    }

    static Charset forName(String name) {
        String n = name.trim();
        if (isSupported(n)) {
            return Charset.forName(n);
        }

        String digits = n.replaceAll("\\D+", "");
        List<String> candidates = new ArrayList<>();
        if (!digits.isEmpty()) {
            candidates.add("Cp" + digits);
            candidates.add("IBM" + digits);
            candidates.add("ibm-" + digits);
            candidates.add("windows-" + digits);
        }
        for (String c : candidates) {
            if (isSupported(c)) {
                log.info("Resolved charset '{}' -> '{}'", name, c);
                return Charset.forName(c);
            }
        }

        log.warn("Failed to resolve charset '{}', falling back to UTF-8", name);
        return StandardCharsets.UTF_8;
    }

    private static boolean isSupported(String name) {
        try {
            return Charset.isSupported(name);
        } catch (IllegalCharsetNameException e) {
            log.debug("Illegal charset name '{}'", name);
            return false;
        }
    }
}
