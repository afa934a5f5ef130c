package io.github.manjago.mepa.persistence;

import io.github.manjago.mepa.core.ProgramImage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Program storage in plain text, one instruction per line:
 * <pre>
 * 10 INPP
 * 20 AMEM 1
 * 30 L1: CRCT 5
 * </pre>
 *
 * Blank lines and lines that do not start with a non-negative integer are
 * skipped on load, never reported as errors. A number without text stores an
 * empty line.
 */
public final class ProgramStore {

    private static final Logger log = LoggerFactory.getLogger(ProgramStore.class);

    private ProgramStore() {
        // Utility class
    }

    /**
     * Result of parsing program text.
     *
     * @param lines   line number to instruction text
     * @param skipped lines ignored because they had no leading line number
     */
    public record ParseResult(@NotNull Map<Integer, String> lines, int skipped) {}

    /**
     * Load a program file into the image, replacing its content.
     *
     * @return number of lines skipped
     */
    public static int load(@NotNull ProgramImage image, @NotNull Path path) throws IOException {
        log.debug("Loading program from {}", path);
        ParseResult result = parse(Files.readAllLines(path, StandardCharsets.UTF_8));
        image.replaceAll(result.lines(), path);
        log.info("Loaded {} lines from {} ({} skipped)", result.lines().size(), path, result.skipped());
        return result.skipped();
    }

    /**
     * Parse program text. Later duplicates of a line number replace earlier ones.
     */
    public static @NotNull ParseResult parse(@NotNull List<String> rawLines) {
        Map<Integer, String> lines = new TreeMap<>();
        int skipped = 0;

        for (String raw : rawLines) {
            String stripped = raw.strip();
            if (stripped.isEmpty()) {
                continue;
            }

            String[] parts = stripped.split("\\s+", 2);
            Integer number = parseLineNumber(parts[0]);
            if (number == null) {
                log.debug("Skipping line without line number: {}", raw);
                skipped++;
                continue;
            }
            lines.put(number, parts.length > 1 ? parts[1].strip() : "");
        }

        return new ParseResult(lines, skipped);
    }

    private static @Nullable Integer parseLineNumber(String token) {
        try {
            int number = Integer.parseInt(token);
            return number >= 0 ? number : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Save to the file the image was loaded from.
     *
     * @throws IllegalStateException if the image has no file name
     */
    public static void save(@NotNull ProgramImage image) throws IOException {
        Path path = image.getFileName();
        if (path == null) {
            throw new IllegalStateException("No file name specified");
        }
        save(image, path);
    }

    /**
     * Write the program in ascending line order and mark the image as saved.
     */
    public static void save(@NotNull ProgramImage image, @NotNull Path path) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (ProgramImage.Line line : image.sortedLines()) {
                writer.write(line.toString());
                writer.newLine();
            }
        }
        image.markSaved(path);
        log.info("Saved {} lines to {}", image.size(), path);
    }
}
