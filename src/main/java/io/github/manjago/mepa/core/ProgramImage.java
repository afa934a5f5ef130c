package io.github.manjago.mepa.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The editable program: a sparse map from line number to raw instruction text.
 * <p>
 * Line numbers are unique and non-negative. Execution order is ascending line
 * number, whatever order the lines were inserted in. Lines are stored as text
 * and reparsed by {@link LoadedProgram} whenever the engine rebuilds.
 */
public final class ProgramImage {

    private final TreeMap<Integer, String> lines = new TreeMap<>();

    /** True when there are edits not yet written to {@link #fileName}. */
    private boolean modified;

    /** File the program was loaded from or last saved to. */
    private Path fileName;

    /**
     * A single program line.
     */
    public record Line(int number, @NotNull String text) {
        @Override
        public String toString() {
            return number + " " + text;
        }
    }

    // ========== Editing ==========

    /**
     * Insert or replace a line.
     *
     * @return true if an existing line was replaced
     */
    public boolean setLine(int number, @NotNull String text) {
        if (number < 0) {
            throw new IllegalArgumentException("Line number must not be negative: " + number);
        }
        String previous = lines.put(number, text.strip());
        modified = true;
        return previous != null;
    }

    /**
     * Remove a single line.
     *
     * @return true if the line existed
     */
    public boolean deleteLine(int number) {
        if (lines.remove(number) != null) {
            modified = true;
            return true;
        }
        return false;
    }

    /**
     * Remove every line in {@code [from, to]}.
     *
     * @return removed lines in ascending order (empty if none matched)
     */
    public @NotNull List<Line> deleteRange(int from, int to) {
        if (from > to) {
            throw new IllegalArgumentException("Invalid range: " + from + " > " + to);
        }
        Map<Integer, String> range = lines.subMap(from, true, to, true);
        List<Line> removed = new ArrayList<>(range.size());
        range.forEach((n, text) -> removed.add(new Line(n, text)));
        range.clear();
        if (!removed.isEmpty()) {
            modified = true;
        }
        return removed;
    }

    /**
     * Replace the whole program with loaded content. Clears the modified flag.
     */
    public void replaceAll(@NotNull Map<Integer, String> content, @Nullable Path source) {
        lines.clear();
        lines.putAll(content);
        fileName = source;
        modified = false;
    }

    /**
     * Remove all lines and forget the file name.
     */
    public void clear() {
        lines.clear();
        modified = false;
        fileName = null;
    }

    // ========== Queries ==========

    public @Nullable String getText(int number) {
        return lines.get(number);
    }

    public boolean contains(int number) {
        return lines.containsKey(number);
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * @return all lines in ascending line-number order
     */
    public @NotNull List<Line> sortedLines() {
        List<Line> result = new ArrayList<>(lines.size());
        lines.forEach((n, text) -> result.add(new Line(n, text)));
        return result;
    }

    // ========== File state ==========

    public boolean isModified() {
        return modified;
    }

    public @Nullable Path getFileName() {
        return fileName;
    }

    /**
     * Record a successful save.
     */
    public void markSaved(@NotNull Path path) {
        this.fileName = path;
        this.modified = false;
    }
}
