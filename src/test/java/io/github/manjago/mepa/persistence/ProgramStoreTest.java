package io.github.manjago.mepa.persistence;

import io.github.manjago.mepa.core.ProgramImage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProgramStoreTest {

    @TempDir
    Path tempDir;

    private Path copyResource(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream is = ProgramStoreTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(is, name + " should be in test resources");
            Files.copy(is, target);
        }
        return target;
    }

    @Test
    @DisplayName("Parse keeps numbered lines and counts the rest as skipped")
    void parseSkipsUnnumbered() {
        ProgramStore.ParseResult result = ProgramStore.parse(List.of(
                "10 INPP",
                "",
                "junk",
                "  20   CRCT 5  ",
                "-3 NADA",
                "30"));

        assertEquals(Map.of(10, "INPP", 20, "CRCT 5", 30, ""), result.lines());
        assertEquals(2, result.skipped());
    }

    @Test
    @DisplayName("Later duplicates of a line number win")
    void parseDuplicates() {
        ProgramStore.ParseResult result = ProgramStore.parse(List.of("10 CRCT 1", "10 CRCT 2"));

        assertEquals(Map.of(10, "CRCT 2"), result.lines());
    }

    @Test
    @DisplayName("Load replaces the image content and remembers the file")
    void loadReplaces() throws IOException {
        Path file = copyResource("malformed.mepa");
        ProgramImage image = new ProgramImage();
        image.setLine(99, "NADA");

        int skipped = ProgramStore.load(image, file);

        assertEquals(3, skipped);
        assertEquals(4, image.size());
        assertFalse(image.contains(99));
        assertEquals("CRCT 7", image.getText(20));
        assertEquals(file, image.getFileName());
        assertFalse(image.isModified());
    }

    @Test
    @DisplayName("Loading a missing file fails")
    void loadMissing() {
        ProgramImage image = new ProgramImage();

        assertThrows(NoSuchFileException.class,
                () -> ProgramStore.load(image, tempDir.resolve("missing.mepa")));
    }

    @Test
    @DisplayName("Save writes lines in ascending order")
    void saveOrdered() throws IOException {
        ProgramImage image = new ProgramImage();
        image.setLine(30, "PARA");
        image.setLine(10, "INPP");
        image.setLine(20, "L1: CRCT 5");
        Path file = tempDir.resolve("out.mepa");

        ProgramStore.save(image, file);

        assertEquals(List.of("10 INPP", "20 L1: CRCT 5", "30 PARA"),
                Files.readAllLines(file, StandardCharsets.UTF_8));
        assertEquals(file, image.getFileName());
        assertFalse(image.isModified());
    }

    @Test
    @DisplayName("Saved program loads back unchanged")
    void saveThenLoad() throws IOException {
        ProgramImage original = new ProgramImage();
        ProgramStore.load(original, copyResource("factorial.mepa"));
        Path file = tempDir.resolve("copy.mepa");
        ProgramStore.save(original, file);

        ProgramImage copy = new ProgramImage();
        int skipped = ProgramStore.load(copy, file);

        assertEquals(0, skipped);
        assertEquals(original.sortedLines(), copy.sortedLines());
    }

    @Test
    @DisplayName("Save without a file name is rejected")
    void saveWithoutFileName() {
        ProgramImage image = new ProgramImage();
        image.setLine(10, "INPP");

        assertThrows(IllegalStateException.class, () -> ProgramStore.save(image));
    }
}
