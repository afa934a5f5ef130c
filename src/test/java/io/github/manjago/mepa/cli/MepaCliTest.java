package io.github.manjago.mepa.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MepaCliTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cli = MepaCli.commandLine()
                .setOut(new PrintWriter(out))
                .setErr(new PrintWriter(err));
    }

    private Path program(String... lines) throws IOException {
        Path file = tempDir.resolve("program.mepa");
        Files.write(file, List.of(lines), StandardCharsets.UTF_8);
        return file;
    }

    private List<String> outLines() {
        return out.toString().lines().toList();
    }

    @Test
    @DisplayName("run prints IMPR values and exits 0")
    void run() throws IOException {
        Path file = program("10 INPP", "20 CRCT 42", "30 IMPR", "40 PARA");

        int exit = cli.execute("run", file.toString());

        assertEquals(0, exit);
        assertEquals(List.of("42"), outLines());
    }

    @Test
    @DisplayName("run reports execution errors with exit 1")
    void runError() throws IOException {
        Path file = program("10 INPP", "20 CRVL 0");

        int exit = cli.execute("run", file.toString());

        assertEquals(1, exit);
        assertTrue(err.toString().startsWith("Error: Line 20:"));
    }

    @Test
    @DisplayName("run stops at the step budget with exit 2")
    void runStepLimit() throws IOException {
        Path file = program("10 L1: DSVS L1");

        int exit = cli.execute("run", file.toString(), "--max-steps", "50");

        assertEquals(2, exit);
        assertTrue(err.toString().startsWith("Stopped after 50 steps"));
    }

    @Test
    @DisplayName("run reads the step budget from the config file")
    void runConfigBudget() throws IOException {
        Path file = program("10 L1: DSVS L1");
        Path conf = tempDir.resolve("mepa.conf");
        Files.writeString(conf, "mepa.run.max-steps = 10\n");

        int exit = cli.execute("run", file.toString(), "--config", conf.toString());

        assertEquals(2, exit);
    }

    @Test
    @DisplayName("run reports a missing file")
    void runMissingFile() {
        int exit = cli.execute("run", tempDir.resolve("nope.mepa").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().startsWith("Error: cannot read"));
    }

    @Test
    @DisplayName("debug traces every instruction")
    void debug() throws IOException {
        Path file = program("10 INPP", "20 CRCT 1", "30 IMPR", "40 PARA");

        int exit = cli.execute("debug", file.toString());

        assertEquals(0, exit);
        assertEquals(List.of(
                "Starting debug mode:",
                "10 INPP",
                "20 CRCT 1",
                "30 IMPR",
                "1",
                "40 PARA",
                "Program finished (PARA)"), outLines());
    }

    @Test
    @DisplayName("debug stops tracing a runaway program")
    void debugStepLimit() throws IOException {
        Path file = program("10 L1: NADA", "20 DSVS L1");

        int exit = cli.execute("debug", file.toString(), "-n", "3");

        assertEquals(2, exit);
        assertEquals("Stopped after 3 steps", outLines().get(outLines().size() - 1));
    }

    @Test
    @DisplayName("list --check marks unknown instructions")
    void listCheck() throws IOException {
        Path file = program("20 PARA", "10 FOO 1", "junk");

        int exit = cli.execute("list", file.toString(), "--check");

        assertEquals(1, exit);
        assertEquals(List.of(
                "10 FOO 1    ; unknown instruction",
                "20 PARA",
                "2 lines, 1 unknown instructions, 1 lines skipped"), outLines());
    }

    @Test
    @DisplayName("info lists the instruction set")
    void info() {
        int exit = cli.execute("info");

        assertEquals(0, exit);
        assertTrue(out.toString().contains("MEPA interpreter, version 1.0.0"));
        assertTrue(out.toString().contains("INPP"));
        assertTrue(out.toString().contains("IMPR"));
    }

    @Test
    @DisplayName("Missing program argument is a usage error")
    void usageError() {
        int exit = cli.execute("run");

        assertEquals(2, exit);
        assertFalse(err.toString().isEmpty());
    }
}
