package io.github.manjago.mepa.cli;

import io.github.manjago.mepa.config.MepaConfig;
import io.github.manjago.mepa.core.MepaException;
import io.github.manjago.mepa.core.ProgramImage;
import io.github.manjago.mepa.core.RunReport;
import io.github.manjago.mepa.core.VirtualMachine;
import io.github.manjago.mepa.debug.DebugController;
import io.github.manjago.mepa.debug.DebugReport;
import io.github.manjago.mepa.debug.DebugState;
import io.github.manjago.mepa.debug.SnapshotPrinter;
import io.github.manjago.mepa.persistence.ProgramStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Interactive command loop: program editor, runner and debugger.
 *
 * <h2>Commands (case-insensitive):</h2>
 * <pre>
 * LOAD &lt;file&gt;          load a program file
 * LIST                 list the program, one page at a time
 * INS &lt;n&gt; &lt;instr&gt;      insert or replace line n
 * DEL &lt;n&gt; [&lt;m&gt;]        delete line n, or lines n..m
 * SAVE                 save to the loaded file
 * RUN                  run the program
 * DEBUG                start single-step mode
 * NEXT                 execute the next instruction
 * STOP                 leave single-step mode
 * STACK                show memory and stack (single-step mode only)
 * EXIT                 quit
 * </pre>
 *
 * Errors are printed and never end the loop.
 */
public class MepaShell {

    private static final Logger log = LoggerFactory.getLogger(MepaShell.class);

    /** Commands that end an active debug session before running. */
    private static final Set<String> ENDS_DEBUG = Set.of("LOAD", "RUN", "INS", "DEL", "EXIT");

    private final MepaConfig config;
    private final BufferedReader in;
    private final PrintWriter out;

    private final ProgramImage program = new ProgramImage();
    private final VirtualMachine vm;
    private final DebugController debugger;
    private final SnapshotPrinter printer;

    private boolean exitRequested;

    public MepaShell(@NotNull MepaConfig config, @NotNull BufferedReader in, @NotNull PrintWriter out) {
        this.config = config;
        this.in = in;
        this.out = out;
        this.vm = new VirtualMachine(program, (line, value) -> {
            out.println(value);
            out.flush();
        });
        this.vm.setMaxMemory(config.maxMemory());
        this.debugger = new DebugController(vm);
        this.printer = new SnapshotPrinter(out).showOutputs(false);
    }

    /**
     * Read and execute commands until EXIT or end of input.
     */
    public void run() {
        out.println("MEPA interpreter - type EXIT to quit");

        try {
            while (!exitRequested) {
                out.print(config.prompt());
                out.flush();

                String line = in.readLine();
                if (line == null) {
                    out.println();
                    out.println("Exiting...");
                    break;
                }
                execute(line);
            }
        } catch (IOException | UncheckedIOException e) {
            log.error("Input closed unexpectedly", e);
        }
        out.flush();
    }

    /**
     * Execute one command line.
     *
     * @return false once EXIT was executed
     */
    public boolean execute(@NotNull String input) {
        String trimmed = input.strip();
        if (trimmed.isEmpty()) {
            return !exitRequested;
        }

        String[] parts = trimmed.split("\\s+", 2);
        String command = parts[0].toUpperCase(Locale.ROOT);
        String args = parts.length > 1 ? parts[1].strip() : "";

        if (ENDS_DEBUG.contains(command) && debugger.isActive()) {
            stopDebug();
        }

        switch (command) {
            case "EXIT" -> exit();
            case "LOAD" -> load(args);
            case "LIST" -> list();
            case "INS" -> insert(args);
            case "DEL" -> delete(args);
            case "SAVE" -> save();
            case "RUN" -> runProgram();
            case "DEBUG" -> startDebug();
            case "NEXT" -> next();
            case "STOP" -> {
                if (debugger.isActive()) {
                    stopDebug();
                } else {
                    out.println("Not in debug mode");
                }
            }
            case "STACK" -> stack();
            default -> out.println("Error: invalid command");
        }
        out.flush();
        return !exitRequested;
    }

    // ========== File commands ==========

    private void exit() {
        offerSave("Unsaved changes. Save before exiting? (y/n): ");
        out.println("Exiting...");
        exitRequested = true;
    }

    private void load(String args) {
        if (args.isEmpty()) {
            out.println("Error: specify the file name");
            return;
        }
        offerSave("Unsaved changes. Save before loading another file? (y/n): ");

        Path path = Path.of(args);
        try {
            int skipped = ProgramStore.load(program, path);
            vm.rebuild();
            out.println("File '" + args + "' loaded successfully.");
            if (skipped > 0) {
                log.info("{} lines without line number skipped in {}", skipped, path);
            }
        } catch (NoSuchFileException e) {
            out.println("Error: file '" + args + "' not found");
        } catch (IOException e) {
            out.println("Error loading file: " + e.getMessage());
        }
    }

    private void save() {
        if (program.isEmpty()) {
            out.println("Error: no code in memory to save");
            return;
        }
        saveProgram();
    }

    private void saveProgram() {
        try {
            ProgramStore.save(program);
            out.println("File '" + program.getFileName() + "' saved successfully");
        } catch (IllegalStateException | IOException e) {
            out.println("Error saving file: " + e.getMessage());
        }
    }

    private void offerSave(String question) {
        if (!program.isModified()) {
            return;
        }
        out.print(question);
        out.flush();
        String answer = readAnswer();
        if (answer.equals("y") || answer.equals("s")) {
            saveProgram();
        }
    }

    private String readAnswer() {
        try {
            String answer = in.readLine();
            return answer == null ? "" : answer.strip().toLowerCase(Locale.ROOT);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // ========== Editor commands ==========

    private void list() {
        List<ProgramImage.Line> lines = program.sortedLines();
        if (lines.isEmpty()) {
            out.println("No code in memory");
            return;
        }

        int pageSize = config.pageSize();
        for (int i = 0; i < lines.size(); i += pageSize) {
            printer.printLines(lines.subList(i, Math.min(i + pageSize, lines.size())));
            if (i + pageSize < lines.size()) {
                out.print("Press Enter to continue.");
                out.flush();
                readAnswer();
            }
        }
    }

    private void insert(String args) {
        String[] parts = args.split("\\s+", 2);
        if (args.isEmpty() || parts.length < 2) {
            out.println("Error: INS requires <LINE> <INSTRUCTION>");
            return;
        }

        int number;
        try {
            number = Integer.parseInt(parts[0]);
        } catch (NumberFormatException e) {
            out.println("Error: invalid line number");
            return;
        }
        if (number < 0) {
            out.println("Error: line number must not be negative");
            return;
        }

        boolean replaced = program.setLine(number, parts[1]);
        vm.rebuild();
        out.println(replaced ? "Line updated:" : "Line inserted:");
        printer.printLine(number, program.getText(number));
    }

    private void delete(String args) {
        String[] parts = args.isEmpty() ? new String[0] : args.split("\\s+");
        if (parts.length < 1 || parts.length > 2) {
            out.println("Error: DEL requires <LINE> or <FIRST_LINE> <LAST_LINE>");
            return;
        }

        int from;
        int to;
        try {
            from = Integer.parseInt(parts[0]);
            to = parts.length == 2 ? Integer.parseInt(parts[1]) : from;
        } catch (NumberFormatException e) {
            out.println("Error: invalid line number");
            return;
        }

        if (parts.length == 1) {
            if (program.deleteLine(from)) {
                vm.rebuild();
                out.println("Line removed:");
                out.println(from);
            } else {
                out.println("Error: line " + from + " does not exist");
            }
            return;
        }

        if (from > to) {
            out.println("Error: invalid range (first line > last line)");
            return;
        }
        List<ProgramImage.Line> removed = program.deleteRange(from, to);
        if (removed.isEmpty()) {
            out.println("No lines found in range " + from + "-" + to);
            return;
        }
        vm.rebuild();
        out.println("Lines removed:");
        printer.printLines(removed);
    }

    // ========== Execution commands ==========

    private void runProgram() {
        if (program.isEmpty()) {
            out.println("Error: no code in memory");
            return;
        }
        try {
            RunReport report = vm.run(config.maxSteps());
            if (!report.completed()) {
                out.printf("Stopped after %,d steps (limit reached)%n", report.steps());
            }
        } catch (MepaException e) {
            out.println("Execution error: " + e.getMessage());
        }
    }

    private void startDebug() {
        if (program.isEmpty()) {
            out.println("Error: no code in memory");
            return;
        }
        try {
            out.println("Starting debug mode:");
            printer.printReport(debugger.start());
        } catch (MepaException e) {
            out.println("Error: " + e.getMessage());
        }
    }

    private void next() {
        DebugState state = debugger.getState();
        if (state == DebugState.IDLE) {
            out.println("Error: not in debug mode. Use DEBUG first");
            return;
        }
        if (state == DebugState.HALTED) {
            out.println("Program finished. Use DEBUG to restart or STOP to leave debug mode");
            return;
        }
        try {
            DebugReport report = debugger.step();
            printer.printReport(report);
            if (config.showStack()) {
                printer.printSnapshot(debugger.inspect());
            }
        } catch (MepaException e) {
            out.println("Error: " + e.getMessage());
        }
    }

    private void stopDebug() {
        debugger.stop();
        out.println("Debug mode ended");
    }

    private void stack() {
        if (!debugger.isActive()) {
            out.println("STACK command is only available in debug mode");
            return;
        }
        printer.printSnapshot(debugger.inspect());
    }

    // ========== Accessors ==========

    public ProgramImage getProgram() {
        return program;
    }

    public DebugController getDebugger() {
        return debugger;
    }
}
