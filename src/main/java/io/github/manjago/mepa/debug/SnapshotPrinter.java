package io.github.manjago.mepa.debug;

import io.github.manjago.mepa.core.ProgramImage;
import io.github.manjago.mepa.core.StepResult;

import java.io.PrintWriter;
import java.util.List;

/**
 * Prints machine snapshots and program listings in human-readable format.
 * <p>
 * Memory and stack share one address space in the dump: memory cells come
 * first, stack entries continue numbering after the last memory cell.
 */
public class SnapshotPrinter {

    private final PrintWriter out;
    private boolean showHeader = true;
    private boolean showOutputs = true;

    public SnapshotPrinter(PrintWriter out) {
        this.out = out;
    }

    public SnapshotPrinter showHeader(boolean show) {
        this.showHeader = show;
        return this;
    }

    /**
     * Whether {@link #printReport} echoes values printed during the step.
     * Turn off when an output listener already prints them.
     */
    public SnapshotPrinter showOutputs(boolean show) {
        this.showOutputs = show;
        return this;
    }

    /**
     * Print memory then stack.
     */
    public void printSnapshot(MachineSnapshot snapshot) {
        if (snapshot.isEmpty()) {
            out.println("Stack empty");
            out.flush();
            return;
        }

        if (showHeader) {
            out.println("Stack contents");
        }

        List<Long> memory = snapshot.memory();
        for (int i = 0; i < memory.size(); i++) {
            out.printf("%d: %d%n", i, memory.get(i));
        }

        int base = memory.size();
        List<Long> stack = snapshot.stack();
        for (int i = 0; i < stack.size(); i++) {
            out.printf("%d: %d%n", base + i, stack.get(i));
        }
        out.flush();
    }

    /**
     * Print the instruction a debug session is paused on, or the completion notice.
     */
    public void printReport(DebugReport report) {
        if (showOutputs) {
            for (Long value : report.outputs()) {
                out.println(value);
            }
        }
        if (report.isHalted()) {
            out.println(report.haltReason() == StepResult.HaltReason.PARA
                    ? "Program finished (PARA)"
                    : "Program finished");
            out.flush();
        } else {
            printLine(report.pendingLine(), report.pendingText());
        }
    }

    public void printLine(int number, String text) {
        out.println(number + " " + text);
        out.flush();
    }

    /**
     * Print a page of program lines.
     */
    public void printLines(List<ProgramImage.Line> lines) {
        for (ProgramImage.Line line : lines) {
            printLine(line.number(), line.text());
        }
    }
}
