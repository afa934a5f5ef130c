package io.github.manjago.mepa.debug;

import io.github.manjago.mepa.core.MachineMode;
import io.github.manjago.mepa.core.ProgramImage;
import io.github.manjago.mepa.core.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotPrinterTest {

    private StringWriter buffer;
    private SnapshotPrinter printer;

    @BeforeEach
    void setUp() {
        buffer = new StringWriter();
        printer = new SnapshotPrinter(new PrintWriter(buffer));
    }

    private List<String> printed() {
        return buffer.toString().lines().toList();
    }

    @Test
    @DisplayName("Empty machine prints a single notice")
    void emptySnapshot() {
        printer.printSnapshot(new MachineSnapshot(MachineMode.DEBUG_PAUSED, 10, List.of(), List.of()));

        assertEquals(List.of("Stack empty"), printed());
    }

    @Test
    @DisplayName("Stack entries are numbered after the memory cells")
    void memoryThenStack() {
        printer.printSnapshot(new MachineSnapshot(MachineMode.DEBUG_PAUSED, 30,
                List.of(5L, 0L), List.of(-1L, 12L)));

        assertEquals(List.of("Stack contents", "0: 5", "1: 0", "2: -1", "3: 12"), printed());
    }

    @Test
    @DisplayName("Header can be turned off")
    void noHeader() {
        printer.showHeader(false)
                .printSnapshot(new MachineSnapshot(MachineMode.HALTED, -1, List.of(), List.of(4L)));

        assertEquals(List.of("0: 4"), printed());
    }

    @Test
    @DisplayName("Paused report shows printed values then the pending line")
    void pausedReport() {
        printer.printReport(new DebugReport(DebugState.PAUSED, 40, "DSVS L1", List.of(3L), null));

        assertEquals(List.of("3", "40 DSVS L1"), printed());
    }

    @Test
    @DisplayName("Printed values can be suppressed")
    void outputsSuppressed() {
        printer.showOutputs(false)
                .printReport(new DebugReport(DebugState.PAUSED, 40, "NADA", List.of(3L), null));

        assertEquals(List.of("40 NADA"), printed());
    }

    @Test
    @DisplayName("Halted report names PARA")
    void haltedReport() {
        printer.printReport(new DebugReport(DebugState.HALTED, -1, null, List.of(),
                StepResult.HaltReason.PARA));
        printer.printReport(new DebugReport(DebugState.HALTED, -1, null, List.of(),
                StepResult.HaltReason.END_OF_PROGRAM));

        assertEquals(List.of("Program finished (PARA)", "Program finished"), printed());
    }

    @Test
    @DisplayName("Listing prints number and text")
    void listing() {
        printer.printLines(List.of(new ProgramImage.Line(10, "INPP"), new ProgramImage.Line(20, "L1: NADA")));

        assertEquals(List.of("10 INPP", "20 L1: NADA"), printed());
    }
}
