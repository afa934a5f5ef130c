package io.github.manjago.mepa.debug;

import io.github.manjago.mepa.core.ErrorKind;
import io.github.manjago.mepa.core.MachineMode;
import io.github.manjago.mepa.core.MepaException;
import io.github.manjago.mepa.core.ProgramImage;
import io.github.manjago.mepa.core.StepResult;
import io.github.manjago.mepa.core.VirtualMachine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DebugControllerTest {

    private static ProgramImage program(String... lines) {
        ProgramImage image = new ProgramImage();
        for (int i = 0; i < lines.length; i++) {
            image.setLine((i + 1) * 10, lines[i]);
        }
        return image;
    }

    private static DebugController controller(String... lines) {
        return new DebugController(new VirtualMachine(program(lines)));
    }

    @Nested
    @DisplayName("Session lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("New controller is idle")
        void initiallyIdle() {
            DebugController debugger = controller("INPP");

            assertEquals(DebugState.IDLE, debugger.getState());
            assertFalse(debugger.isActive());
        }

        @Test
        @DisplayName("Start pauses before the INPP line")
        void startPausesAtInpp() throws MepaException {
            DebugController debugger = controller("NADA", "INPP", "CRCT 1", "PARA");

            DebugReport report = debugger.start();

            assertEquals(DebugState.PAUSED, report.state());
            assertEquals(20, report.pendingLine());
            assertEquals("INPP", report.pendingText());
            assertTrue(report.outputs().isEmpty());
            assertTrue(debugger.isActive());
        }

        @Test
        @DisplayName("Start on an empty program fails and stays idle")
        void startEmpty() {
            DebugController debugger = controller();

            MepaException e = assertThrows(MepaException.class, debugger::start);

            assertEquals(ErrorKind.EMPTY_PROGRAM, e.getKind());
            assertEquals(DebugState.IDLE, debugger.getState());
        }

        @Test
        @DisplayName("Stop discards the session")
        void stop() throws MepaException {
            VirtualMachine vm = new VirtualMachine(program("INPP", "AMEM 1", "PARA"));
            DebugController debugger = new DebugController(vm);
            debugger.start();
            debugger.step();
            debugger.step();

            debugger.stop();

            assertEquals(DebugState.IDLE, debugger.getState());
            assertEquals(MachineMode.IDLE, vm.getMode());
            assertEquals(0, vm.getState().memorySize());
        }

        @Test
        @DisplayName("Misuse while idle is rejected")
        void idleMisuse() {
            DebugController debugger = controller("INPP");

            assertThrows(IllegalStateException.class, debugger::step);
            assertThrows(IllegalStateException.class, debugger::stop);
            assertThrows(IllegalStateException.class, debugger::inspect);
        }

        @Test
        @DisplayName("Restarting begins again from a fresh state")
        void restart() throws MepaException {
            DebugController debugger = controller("INPP", "CRCT 1", "PARA");
            debugger.start();
            debugger.step();
            debugger.step();

            DebugReport report = debugger.start();

            assertEquals(10, report.pendingLine());
            assertTrue(debugger.inspect().isEmpty());
        }

        @Test
        @DisplayName("A run on the same engine ends the session")
        void runReplacesSession() throws MepaException {
            VirtualMachine vm = new VirtualMachine(program("INPP", "CRCT 1", "PARA"));
            DebugController debugger = new DebugController(vm);
            debugger.start();

            vm.run();

            assertEquals(DebugState.IDLE, debugger.getState());
            assertThrows(IllegalStateException.class, debugger::step);
        }
    }

    @Nested
    @DisplayName("Stepping")
    class Stepping {

        @Test
        @DisplayName("Each step executes exactly one instruction")
        void singleStep() throws MepaException {
            DebugController debugger = controller("INPP", "CRCT 4", "CRCT 5", "SOMA", "PARA");
            debugger.start();

            debugger.step();
            DebugReport report = debugger.step();

            assertEquals(30, report.pendingLine());
            assertEquals("CRCT 5", report.pendingText());
            assertEquals(List.of(4L), debugger.inspect().stack());
        }

        @Test
        @DisplayName("Step reports values printed by IMPR")
        void printedValues() throws MepaException {
            DebugController debugger = controller("CRCT 8", "IMPR", "PARA");
            debugger.start();
            debugger.step();

            DebugReport report = debugger.step();

            assertEquals(List.of(8L), report.outputs());
            assertEquals(30, report.pendingLine());
        }

        @Test
        @DisplayName("Only the current step's printed values are reported")
        void printedValuesPerStep() throws MepaException {
            List<Long> listened = new ArrayList<>();
            VirtualMachine vm = new VirtualMachine(program("CRCT 8", "IMPR", "IMPR", "PARA"),
                    (line, value) -> listened.add(value));
            DebugController debugger = new DebugController(vm);
            vm.run();
            debugger.start();

            assertTrue(debugger.step().outputs().isEmpty());
            assertEquals(List.of(8L), debugger.step().outputs());
            assertEquals(List.of(8L), debugger.step().outputs());
            assertTrue(debugger.step().outputs().isEmpty());
            assertEquals(List.of(8L, 8L, 8L, 8L), listened);
        }

        @Test
        @DisplayName("PARA halts the session")
        void haltOnPara() throws MepaException {
            DebugController debugger = controller("INPP", "PARA", "CRCT 1");
            debugger.start();
            debugger.step();

            DebugReport report = debugger.step();

            assertTrue(report.isHalted());
            assertEquals(StepResult.HaltReason.PARA, report.haltReason());
            assertEquals(-1, report.pendingLine());
            assertNull(report.pendingText());
            assertEquals(DebugState.HALTED, debugger.getState());
            assertThrows(IllegalStateException.class, debugger::step);
        }

        @Test
        @DisplayName("Stepping past the last line halts with end of program")
        void haltAtEnd() throws MepaException {
            DebugController debugger = controller("INPP", "CRCT 1");
            debugger.start();
            debugger.step();

            DebugReport report = debugger.step();

            assertEquals(StepResult.HaltReason.END_OF_PROGRAM, report.haltReason());
            assertEquals(DebugState.HALTED, debugger.getState());
        }

        @Test
        @DisplayName("Halted session can still be inspected")
        void inspectAfterHalt() throws MepaException {
            DebugController debugger = controller("CRCT 3", "PARA");
            debugger.start();
            debugger.step();
            debugger.step();

            MachineSnapshot snapshot = debugger.inspect();

            assertEquals(List.of(3L), snapshot.stack());
            assertEquals(3L, snapshot.top());
        }

        @Test
        @DisplayName("A non-terminating loop stays paused on the loop line")
        void infiniteLoop() throws MepaException {
            DebugController debugger = controller("L1: NADA", "DSVS L1");
            debugger.start();

            for (int i = 0; i < 10; i++) {
                debugger.step();
                DebugReport report = debugger.step();
                assertEquals(10, report.pendingLine());
                assertEquals("L1: NADA", report.pendingText());
            }
            assertEquals(DebugState.PAUSED, debugger.getState());
        }

        @Test
        @DisplayName("A failing step ends the session and rethrows")
        void failure() throws MepaException {
            DebugController debugger = controller("INPP", "AMEM 1", "CRVL 5");
            debugger.start();
            debugger.step();
            debugger.step();

            MepaException e = assertThrows(MepaException.class, debugger::step);

            assertEquals(ErrorKind.MEMORY_OUT_OF_BOUNDS, e.getKind());
            assertEquals(30, e.getLineNumber());
            assertEquals(DebugState.IDLE, debugger.getState());
        }
    }

    @Nested
    @DisplayName("Inspection")
    class Inspection {

        @Test
        @DisplayName("Snapshot copies memory and stack")
        void snapshotIsCopy() throws MepaException {
            VirtualMachine vm = new VirtualMachine(program("AMEM 2", "CRCT 7", "ARMZ 1", "CRCT 9", "PARA"));
            DebugController debugger = new DebugController(vm);
            debugger.start();
            for (int i = 0; i < 4; i++) {
                debugger.step();
            }

            MachineSnapshot snapshot = debugger.inspect();
            debugger.step();

            assertEquals(List.of(0L, 7L), snapshot.memory());
            assertEquals(List.of(9L), snapshot.stack());
            assertEquals(50, snapshot.currentLine());
            assertEquals(MachineMode.DEBUG_PAUSED, snapshot.mode());
            assertThrows(UnsupportedOperationException.class, () -> snapshot.stack().add(1L));
        }
    }
}
