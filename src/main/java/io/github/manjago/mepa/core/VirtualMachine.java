package io.github.manjago.mepa.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.LongBinaryOperator;

/**
 * Execution engine for MEPA programs.
 * <p>
 * Executes the lines of a {@link ProgramImage} in ascending line-number order
 * against an operand stack and a flat memory. The line sequence, the parsed
 * instructions and the label table are snapshotted by {@link #rebuild()}, which
 * every reset calls, so edits never affect a run in progress.
 * <p>
 * The engine owns its {@link MachineState}; a fresh one is built on every reset.
 * Not thread-safe.
 */
public final class VirtualMachine {

    private static final Logger log = LoggerFactory.getLogger(VirtualMachine.class);

    private final ProgramImage image;

    /** Receive IMPR output as it happens */
    private final List<OutputListener> outputListeners = new ArrayList<>();

    private long maxMemory = MachineState.DEFAULT_MAX_MEMORY;

    private LoadedProgram program = LoadedProgram.EMPTY;

    private MachineState state = new MachineState();

    public VirtualMachine(@NotNull ProgramImage image) {
        this(image, OutputListener.NOOP);
    }

    public VirtualMachine(@NotNull ProgramImage image, @Nullable OutputListener outputListener) {
        this.image = image;
        if (outputListener != null) {
            outputListeners.add(outputListener);
        }
        rebuild();
    }

    public void addOutputListener(@NotNull OutputListener listener) {
        outputListeners.add(listener);
    }

    public void removeOutputListener(@NotNull OutputListener listener) {
        outputListeners.remove(listener);
    }

    /**
     * Set the memory cell limit for runs started after this call.
     */
    public void setMaxMemory(long cells) {
        if (cells < 0 || cells > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Memory limit out of range: " + cells);
        }
        this.maxMemory = cells;
    }

    public long getMaxMemory() {
        return maxMemory;
    }

    // ========== Lifecycle ==========

    /**
     * Re-derive the line index and label table from the program image.
     * Must be called after the image changes; {@link #reset} calls it too.
     */
    public void rebuild() {
        program = LoadedProgram.of(image);
        log.debug("Rebuilt program: {} lines, {} labels", program.size(), program.labels().size());
    }

    /**
     * Start a run: rebuild, create a fresh state and point the program counter
     * at the INPP line (or the first line if there is none).
     *
     * @param mode mode to enter, {@link MachineMode#RUNNING} or {@link MachineMode#DEBUG_PAUSED}
     * @throws MepaException EMPTY_PROGRAM if there is nothing to execute
     */
    public void reset(@NotNull MachineMode mode) throws MepaException {
        if (!mode.isActive()) {
            throw new IllegalArgumentException("Cannot start in mode " + mode);
        }
        rebuild();
        state = new MachineState();

        int start = program.startIndex();
        if (start < 0) {
            throw new MepaException(ErrorKind.EMPTY_PROGRAM, "No code to execute");
        }
        state = new MachineState(mode, start, maxMemory);
        log.debug("Reset in {} mode, starting at line {}", mode, program.lineAt(start));
    }

    /**
     * Drop the current state and return to {@link MachineMode#IDLE}.
     */
    public void discard() {
        state = new MachineState();
    }

    // ========== Running ==========

    /**
     * Run to completion without a step budget.
     * A program that never reaches PARA or the end runs forever.
     */
    public RunReport run() throws MepaException {
        return run(0);
    }

    /**
     * Reset and run until PARA, the end of the program, an error, or the budget is used up.
     *
     * @param maxSteps maximum instructions to execute, 0 = unlimited
     * @return run report with printed values
     * @throws MepaException on the first failing instruction
     */
    public RunReport run(long maxSteps) throws MepaException {
        reset(MachineMode.RUNNING);
        RecentOutputs printed = new RecentOutputs();
        outputListeners.add(printed);
        try {
            int lastLine = -1;

            while (maxSteps <= 0 || state.getSteps() < maxSteps) {
                StepResult result = step();
                lastLine = result.line();

                if (result instanceof StepResult.Failed failed) {
                    throw failed.error();
                }
                if (result instanceof StepResult.Halted halted) {
                    log.debug("Run finished at line {} ({}) after {} steps",
                            halted.line(), halted.reason(), state.getSteps());
                    return printed.report(RunReport.Status.from(halted.reason()), state.getSteps(), lastLine);
                }
            }

            log.debug("Step budget of {} used up at line {}", maxSteps, lastLine);
            state.setMode(MachineMode.HALTED);
            return printed.report(RunReport.Status.STEP_LIMIT, state.getSteps(), lastLine);
        } finally {
            outputListeners.remove(printed);
        }
    }

    /**
     * Counts printed values and keeps the most recent ones for the run report.
     */
    private static final class RecentOutputs implements OutputListener {

        private final Deque<Long> recent = new ArrayDeque<>();
        private long count;

        @Override
        public void onOutput(int lineNumber, long value) {
            count++;
            if (recent.size() == RunReport.OUTPUT_HISTORY) {
                recent.removeFirst();
            }
            recent.addLast(value);
        }

        RunReport report(RunReport.Status status, long steps, int lastLine) {
            return new RunReport(status, steps, count, List.copyOf(recent), lastLine);
        }
    }

    /**
     * Execute the instruction at the program counter.
     * <p>
     * On failure the state is discarded and the engine returns to IDLE.
     *
     * @throws IllegalStateException if no run or debug session is active
     */
    public StepResult step() {
        if (!state.getMode().isActive()) {
            throw new IllegalStateException("No execution in progress (mode " + state.getMode() + ")");
        }

        int pc = state.getPc();
        if (pc < 0 || pc >= program.size()) {
            state.setMode(MachineMode.HALTED);
            return new StepResult.Halted(-1, StepResult.HaltReason.END_OF_PROGRAM);
        }

        int line = program.lineAt(pc);
        Instruction insn = program.instructionAt(pc);
        log.trace("Executing line {}: {}", line, program.textAt(pc));

        StepResult result;
        try {
            result = execute(line, insn);
        } catch (MachineFault fault) {
            MepaException error = new MepaException(fault.getKind(), line, fault.getMessage());
            log.debug("Execution failed: {}", error.getMessage());
            discard();
            return new StepResult.Failed(line, error);
        }

        state.incrementSteps();

        if (result instanceof StepResult.Continue && state.getPc() >= program.size()) {
            result = new StepResult.Halted(line, StepResult.HaltReason.END_OF_PROGRAM);
        }
        if (result instanceof StepResult.Halted) {
            state.setMode(MachineMode.HALTED);
        }
        return result;
    }

    private StepResult execute(int line, Instruction insn) {
        OpCode op = insn.opCode();

        if (op == null) {
            if (insn.isEmpty()) {
                // Blank or label-only line
                return next(line);
            }
            throw new MachineFault(ErrorKind.UNKNOWN_OPCODE, "Unknown instruction: " + insn.mnemonic());
        }

        requireArguments(op, insn);

        switch (op) {
            case INPP, NADA -> {
                return next(line);
            }

            case PARA -> {
                return new StepResult.Halted(line, StepResult.HaltReason.PARA);
            }

            case AMEM -> {
                state.allocate(integerArgument(op, insn));
                return next(line);
            }

            case DMEM -> {
                state.deallocate(integerArgument(op, insn));
                return next(line);
            }

            case CRCT -> {
                state.push(integerArgument(op, insn));
                return next(line);
            }

            case CRVL -> {
                long address = integerArgument(op, insn);
                state.push(state.load(address));
                return next(line);
            }

            case ARMZ -> {
                long address = integerArgument(op, insn);
                long value = state.pop();
                state.store(address, value);
                return next(line);
            }

            case SOMA -> {
                return binary(line, (a, b) -> a + b);
            }

            case SUBT -> {
                return binary(line, (a, b) -> a - b);
            }

            case MULT -> {
                return binary(line, (a, b) -> a * b);
            }

            case DIVI -> {
                long b = state.pop();
                long a = state.pop();
                if (b == 0) {
                    throw new MachineFault(ErrorKind.DIVISION_BY_ZERO, "Division by zero");
                }
                state.push(Math.floorDiv(a, b));
                return next(line);
            }

            case INVR -> {
                state.push(-state.pop());
                return next(line);
            }

            case CONJ -> {
                return binary(line, (a, b) -> truth(a != 0 && b != 0));
            }

            case DISJ -> {
                return binary(line, (a, b) -> truth(a != 0 || b != 0));
            }

            case CMME -> {
                return binary(line, (a, b) -> truth(a < b));
            }

            case CMMA -> {
                return binary(line, (a, b) -> truth(a > b));
            }

            case CMIG -> {
                return binary(line, (a, b) -> truth(a == b));
            }

            case CMDG -> {
                return binary(line, (a, b) -> truth(a != b));
            }

            case CMEG -> {
                return binary(line, (a, b) -> truth(a <= b));
            }

            case CMAG -> {
                return binary(line, (a, b) -> truth(a >= b));
            }

            case DSVS -> {
                return jump(line, op, insn.argument(0));
            }

            case DSVF -> {
                long condition = state.pop();
                if (condition == 0) {
                    return jump(line, op, insn.argument(0));
                }
                return next(line);
            }

            case IMPR -> {
                long value = state.peek();
                for (OutputListener listener : List.copyOf(outputListeners)) {
                    listener.onOutput(line, value);
                }
                return next(line);
            }

            default -> throw new MachineFault(ErrorKind.UNKNOWN_OPCODE, "Unknown instruction: " + op);
        }
    }

    // ========== Helpers ==========

    private StepResult next(int line) {
        state.advancePc();
        return new StepResult.Continue(line);
    }

    /**
     * Pop b, pop a, push a op b.
     */
    private StepResult binary(int line, LongBinaryOperator operator) {
        long b = state.pop();
        long a = state.pop();
        state.push(operator.applyAsLong(a, b));
        return next(line);
    }

    private static long truth(boolean value) {
        return value ? 1L : 0L;
    }

    private StepResult jump(int line, OpCode op, String target) {
        int index = program.resolveTarget(target);
        if (index < 0) {
            throw new MachineFault(ErrorKind.UNRESOLVED_TARGET,
                    op + ": label or line " + target + " not found");
        }
        state.setPc(index);
        return new StepResult.Jumped(line, program.lineAt(index));
    }

    private static void requireArguments(OpCode op, Instruction insn) {
        int required = op.getOperandCount();
        if (required > 0 && insn.argumentCount() != required) {
            throw new MachineFault(ErrorKind.MALFORMED_ARGUMENTS,
                    op + " requires " + required + " argument" + (required == 1 ? "" : "s")
                            + ", got " + insn.argumentCount());
        }
    }

    private static long integerArgument(OpCode op, Instruction insn) {
        String token = insn.argument(0);
        try {
            return Long.parseLong(token.strip());
        } catch (NumberFormatException e) {
            throw new MachineFault(ErrorKind.MALFORMED_ARGUMENTS,
                    op + ": invalid integer argument '" + token + "'");
        }
    }

    // ========== Inspection ==========

    public MachineState getState() {
        return state;
    }

    public MachineMode getMode() {
        return state.getMode();
    }

    public LoadedProgram getProgram() {
        return program;
    }

    /**
     * @return line number the program counter points at, or -1 if past the end
     */
    public int currentLine() {
        int pc = state.getPc();
        return pc >= 0 && pc < program.size() ? program.lineAt(pc) : -1;
    }

    /**
     * @return raw text of the line the program counter points at, or null if past the end
     */
    public @Nullable String currentText() {
        int pc = state.getPc();
        return pc >= 0 && pc < program.size() ? program.textAt(pc) : null;
    }
}
