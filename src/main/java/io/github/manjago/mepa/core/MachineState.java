package io.github.manjago.mepa.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Machine state for one run or debug session.
 *
 * Contains:
 * - Operand stack (LIFO of integers)
 * - Memory, zero-indexed, grown and shrunk only by AMEM/DMEM, capped at a cell limit
 * - Program counter: index into the ascending line sequence, not a line number
 * - Execution mode
 *
 * A new instance is created for every run; it is never reset in place.
 */
public final class MachineState {

    /** Memory cell limit used when none is configured. */
    public static final long DEFAULT_MAX_MEMORY = 1L << 20;

    private static final int INITIAL_CAPACITY = 16;

    private final List<Long> stack = new ArrayList<>();

    /** Cells {@code [0, memorySize)} are live, the rest is spare capacity. */
    private long[] memory = new long[0];
    private int memorySize;

    private final long maxMemory;

    private int pc;

    private MachineMode mode;

    /** Instructions executed so far. */
    private long steps;

    public MachineState() {
        this(MachineMode.IDLE, 0);
    }

    public MachineState(MachineMode mode, int pc) {
        this(mode, pc, DEFAULT_MAX_MEMORY);
    }

    /**
     * @param maxMemory largest number of memory cells AMEM may reach
     */
    public MachineState(MachineMode mode, int pc, long maxMemory) {
        if (maxMemory < 0 || maxMemory > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Memory limit out of range: " + maxMemory);
        }
        this.mode = mode;
        this.pc = pc;
        this.maxMemory = maxMemory;
    }

    // ========== Stack ==========

    public void push(long value) {
        stack.add(value);
    }

    public long pop() {
        if (stack.isEmpty()) {
            throw new MachineFault(ErrorKind.STACK_UNDERFLOW, "Stack is empty");
        }
        return stack.remove(stack.size() - 1);
    }

    public long peek() {
        if (stack.isEmpty()) {
            throw new MachineFault(ErrorKind.STACK_UNDERFLOW, "Stack is empty");
        }
        return stack.get(stack.size() - 1);
    }

    public int stackSize() {
        return stack.size();
    }

    /**
     * @return stack contents, bottom first
     */
    public List<Long> getStack() {
        return Collections.unmodifiableList(stack);
    }

    // ========== Memory ==========

    /**
     * Append {@code count} zero cells.
     */
    public void allocate(long count) {
        if (count < 0) {
            throw new MachineFault(ErrorKind.INVALID_ALLOCATION, "Cannot allocate negative size " + count);
        }
        if (count > maxMemory - memorySize) {
            throw new MachineFault(ErrorKind.INVALID_ALLOCATION,
                    "Cannot allocate " + count + " cells (allocated: " + memorySize
                            + ", limit: " + maxMemory + ")");
        }
        int newSize = memorySize + (int) count;
        if (newSize > memory.length) {
            int capacity = (int) Math.min(maxMemory,
                    Math.max(newSize, Math.max(INITIAL_CAPACITY, 2L * memory.length)));
            memory = Arrays.copyOf(memory, capacity);
        }
        Arrays.fill(memory, memorySize, newSize, 0L);
        memorySize = newSize;
    }

    /**
     * Remove {@code count} cells from the end.
     */
    public void deallocate(long count) {
        if (count < 0 || count > memorySize) {
            throw new MachineFault(ErrorKind.INVALID_ALLOCATION,
                    "Cannot release " + count + " cells (allocated: " + memorySize + ")");
        }
        memorySize -= (int) count;
    }

    public long load(long address) {
        return memory[checkAddress(address)];
    }

    public void store(long address, long value) {
        memory[checkAddress(address)] = value;
    }

    public int memorySize() {
        return memorySize;
    }

    public long getMaxMemory() {
        return maxMemory;
    }

    /**
     * @return copy of the live memory cells, address 0 first
     */
    public List<Long> getMemory() {
        List<Long> cells = new ArrayList<>(memorySize);
        for (int i = 0; i < memorySize; i++) {
            cells.add(memory[i]);
        }
        return Collections.unmodifiableList(cells);
    }

    private int checkAddress(long address) {
        if (address < 0 || address >= memorySize) {
            String range = memorySize == 0 ? "no memory allocated" : "valid: 0.." + (memorySize - 1);
            throw new MachineFault(ErrorKind.MEMORY_OUT_OF_BOUNDS,
                    "Address " + address + " out of bounds (" + range + ")");
        }
        return (int) address;
    }

    // ========== Program counter ==========

    public int getPc() {
        return pc;
    }

    public void setPc(int pc) {
        this.pc = pc;
    }

    /**
     * Move to the next line in ascending order.
     */
    public void advancePc() {
        this.pc++;
    }

    // ========== Mode & counters ==========

    public MachineMode getMode() {
        return mode;
    }

    public void setMode(MachineMode mode) {
        this.mode = mode;
    }

    public long getSteps() {
        return steps;
    }

    public void incrementSteps() {
        this.steps++;
    }

    @Override
    public String toString() {
        return "MachineState{mode=" + mode +
                ", PC=" + pc +
                ", stack=" + stack +
                ", memory=" + getMemory() +
                ", steps=" + steps +
                '}';
    }
}
