package io.github.manjago.mepa.core;


import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * MEPA instruction set.
 * <p>
 * Every instruction works on the operand stack and the flat memory region.
 * Binary operators pop the right operand first, then the left one, so
 * {@code a op b} means {@code a} is the value that was pushed earlier.
 * Booleans are pushed as 1 (true) or 0 (false).
 */
public enum OpCode {

    // ========== Program control ==========

    /** Program start marker. Execution begins here if present. */
    INPP(0),

    /** Halt. */
    PARA(0),

    /** No operation. */
    NADA(0),

    // ========== Memory ==========

    /** Allocate n zero-valued cells at the end of memory. */
    AMEM(1),

    /** Release n cells from the end of memory. */
    DMEM(1),

    /** Load constant. push(v) */
    CRCT(1),

    /** Load value. push(memory[n]) */
    CRVL(1),

    /** Store. memory[n] = pop() */
    ARMZ(1),

    // ========== Arithmetic ==========

    /** Sum. push(a + b) */
    SOMA(0),

    /** Subtract. push(a - b) */
    SUBT(0),

    /** Multiply. push(a * b) */
    MULT(0),

    /** Floor division. push(floor(a / b)) */
    DIVI(0),

    /** Negate. push(-a) */
    INVR(0),

    // ========== Logic ==========

    /** Conjunction. push(a != 0 && b != 0) */
    CONJ(0),

    /** Disjunction. push(a != 0 || b != 0) */
    DISJ(0),

    // ========== Comparison ==========

    /** Less than. push(a < b) */
    CMME(0),

    /** Greater than. push(a > b) */
    CMMA(0),

    /** Equal. push(a == b) */
    CMIG(0),

    /** Not equal. push(a != b) */
    CMDG(0),

    /** Less or equal. push(a <= b) */
    CMEG(0),

    /** Greater or equal. push(a >= b) */
    CMAG(0),

    // ========== Control Flow ==========

    /** Unconditional jump to a line number or label. */
    DSVS(1),

    /** Pop condition, jump to a line number or label if it is zero. */
    DSVF(1),

    // ========== Output ==========

    /** Print the top of stack without removing it. */
    IMPR(0);

    // ========== Fields & Constructor ==========

    private final int operandCount;

    OpCode(int operandCount) {
        this.operandCount = operandCount;
    }

    /**
     * Number of arguments the instruction requires.
     * Zero-operand instructions ignore any extra tokens.
     */
    public int getOperandCount() {
        return operandCount;
    }

    public String getMnemonic() {
        return name();
    }

    // ========== Lookup ==========

    private static final Map<String, OpCode> BY_MNEMONIC = new HashMap<>();

    static {
        for (OpCode op : values()) {
            BY_MNEMONIC.put(op.name(), op);
        }
    }

    /**
     * Find OpCode by mnemonic (case-insensitive).
     *
     * @param mnemonic mnemonic such as "soma" or "DSVF"
     * @return OpCode or null if the mnemonic is not part of the instruction set
     */
    @Contract(value = "null -> null", pure = true)
    public static @Nullable OpCode fromMnemonic(@Nullable String mnemonic) {
        if (mnemonic == null) {
            return null;
        }
        return BY_MNEMONIC.get(mnemonic.toUpperCase(Locale.ROOT));
    }
}
