package io.github.manjago.talos.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Instruction set of the target stack machine.
 * <p>
 * Stack access is limited to the top 16 slots (the near-register window).
 * Counted instructions move between one and five elements.
 */
public enum Mnemonic {

    // ========== Stack ==========

    /** Push an immediate field element. */
    PUSH("push", Arg.IMMEDIATE),

    /** Pop n elements. */
    POP("pop", Arg.COUNT),

    /** Duplicate the element at depth d. */
    DUP("dup", Arg.DEPTH),

    /** Exchange top with the element at depth d. */
    SWAP("swap", Arg.SWAP_DEPTH),

    /** Move the element at depth d to the top. */
    PICK("pick", Arg.DEPTH),

    /** Pop the top and insert it at depth d. */
    PLACE("place", Arg.DEPTH),

    NOP("nop", Arg.NONE),

    // ========== Arithmetic ==========

    ADD("add", Arg.NONE),
    MUL("mul", Arg.NONE),

    /** Multiplicative inverse; fails on zero. */
    INVERT("invert", Arg.NONE),

    EQ("eq", Arg.NONE),

    // ========== U32 ==========

    /** {@code a b -> (a < b)}, unsigned compare of canonical values. */
    LT("lt", Arg.NONE),
    AND("and", Arg.NONE),
    XOR("xor", Arg.NONE),

    /** {@code x -> hi lo}. */
    SPLIT("split", Arg.NONE),

    /** {@code n d -> q r}; fails on zero divisor. */
    DIV_MOD("div_mod", Arg.NONE),

    /** {@code base exp -> base^exp}. */
    POW("pow", Arg.NONE),
    LOG_2_FLOOR("log_2_floor", Arg.NONE),
    POP_COUNT("pop_count", Arg.NONE),

    // ========== Assertions ==========

    ASSERT("assert", Arg.NONE),
    ASSERT_VECTOR("assert_vector", Arg.NONE),

    // ========== I/O and memory ==========

    READ_IO("read_io", Arg.COUNT),
    WRITE_IO("write_io", Arg.COUNT),
    DIVINE("divine", Arg.COUNT),
    READ_MEM("read_mem", Arg.COUNT),
    WRITE_MEM("write_mem", Arg.COUNT),

    // ========== Hashing ==========

    HASH("hash", Arg.NONE),
    SPONGE_INIT("sponge_init", Arg.NONE),
    SPONGE_ABSORB("sponge_absorb", Arg.NONE),
    SPONGE_SQUEEZE("sponge_squeeze", Arg.NONE),

    // ========== Control flow (never valid in a straight-line block) ==========

    HALT("halt", Arg.NONE, true),
    RETURN("return", Arg.NONE, true),
    RECURSE("recurse", Arg.NONE, true),
    SKIZ("skiz", Arg.NONE, true);

    /** Number of stack slots reachable by dup, swap, pick and place. */
    public static final int WINDOW = 16;

    /** Largest count accepted by counted instructions. */
    public static final int MAX_COUNT = 5;

    /**
     * Argument shape of an instruction.
     */
    public enum Arg {
        NONE,
        /** Any field element, signed or unsigned literal. */
        IMMEDIATE,
        /** 0..15 */
        DEPTH,
        /** 1..15 */
        SWAP_DEPTH,
        /** 1..5 */
        COUNT;

        /**
         * @return true if {@code value} is accepted for this shape
         */
        public boolean accepts(long value) {
            return switch (this) {
                case NONE -> value == 0;
                case IMMEDIATE -> true;
                case DEPTH -> value >= 0 && value < WINDOW;
                case SWAP_DEPTH -> value >= 1 && value < WINDOW;
                case COUNT -> value >= 1 && value <= MAX_COUNT;
            };
        }

        public String range() {
            return switch (this) {
                case NONE -> "none";
                case IMMEDIATE -> "field element";
                case DEPTH -> "0.." + (WINDOW - 1);
                case SWAP_DEPTH -> "1.." + (WINDOW - 1);
                case COUNT -> "1.." + MAX_COUNT;
            };
        }
    }

    // ========== Fields & Constructor ==========

    private final String text;
    private final Arg arg;
    private final boolean controlFlow;

    Mnemonic(String text, Arg arg) {
        this(text, arg, false);
    }

    Mnemonic(String text, Arg arg, boolean controlFlow) {
        this.text = text;
        this.arg = arg;
        this.controlFlow = controlFlow;
    }

    public String text() {
        return text;
    }

    public Arg arg() {
        return arg;
    }

    public boolean hasArgument() {
        return arg != Arg.NONE;
    }

    public boolean isControlFlow() {
        return controlFlow;
    }

    // ========== Lookup ==========

    private static final Map<String, Mnemonic> BY_TEXT = new HashMap<>();

    static {
        for (Mnemonic m : values()) {
            BY_TEXT.put(m.text, m);
        }
    }

    /**
     * Find a mnemonic by its assembly text (case-insensitive).
     *
     * @return mnemonic or null if unknown
     */
    @Contract(pure = true)
    public static @Nullable Mnemonic fromText(String text) {
        return BY_TEXT.get(text.toLowerCase(Locale.ROOT));
    }
}
