package io.github.manjago.talos.ir;

import io.github.manjago.talos.core.Mnemonic;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Operation kinds of the block IR.
 */
public enum IrOp {

    /** Reads the entry-stack element at depth {@code immediate}. */
    INPUT(0, false, null),

    /** Field constant {@code immediate}. */
    CONST(0, false, null),

    ADD(2, true, Mnemonic.ADD),
    MUL(2, true, Mnemonic.MUL),

    /** Additive inverse. */
    NEG(1, false, null),

    /** Multiplicative inverse. */
    INV(1, false, Mnemonic.INVERT),

    EQ(2, true, Mnemonic.EQ),
    LT(2, false, Mnemonic.LT),
    AND(2, true, Mnemonic.AND),
    XOR(2, true, Mnemonic.XOR),
    POW(2, false, Mnemonic.POW),

    /** Marks {@code lhs} as the next block result. */
    OUTPUT(1, false, null);

    private final int arity;
    private final boolean commutative;
    private final Mnemonic mnemonic;

    IrOp(int arity, boolean commutative, Mnemonic mnemonic) {
        this.arity = arity;
        this.commutative = commutative;
        this.mnemonic = mnemonic;
    }

    public int arity() {
        return arity;
    }

    public boolean isCommutative() {
        return commutative;
    }

    /**
     * Machine instruction implementing this op directly, if there is one.
     */
    public @Nullable Mnemonic mnemonic() {
        return mnemonic;
    }

    /**
     * True for ops that produce a value.
     */
    public boolean producesValue() {
        return this != OUTPUT;
    }

    public String text() {
        return name().toLowerCase(Locale.ROOT);
    }
}
