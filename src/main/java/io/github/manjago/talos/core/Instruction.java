package io.github.manjago.talos.core;

import io.github.manjago.talos.field.Goldilocks;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * One machine instruction. Immediates of {@code push} are canonical field elements.
 *
 * @param mnemonic operation
 * @param argument depth, count or immediate; 0 when the mnemonic takes none
 */
public record Instruction(@NotNull Mnemonic mnemonic, long argument) {

    public Instruction {
        if (mnemonic == Mnemonic.PUSH) {
            argument = Goldilocks.reduce(argument);
        } else if (!mnemonic.arg().accepts(argument)) {
            throw new IllegalArgumentException(
                    mnemonic.text() + " argument " + argument + " outside " + mnemonic.arg().range());
        }
    }

    @Contract(pure = true)
    public static @NotNull Instruction of(@NotNull Mnemonic mnemonic) {
        return new Instruction(mnemonic, 0);
    }

    @Contract(pure = true)
    public static @NotNull Instruction of(@NotNull Mnemonic mnemonic, long argument) {
        return new Instruction(mnemonic, argument);
    }

    /**
     * {@code push} of a signed literal; negative values wrap into the field.
     */
    @Contract(pure = true)
    public static @NotNull Instruction push(long value) {
        return new Instruction(Mnemonic.PUSH, Goldilocks.fromSigned(value));
    }

    /**
     * {@code push} of a value already in the field.
     */
    @Contract(pure = true)
    public static @NotNull Instruction pushElement(long element) {
        return new Instruction(Mnemonic.PUSH, element);
    }

    /**
     * Assembly text, e.g. {@code dup 3} or {@code add}.
     */
    @Override
    public String toString() {
        if (!mnemonic.hasArgument()) {
            return mnemonic.text();
        }
        if (mnemonic == Mnemonic.PUSH) {
            return "push " + renderImmediate(argument);
        }
        return mnemonic.text() + " " + argument;
    }

    /**
     * Elements just below {@code p} print as small negative literals.
     */
    private static String renderImmediate(long element) {
        long distance = Goldilocks.P - element;
        if (element != 0 && Long.compareUnsigned(distance, 1L << 32) <= 0) {
            return "-" + distance;
        }
        return Long.toUnsignedString(element);
    }
}
