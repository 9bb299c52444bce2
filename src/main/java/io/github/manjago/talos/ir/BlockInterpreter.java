package io.github.manjago.talos.ir;

import io.github.manjago.talos.core.StackMachine;
import io.github.manjago.talos.field.Goldilocks;
import org.jetbrains.annotations.NotNull;

/**
 * Reference semantics of IR blocks.
 * <p>
 * A block reads its entry stack without consuming it and pushes its outputs, first
 * output deepest. Value semantics match the machine instructions the ops lower to.
 */
public final class BlockInterpreter {

    private BlockInterpreter() {
        // Utility class
    }

    /**
     * Output values of {@code block} for an entry stack given bottom first.
     *
     * @throws ArithmeticException if the block inverts zero on this input
     * @throws IllegalArgumentException if an input reads below the entry stack
     */
    public static long @NotNull [] evaluate(@NotNull BasicBlock block, long[] entryStack) {
        long[] values = new long[block.size()];
        int[] outputs = block.outputs();
        long[] results = new long[outputs.length];
        int produced = 0;

        for (int i = 0; i < block.size(); i++) {
            IrNode node = block.node(i);
            switch (node.op()) {
                case INPUT -> {
                    int index = entryStack.length - 1 - (int) node.immediate();
                    if (index < 0) {
                        throw new IllegalArgumentException("Input depth " + node.immediate()
                                + " below an entry stack of " + entryStack.length);
                    }
                    values[i] = entryStack[index];
                }
                case CONST -> values[i] = node.immediate();
                case OUTPUT -> results[produced++] = values[node.lhs()];
                default -> values[i] = node.op().arity() == 1
                        ? apply(node.op(), values[node.lhs()], 0)
                        : apply(node.op(), values[node.lhs()], values[node.rhs()]);
            }
        }
        return results;
    }

    /**
     * Value of a computing op; {@code b} is ignored for unary ops.
     *
     * @throws ArithmeticException for the inverse of zero
     */
    public static long apply(@NotNull IrOp op, long a, long b) {
        return switch (op) {
            case NEG -> Goldilocks.neg(a);
            case INV -> Goldilocks.inv(a);
            case ADD, MUL, EQ, LT, AND, XOR, POW -> StackMachine.binary(op.mnemonic(), a, b);
            default -> throw new IllegalArgumentException(op + " does not compute a value");
        };
    }
}
