package io.github.manjago.talos.ir;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * One IR operation.
 *
 * @param op operation kind
 * @param type operand type tag
 * @param lhs index of the first operand node, {@link #NONE} if unused
 * @param rhs index of the second operand node, {@link #NONE} if unused
 * @param immediate entry depth for {@code INPUT}, field element for {@code CONST}, 0 otherwise
 */
public record IrNode(@NotNull IrOp op, @NotNull ValueType type, int lhs, int rhs, long immediate) {

    public static final int NONE = -1;

    @Contract(pure = true)
    public static @NotNull IrNode input(int depth, ValueType type) {
        return new IrNode(IrOp.INPUT, type, NONE, NONE, depth);
    }

    @Contract(pure = true)
    public static @NotNull IrNode constant(long element, ValueType type) {
        return new IrNode(IrOp.CONST, type, NONE, NONE, element);
    }

    @Contract(pure = true)
    public static @NotNull IrNode unary(IrOp op, int operand, ValueType type) {
        return new IrNode(op, type, operand, NONE, 0);
    }

    @Contract(pure = true)
    public static @NotNull IrNode binary(IrOp op, int lhs, int rhs, ValueType type) {
        return new IrNode(op, type, lhs, rhs, 0);
    }

    @Contract(pure = true)
    public static @NotNull IrNode output(int value) {
        return new IrNode(IrOp.OUTPUT, ValueType.FIELD, value, NONE, 0);
    }
}
