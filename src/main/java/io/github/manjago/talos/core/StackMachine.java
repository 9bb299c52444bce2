package io.github.manjago.talos.core;

import io.github.manjago.talos.field.Goldilocks;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Interpreter for straight-line stack-machine code over the Goldilocks field.
 * <p>
 * I/O, memory and sponge instructions are modelled by their stack effect only:
 * reads push zeros, writes pop. Control flow always fails.
 */
public final class StackMachine {

    private static final long U32_MASK = 0xFFFF_FFFFL;

    /**
     * Outcome of running a whole sequence.
     *
     * @param status OK or the first error
     * @param failedAt index of the failing instruction, -1 on success
     * @param stack final stack, bottom first
     */
    public record RunResult(ExecutionResult status, int failedAt, long[] stack) {

        public boolean isSuccess() {
            return status.isSuccess();
        }
    }

    /**
     * Run {@code code} from an entry stack given bottom first.
     */
    public @NotNull RunResult run(@NotNull List<Instruction> code, long[] entryStack) {
        StackState state = new StackState(entryStack);
        for (int pc = 0; pc < code.size(); pc++) {
            ExecutionResult result = execute(state, code.get(pc));
            if (result.isError()) {
                return new RunResult(result, pc, state.toArray());
            }
        }
        return new RunResult(ExecutionResult.OK, -1, state.toArray());
    }

    /**
     * Execute a single instruction.
     *
     * @param state stack to mutate
     * @param instruction instruction to execute
     * @return execution result; the stack is unspecified after an error
     */
    public ExecutionResult execute(StackState state, Instruction instruction) {
        int arg = (int) instruction.argument();
        switch (instruction.mnemonic()) {
            case PUSH -> state.push(instruction.argument());

            case POP, WRITE_IO -> {
                if (!state.has(arg)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                state.drop(arg);
            }

            case DUP -> {
                if (!state.has(arg + 1)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                state.push(state.peek(arg));
            }

            case SWAP -> {
                if (!state.has(arg + 1)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                state.swap(arg);
            }

            case PICK -> {
                if (!state.has(arg + 1)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                state.pick(arg);
            }

            case PLACE -> {
                if (!state.has(arg + 1)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                state.place(arg);
            }

            case NOP, SPONGE_INIT -> {
                // no stack effect
            }

            case ADD, MUL, EQ, LT, AND, XOR, POW -> {
                if (!state.has(2)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                long b = state.pop();
                long a = state.pop();
                state.push(binary(instruction.mnemonic(), a, b));
            }

            case INVERT -> {
                if (!state.has(1)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                long a = state.pop();
                if (a == 0) {
                    return ExecutionResult.ERROR_ZERO_INVERSE;
                }
                state.push(Goldilocks.inv(a));
            }

            case SPLIT -> {
                if (!state.has(1)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                long x = state.pop();
                state.push(x >>> 32);
                state.push(x & U32_MASK);
            }

            case DIV_MOD -> {
                if (!state.has(2)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                long d = state.pop();
                long n = state.pop();
                if (d == 0) {
                    return ExecutionResult.ERROR_DIVISION_BY_ZERO;
                }
                state.push(Long.divideUnsigned(n, d));
                state.push(Long.remainderUnsigned(n, d));
            }

            case LOG_2_FLOOR -> {
                if (!state.has(1)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                long x = state.pop();
                if (x == 0) {
                    return ExecutionResult.ERROR_ZERO_LOGARITHM;
                }
                state.push(63 - Long.numberOfLeadingZeros(x));
            }

            case POP_COUNT -> {
                if (!state.has(1)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                state.push(Long.bitCount(state.pop()));
            }

            case ASSERT -> {
                if (!state.has(1)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                if (state.pop() != 1) {
                    return ExecutionResult.ERROR_ASSERTION_FAILED;
                }
            }

            case ASSERT_VECTOR -> {
                if (!state.has(10)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                for (int i = 0; i < 5; i++) {
                    if (state.peek(i) != state.peek(i + 5)) {
                        return ExecutionResult.ERROR_ASSERTION_FAILED;
                    }
                }
                state.drop(5);
            }

            case READ_IO, DIVINE -> pushZeros(state, arg);

            case READ_MEM -> {
                if (!state.has(1)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                long pointer = state.pop();
                pushZeros(state, arg);
                state.push(Goldilocks.sub(pointer, arg));
            }

            case WRITE_MEM -> {
                if (!state.has(arg + 1)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                long pointer = state.pop();
                state.drop(arg);
                state.push(Goldilocks.add(pointer, arg));
            }

            case HASH -> {
                if (!state.has(10)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                state.drop(10);
                pushZeros(state, 5);
            }

            case SPONGE_ABSORB -> {
                if (!state.has(10)) {
                    return ExecutionResult.ERROR_STACK_UNDERFLOW;
                }
                state.drop(10);
            }

            case SPONGE_SQUEEZE -> pushZeros(state, 10);

            case HALT, RETURN, RECURSE, SKIZ -> {
                return ExecutionResult.ERROR_CONTROL_FLOW;
            }
        }
        return ExecutionResult.OK;
    }

    private static void pushZeros(StackState state, int count) {
        for (int i = 0; i < count; i++) {
            state.push(0);
        }
    }

    /**
     * Two-operand semantics shared with the IR interpreter; {@code b} was on top.
     */
    public static long binary(Mnemonic op, long a, long b) {
        return switch (op) {
            case ADD -> Goldilocks.add(a, b);
            case MUL -> Goldilocks.mul(a, b);
            case EQ -> a == b ? 1 : 0;
            case LT -> Long.compareUnsigned(a, b) < 0 ? 1 : 0;
            case AND -> a & b;
            case XOR -> Goldilocks.reduce(a ^ b);
            case POW -> Goldilocks.pow(a, b);
            default -> throw new IllegalArgumentException("Not a binary operation: " + op);
        };
    }
}
