package io.github.manjago.talos.lowering;

import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.core.Mnemonic;
import io.github.manjago.talos.ir.BasicBlock;
import io.github.manjago.talos.ir.BlockInterpreter;
import io.github.manjago.talos.ir.IrNode;
import io.github.manjago.talos.ir.IrOp;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lowers IR blocks to stack code, optionally applying scheduling {@link Strategy strategies}.
 * <p>
 * The emitted code leaves the entry stack untouched and pushes the block outputs on top
 * of it, first output deepest. Every combination of strategies produces code with the
 * same semantics; they differ only in cost.
 * <p>
 * Preconditions: the block passes {@code BlockEncoder.validate}. Blocks whose values do
 * not fit the 16-slot window raise {@link LoweringException}.
 */
public final class StackScheduler {

    /** Stack slot holding an operand about to be consumed. */
    private static final int TEMP = -1;

    public @NotNull List<Instruction> lower(@NotNull BasicBlock block, @NotNull Set<Strategy> strategies) {
        Schedule schedule = new Schedule(block, strategies);
        for (int i = 0; i < block.size(); i++) {
            schedule.visit(i);
        }
        schedule.finish();
        return List.copyOf(schedule.out);
    }

    /**
     * Mutable lowering state for one block.
     */
    private static final class Schedule {
        private final BasicBlock block;
        private final Set<Strategy> strategies;
        private final List<Instruction> out;
        /** Slots pushed by the block, bottom first: node index or TEMP. */
        private final List<Integer> stack;
        private final int[] remaining;
        private final boolean[] known;
        private final long[] value;
        private final boolean[] lazy;

        Schedule(BasicBlock block, Set<Strategy> strategies) {
            this.block = block;
            this.strategies = strategies;
            this.out = new ArrayList<>();
            this.stack = new ArrayList<>();
            int n = block.size();
            this.remaining = new int[n];
            this.known = new boolean[n];
            this.value = new long[n];
            this.lazy = new boolean[n];
            for (IrNode node : block.nodes()) {
                if (node.lhs() != IrNode.NONE) {
                    remaining[node.lhs()]++;
                }
                if (node.rhs() != IrNode.NONE) {
                    remaining[node.rhs()]++;
                }
            }
        }

        Schedule(Schedule other) {
            this.block = other.block;
            this.strategies = other.strategies;
            this.out = new ArrayList<>(other.out);
            this.stack = new ArrayList<>(other.stack);
            this.remaining = other.remaining.clone();
            this.known = other.known.clone();
            this.value = other.value.clone();
            this.lazy = other.lazy.clone();
        }

        private boolean uses(Strategy strategy) {
            return strategies.contains(strategy);
        }

        void visit(int i) {
            IrNode node = block.node(i);
            switch (node.op()) {
                case INPUT -> {
                    if (uses(Strategy.LAZY_INPUTS)) {
                        lazy[i] = true;
                    } else {
                        emit(Mnemonic.DUP, stack.size() + node.immediate());
                        stack.add(i);
                    }
                }
                case CONST -> {
                    if (uses(Strategy.FOLD_CONSTANTS)) {
                        known[i] = true;
                        value[i] = node.immediate();
                    } else {
                        out.add(Instruction.pushElement(node.immediate()));
                        stack.add(i);
                    }
                }
                case OUTPUT -> {
                    // results are gathered in finish()
                }
                default -> compute(i, node);
            }
        }

        private void compute(int i, IrNode node) {
            IrOp op = node.op();
            boolean binary = op.arity() == 2;

            if (uses(Strategy.FOLD_CONSTANTS) && foldable(node)) {
                known[i] = true;
                value[i] = BlockInterpreter.apply(op, value[node.lhs()], binary ? value[node.rhs()] : 0);
                remaining[node.lhs()]--;
                if (binary) {
                    remaining[node.rhs()]--;
                }
                return;
            }

            if (binary) {
                boolean swapped = uses(Strategy.COMMUTE_OPERANDS) && op.isCommutative()
                        && fetchCost(node.rhs(), node.lhs()) < fetchCost(node.lhs(), node.rhs());
                fetch(swapped ? node.rhs() : node.lhs());
                fetch(swapped ? node.lhs() : node.rhs());
            } else {
                fetch(node.lhs());
            }

            switch (op) {
                case NEG -> {
                    out.add(Instruction.push(-1));
                    out.add(Instruction.of(Mnemonic.MUL));
                }
                default -> out.add(Instruction.of(op.mnemonic()));
            }
            for (int k = 0; k < op.arity(); k++) {
                stack.remove(stack.size() - 1);
            }
            stack.add(i);
        }

        private boolean foldable(IrNode node) {
            if (!known[node.lhs()]) {
                return false;
            }
            if (node.op() == IrOp.INV && value[node.lhs()] == 0) {
                return false;
            }
            return node.op().arity() == 1 || known[node.rhs()];
        }

        /**
         * Instructions needed to bring {@code first} then {@code second} to the top.
         */
        private int fetchCost(int first, int second) {
            Schedule trial = new Schedule(this);
            int before = trial.out.size();
            try {
                trial.fetch(first);
                trial.fetch(second);
            } catch (LoweringException e) {
                return Integer.MAX_VALUE;
            }
            return trial.out.size() - before;
        }

        /**
         * Bring one use of {@code node} to the top of the stack as a temporary.
         */
        private void fetch(int node) {
            remaining[node]--;
            if (known[node]) {
                out.add(Instruction.pushElement(value[node]));
            } else if (lazy[node]) {
                emit(Mnemonic.DUP, stack.size() + block.node(node).immediate());
            } else {
                int pos = stack.lastIndexOf(node);
                if (pos < 0) {
                    throw new IllegalStateException("Value %" + node + " is not on the stack");
                }
                int depth = stack.size() - 1 - pos;
                if (uses(Strategy.CONSUME_LAST_USE) && remaining[node] == 0) {
                    if (depth > 0) {
                        emit(Mnemonic.PICK, depth);
                    }
                    stack.remove(pos);
                } else {
                    emit(Mnemonic.DUP, depth);
                }
            }
            stack.add(TEMP);
        }

        void finish() {
            int[] outputs = block.outputs();
            for (int output : outputs) {
                fetch(output);
            }
            int results = outputs.length;
            int junk = stack.size() - results;
            if (junk == 0) {
                return;
            }

            if (uses(Strategy.BATCH_CLEANUP) && (results == 0 || junk + results - 1 < Mnemonic.WINDOW)) {
                for (int k = 0; k < results; k++) {
                    emit(Mnemonic.PLACE, junk + results - 1);
                }
                for (int left = junk; left > 0; left -= Mnemonic.MAX_COUNT) {
                    emit(Mnemonic.POP, Math.min(left, Mnemonic.MAX_COUNT));
                }
                return;
            }

            for (int k = 0; k < junk; k++) {
                if (results > 0) {
                    emit(Mnemonic.PICK, results);
                }
                emit(Mnemonic.POP, 1);
            }
        }

        private void emit(Mnemonic mnemonic, long argument) {
            if (!mnemonic.arg().accepts(argument)) {
                throw new LoweringException(block + ": " + mnemonic.text() + " " + argument
                        + " is outside the " + Mnemonic.WINDOW + "-slot window");
            }
            out.add(Instruction.of(mnemonic, argument));
        }
    }
}
