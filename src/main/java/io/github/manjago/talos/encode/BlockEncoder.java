package io.github.manjago.talos.encode;

import io.github.manjago.talos.core.Mnemonic;
import io.github.manjago.talos.field.Fixed;
import io.github.manjago.talos.field.Goldilocks;
import io.github.manjago.talos.ir.BasicBlock;
import io.github.manjago.talos.ir.IrNode;
import io.github.manjago.talos.ir.IrOp;
import io.github.manjago.talos.ir.MachineState;
import io.github.manjago.talos.ir.ValueType;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Encodes blocks into {@link FeatureTensor}s and back.
 * <p>
 * The encoding is a total function of the block and entry state: no recovery and no
 * truncation, malformed input is rejected.
 */
public final class BlockEncoder {

    /**
     * A block and entry state recovered from a tensor.
     */
    public record Decoded(BasicBlock block, MachineState entry) {}

    /**
     * Encode {@code block} as seen from {@code entry}.
     *
     * @throws BlockTooLargeException if the block has more than {@link BasicBlock#MAX_NODES} nodes
     * @throws InvalidReferenceException if a node refers to something it cannot
     */
    public @NotNull FeatureTensor encode(@NotNull BasicBlock block, @NotNull MachineState entry)
            throws EncodingException {
        validate(block, entry);

        long[] raw = new long[FeatureTensor.LENGTH];
        int[] lastUse = lastUses(block);

        for (int i = 0; i < block.size(); i++) {
            IrNode node = block.node(i);
            int base = i * FeatureTensor.RECORD_WIDTH;
            raw[base + FeatureTensor.OP_OFFSET + node.op().ordinal()] = Fixed.SCALE;
            raw[base + FeatureTensor.TYPE_OFFSET + node.type().ordinal()] = Fixed.SCALE;
            raw[base + FeatureTensor.LHS_OFFSET] = Fixed.ofInt(node.lhs() + 1L).raw();
            raw[base + FeatureTensor.RHS_OFFSET] = Fixed.ofInt(node.rhs() + 1L).raw();
            raw[base + FeatureTensor.LIVE_START_OFFSET] = Fixed.ofInt(i).raw();
            raw[base + FeatureTensor.LIVE_END_OFFSET] = Fixed.ofInt(lastUse[i]).raw();
            for (int limb = 0; limb < FeatureTensor.IMMEDIATE_LIMBS; limb++) {
                raw[base + FeatureTensor.IMMEDIATE_OFFSET + limb] = (node.immediate() >>> (limb * FeatureTensor.LIMB_BITS))
                        & FeatureTensor.LIMB_MASK;
            }
        }

        int context = FeatureTensor.CONTEXT_OFFSET;
        for (int slot = 0; slot < Mnemonic.WINDOW; slot++) {
            raw[context + slot] = entry.occupied(slot) ? Fixed.SCALE : 0;
            raw[context + Mnemonic.WINDOW + slot] = entry.live(slot) ? Fixed.SCALE : 0;
        }
        return new FeatureTensor(block.fingerprint(), block.size(), raw);
    }

    /**
     * Check the structural preconditions of encoding and lowering.
     */
    public static void validate(@NotNull BasicBlock block, @NotNull MachineState entry) throws EncodingException {
        if (block.size() > BasicBlock.MAX_NODES) {
            throw new BlockTooLargeException(block.size());
        }
        for (int i = 0; i < block.size(); i++) {
            IrNode node = block.node(i);
            IrOp op = node.op();
            switch (op) {
                case INPUT -> {
                    long depth = node.immediate();
                    if (depth < 0 || depth >= Mnemonic.WINDOW) {
                        throw new InvalidReferenceException(i, "input depth " + depth + " outside the window");
                    }
                    if (depth >= entry.depth()) {
                        throw new InvalidReferenceException(i,
                                "input depth " + depth + " but only " + entry.depth() + " entry elements");
                    }
                }
                case CONST -> {
                    if (Long.compareUnsigned(node.immediate(), Goldilocks.P) >= 0) {
                        throw new EncodingException("Node %" + i + ": constant is not a field element");
                    }
                }
                default -> {
                    // operands checked below
                }
            }
            checkOperand(block, i, node.lhs(), op.arity() >= 1);
            checkOperand(block, i, node.rhs(), op.arity() >= 2);
        }
    }

    private static void checkOperand(BasicBlock block, int index, int ref, boolean used)
            throws InvalidReferenceException {
        if (!used) {
            if (ref != IrNode.NONE) {
                throw new InvalidReferenceException(index, "unexpected operand %" + ref);
            }
            return;
        }
        if (ref < 0 || ref >= index) {
            throw new InvalidReferenceException(index, "dangling reference %" + ref);
        }
        if (!block.node(ref).op().producesValue()) {
            throw new InvalidReferenceException(index, "%" + ref + " produces no value");
        }
    }

    /**
     * Last-use index of every node from one backward pass; unused nodes end where they start.
     */
    static int[] lastUses(BasicBlock block) {
        int n = block.size();
        int[] lastUse = new int[n];
        Arrays.fill(lastUse, -1);
        for (int j = n - 1; j >= 0; j--) {
            IrNode node = block.node(j);
            if (node.lhs() != IrNode.NONE && lastUse[node.lhs()] < 0) {
                lastUse[node.lhs()] = j;
            }
            if (node.rhs() != IrNode.NONE && lastUse[node.rhs()] < 0) {
                lastUse[node.rhs()] = j;
            }
            if (lastUse[j] < 0) {
                lastUse[j] = j;
            }
        }
        return lastUse;
    }

    /**
     * Recover the block and the window-clipped entry state.
     *
     * @throws EncodingException if the tensor is not a well-formed encoding of its block id
     */
    public @NotNull Decoded decode(@NotNull FeatureTensor tensor) throws EncodingException {
        List<IrNode> nodes = new ArrayList<>(tensor.nodeCount());
        for (int i = 0; i < tensor.nodeCount(); i++) {
            int base = i * FeatureTensor.RECORD_WIDTH;
            IrOp op = IrOp.values()[oneHot(tensor, base + FeatureTensor.OP_OFFSET, IrOp.values().length, i)];
            ValueType type = ValueType.values()[oneHot(tensor, base + FeatureTensor.TYPE_OFFSET,
                    ValueType.values().length, i)];
            int lhs = toInt(tensor.get(base + FeatureTensor.LHS_OFFSET)) - 1;
            int rhs = toInt(tensor.get(base + FeatureTensor.RHS_OFFSET)) - 1;
            nodes.add(new IrNode(op, type, lhs, rhs, tensor.immediate(i)));
        }

        int depth = 0;
        int liveMask = 0;
        for (int slot = 0; slot < Mnemonic.WINDOW; slot++) {
            if (!tensor.get(FeatureTensor.CONTEXT_OFFSET + slot).isZero()) {
                depth = slot + 1;
            }
            if (!tensor.get(FeatureTensor.CONTEXT_OFFSET + Mnemonic.WINDOW + slot).isZero()) {
                liveMask |= 1 << slot;
            }
        }

        BasicBlock block = new BasicBlock("decoded", nodes);
        if (!block.fingerprint().equals(tensor.blockId())) {
            throw new EncodingException("Tensor content does not match block id " + tensor.blockId());
        }
        return new Decoded(block, new MachineState(depth, liveMask));
    }

    private static int oneHot(FeatureTensor tensor, int offset, int width, int node) throws EncodingException {
        for (int k = 0; k < width; k++) {
            if (tensor.get(offset + k).equals(Fixed.ONE)) {
                return k;
            }
        }
        throw new EncodingException("Node %" + node + ": no one-hot tag set");
    }

    private static int toInt(Fixed value) {
        return (int) (value.signedRaw() >> Fixed.SCALE_BITS);
    }
}
