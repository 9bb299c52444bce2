package io.github.manjago.talos.encode;

import io.github.manjago.talos.core.Mnemonic;
import io.github.manjago.talos.field.Fixed;
import io.github.manjago.talos.ir.BasicBlock;
import io.github.manjago.talos.ir.IrOp;
import io.github.manjago.talos.ir.ValueType;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Fixed-size fixed-point encoding of a block and its entry state.
 *
 * <h2>Layout</h2>
 * One record of {@link #RECORD_WIDTH} values per node, zero padded to
 * {@link BasicBlock#MAX_NODES} records, followed by the entry context.
 * <pre>
 * offset  width  field
 *  0      12     op one-hot
 * 12       3     type one-hot
 * 15       1     lhs reference (index + 1, 0 = none)
 * 16       1     rhs reference (index + 1, 0 = none)
 * 17       1     live start (defining index)
 * 18       1     live end (last-use index)
 * 19       4     immediate, 16-bit limbs low first, each stored raw as limb / 2^16
 * </pre>
 * Entry context: 16 occupancy flags then 16 liveness flags for the near-register window.
 * <p>
 * The layout is part of the generator input contract and must not change without a new
 * generator version.
 */
public final class FeatureTensor {

    public static final int OP_OFFSET = 0;
    public static final int TYPE_OFFSET = OP_OFFSET + IrOp.values().length;
    public static final int LHS_OFFSET = TYPE_OFFSET + ValueType.values().length;
    public static final int RHS_OFFSET = LHS_OFFSET + 1;
    public static final int LIVE_START_OFFSET = RHS_OFFSET + 1;
    public static final int LIVE_END_OFFSET = LIVE_START_OFFSET + 1;
    public static final int IMMEDIATE_OFFSET = LIVE_END_OFFSET + 1;
    public static final int IMMEDIATE_LIMBS = 4;
    public static final int RECORD_WIDTH = IMMEDIATE_OFFSET + IMMEDIATE_LIMBS;

    public static final int CONTEXT_OFFSET = BasicBlock.MAX_NODES * RECORD_WIDTH;
    public static final int CONTEXT_WIDTH = 2 * Mnemonic.WINDOW;
    public static final int LENGTH = CONTEXT_OFFSET + CONTEXT_WIDTH;

    static final int LIMB_BITS = 16;
    static final long LIMB_MASK = (1L << LIMB_BITS) - 1;

    private final String blockId;
    private final int nodeCount;
    private final long[] raw;

    FeatureTensor(String blockId, int nodeCount, long[] raw) {
        if (raw.length != LENGTH) {
            throw new IllegalArgumentException("Tensor length " + raw.length + ", expected " + LENGTH);
        }
        this.blockId = blockId;
        this.nodeCount = nodeCount;
        this.raw = raw;
    }

    /**
     * Rebuild a tensor from persisted raw values.
     */
    public static @NotNull FeatureTensor fromRaw(String blockId, int nodeCount, long[] raw) {
        return new FeatureTensor(blockId, nodeCount, raw.clone());
    }

    /**
     * Fingerprint of the block this tensor was computed from.
     */
    public String blockId() {
        return blockId;
    }

    public int nodeCount() {
        return nodeCount;
    }

    public Fixed get(int index) {
        return Fixed.ofRaw(raw[index]);
    }

    /**
     * Value of {@code field} (one of the offsets) in the record of {@code node}.
     */
    public Fixed field(int node, int field) {
        return get(node * RECORD_WIDTH + field);
    }

    /**
     * True if the one-hot op tag of {@code node} is {@code op}.
     */
    public boolean hasOp(int node, IrOp op) {
        return raw[node * RECORD_WIDTH + OP_OFFSET + op.ordinal()] == Fixed.SCALE;
    }

    /**
     * Immediate of {@code node} reassembled from its limbs.
     */
    public long immediate(int node) {
        int base = node * RECORD_WIDTH + IMMEDIATE_OFFSET;
        long value = 0;
        for (int limb = 0; limb < IMMEDIATE_LIMBS; limb++) {
            value |= (raw[base + limb] & LIMB_MASK) << (limb * LIMB_BITS);
        }
        return value;
    }

    /**
     * Raw field elements in layout order.
     */
    public long[] toRawArray() {
        return raw.clone();
    }

    public Fixed[] toArray() {
        Fixed[] values = new Fixed[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            values[i] = Fixed.ofRaw(raw[i]);
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FeatureTensor other
                && nodeCount == other.nodeCount
                && blockId.equals(other.blockId)
                && Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return 31 * blockId.hashCode() + Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "FeatureTensor[" + blockId.substring(0, Math.min(8, blockId.length())) + ", " + nodeCount + " nodes]";
    }
}
