package io.github.manjago.talos.cost;

import io.github.manjago.talos.core.Instruction;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Cliff-aware cost of straight-line instruction sequences.
 * <p>
 * Profiling sums the static per-instruction deltas of the {@link CostModel}; no
 * interpreter runs. The cost of a profile is the next power of two at or above its
 * tallest table, so one extra row across a boundary doubles it.
 */
public final class CostOracle {

    private final CostModel model;

    public CostOracle(@NotNull CostModel model) {
        this.model = model;
    }

    public CostModel model() {
        return model;
    }

    public @NotNull CostProfile profile(@NotNull List<Instruction> instructions) {
        long[] heights = new long[model.tableCount()];
        for (Instruction instruction : instructions) {
            long[] deltas = model.deltas(instruction);
            for (int t = 0; t < heights.length; t++) {
                heights[t] = Math.addExact(heights[t], deltas[t]);
            }
        }
        return new CostProfile(model.tableNames(), heights);
    }

    /**
     * {@code 2^ceil(log2(max))}, with 0 for an all-zero profile.
     */
    @Contract(pure = true)
    public static long cost(@NotNull CostProfile profile) {
        return pow2Ceil(profile.max());
    }

    public long cost(@NotNull List<Instruction> instructions) {
        return cost(profile(instructions));
    }

    @Contract(pure = true)
    static long pow2Ceil(long value) {
        if (value <= 0) {
            return 0;
        }
        if (value > (1L << 62)) {
            throw new ArithmeticException("Table height " + value + " has no power-of-two cost in range");
        }
        long high = Long.highestOneBit(value);
        return high == value ? value : high << 1;
    }
}
