package io.github.manjago.talos.cost;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;

/**
 * Row counts per cost table for one instruction sequence.
 */
public final class CostProfile {

    private final List<String> tableNames;
    private final long[] heights;

    public CostProfile(@NotNull List<String> tableNames, long[] heights) {
        if (tableNames.size() != heights.length) {
            throw new IllegalArgumentException(
                    heights.length + " heights for " + tableNames.size() + " tables");
        }
        for (long h : heights) {
            if (h < 0) {
                throw new IllegalArgumentException("Negative table height: " + Arrays.toString(heights));
            }
        }
        this.tableNames = List.copyOf(tableNames);
        this.heights = heights.clone();
    }

    public int tableCount() {
        return heights.length;
    }

    public long height(int table) {
        return heights[table];
    }

    public long[] heights() {
        return heights.clone();
    }

    public List<String> tableNames() {
        return tableNames;
    }

    /**
     * Height of the tallest table, 0 for an empty profile.
     */
    public long max() {
        long max = 0;
        for (long h : heights) {
            max = Math.max(max, h);
        }
        return max;
    }

    /**
     * Index of the tallest table; the first one on ties.
     */
    public int dominantTable() {
        int best = 0;
        for (int i = 1; i < heights.length; i++) {
            if (heights[i] > heights[best]) {
                best = i;
            }
        }
        return best;
    }

    public String dominantTableName() {
        return tableNames.get(dominantTable());
    }

    /**
     * True when this profile is dominated by another table than {@code before}.
     */
    public boolean isTableRebalance(@NotNull CostProfile before) {
        return max() > 0 && before.max() > 0 && dominantTable() != before.dominantTable();
    }

    /**
     * True when the tallest table stayed the same and shrank by less than half, so any
     * cost saving against {@code before} comes from dropping below a power-of-two boundary.
     */
    public boolean isCliffJump(@NotNull CostProfile before) {
        return !isTableRebalance(before)
                && max() < before.max()
                && max() * 2 > before.max()
                && CostOracle.cost(this) < CostOracle.cost(before);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CostProfile other
                && tableNames.equals(other.tableNames)
                && Arrays.equals(heights, other.heights);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(heights);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < heights.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(tableNames.get(i)).append('=').append(heights[i]);
        }
        return sb.append('}').toString();
    }
}
