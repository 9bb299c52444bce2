package io.github.manjago.talos.cost;

import io.github.manjago.talos.core.Instruction;

import java.util.List;

/**
 * Per-instruction table deltas of the target's cost accounting.
 * <p>
 * Treated as ground truth: the oracle sums these deltas and never re-derives them.
 * Implementations must be pure and thread-safe.
 */
public interface CostModel {

    /**
     * Names of the tracked tables, in delta order.
     */
    List<String> tableNames();

    default int tableCount() {
        return tableNames().size();
    }

    /**
     * Rows added to each table by one execution of {@code instruction}.
     *
     * @return array of {@link #tableCount()} non-negative values, owned by the caller
     */
    long[] deltas(Instruction instruction);
}
