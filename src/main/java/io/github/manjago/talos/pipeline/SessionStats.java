package io.github.manjago.talos.pipeline;

/**
 * Snapshot of compilation session statistics.
 */
public record SessionStats(
    int blocks,
    int selected,
    int fallbacks,
    int failed,
    long baselineCost,        // sum over compiled blocks
    long chosenCost,          // sum over compiled blocks
    long replayWritten,
    long replayDropped,
    long elapsedMs
) {

    /**
     * Share of compiled blocks that kept the baseline.
     */
    public double fallbackRate() {
        int compiled = selected + fallbacks;
        return compiled > 0 ? (double) fallbacks / compiled : 0;
    }

    /**
     * Cost removed, in percent of the baseline total.
     */
    public double savingPercent() {
        return baselineCost > 0 ? 100.0 * (baselineCost - chosenCost) / baselineCost : 0;
    }

    public double blocksPerSecond() {
        return elapsedMs > 0 ? blocks * 1000.0 / elapsedMs : 0;
    }

    @Override
    public String toString() {
        return String.format("""
            === Compilation Statistics ===
            Blocks:           %,d (%.1f blocks/sec)
              Selected:       %,d
              Fallback:       %,d (%.1f%%)
              Failed:         %,d
            Cost:
              Baseline:       %,d
              Chosen:         %,d (%.1f%% saved)
            Replay log:       %,d written, %,d dropped
            """,
            blocks, blocksPerSecond(),
            selected,
            fallbacks, fallbackRate() * 100,
            failed,
            baselineCost,
            chosenCost, savingPercent(),
            replayWritten, replayDropped
        );
    }
}
