package io.github.manjago.talos.pipeline;

import io.github.manjago.talos.config.OptimizerConfig;
import io.github.manjago.talos.generator.ScheduleSearchGenerator;
import io.github.manjago.talos.ir.BlockReader;
import io.github.manjago.talos.ir.TestBlocks;
import io.github.manjago.talos.persistence.CheckpointNotFoundException;
import io.github.manjago.talos.persistence.CheckpointStore;
import io.github.manjago.talos.replay.ReplayLog;
import io.github.manjago.talos.select.Selection;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OptimizerTest {

    @TempDir
    Path tempDir;

    private OptimizerConfig config() {
        return OptimizerConfig.builder()
                .generationBudgetMs(0)
                .verificationTimeoutMs(0)
                .compileThreads(2)
                .checkpointFile(tempDir.resolve("checkpoints.mv"))
                .replayLog(tempDir.resolve("replay.log"))
                .build();
    }

    @Test
    @DisplayName("Fresh store starts from the configured kind's defaults")
    void bootstrapsStore() throws Exception {
        String version;
        try (Optimizer optimizer = Optimizer.open(config(), false)) {
            version = optimizer.getActive().version();
            assertEquals(new ScheduleSearchGenerator.Factory().defaults().contentHash(), version);
        }

        try (CheckpointStore store = CheckpointStore.open(tempDir.resolve("checkpoints.mv"))) {
            assertEquals(Optional.of(version), store.active());
        }
    }

    @Test
    @DisplayName("Single block optimization is recorded in the replay log")
    void optimizeRecords() throws Exception {
        BlockReader.ParsedBlock parsed = TestBlocks.sumMul();
        Selection selection;
        try (Optimizer optimizer = Optimizer.open(config(), true)) {
            selection = optimizer.optimize(parsed.block(),
                    optimizer.getLowering().lower(parsed.block()), parsed.entry());
        }

        assertTrue(selection.isSelected());
        assertEquals(1, ReplayLog.read(tempDir.resolve("replay.log")).size());
        assertEquals(selection.outcome(), ReplayLog.read(tempDir.resolve("replay.log")).get(0));
    }

    @Test
    @DisplayName("Unknown configured checkpoint fails to open")
    void unknownCheckpoint() {
        OptimizerConfig config = config().toBuilder().checkpoint("feedface").build();

        assertThrows(CheckpointNotFoundException.class, () -> Optimizer.open(config, false));
    }
}
