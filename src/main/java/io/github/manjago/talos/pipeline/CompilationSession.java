package io.github.manjago.talos.pipeline;

import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.encode.EncodingException;
import io.github.manjago.talos.ir.BasicBlock;
import io.github.manjago.talos.ir.BlockReader;
import io.github.manjago.talos.lowering.BaselineLowering;
import io.github.manjago.talos.lowering.LoweringException;
import io.github.manjago.talos.replay.ReplayLog;
import io.github.manjago.talos.select.Selection;
import io.github.manjago.talos.select.SpeculativeSelector;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs baseline lowering and speculative selection over many blocks.
 * <p>
 * Blocks are independent and run on a fixed worker pool; results come back in input
 * order. A block that cannot be lowered or encoded is reported as failed and the others
 * carry on. Every outcome is appended to the replay log when one is attached.
 */
public class CompilationSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CompilationSession.class);

    private final SpeculativeSelector selector;
    private final BaselineLowering lowering;
    private final ReplayLog replayLog;
    private final ExecutorService workers;

    private SessionListener listener = SessionListener.NOOP;

    // Statistics
    private final AtomicInteger blocks = new AtomicInteger();
    private final AtomicInteger selected = new AtomicInteger();
    private final AtomicInteger fallbacks = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicLong baselineCost = new AtomicLong();
    private final AtomicLong chosenCost = new AtomicLong();
    private final AtomicLong elapsedMs = new AtomicLong();

    public CompilationSession(@NotNull SpeculativeSelector selector,
                              @NotNull BaselineLowering lowering,
                              @Nullable ReplayLog replayLog,
                              int threads) {
        this.selector = selector;
        this.lowering = lowering;
        this.replayLog = replayLog;
        this.workers = Executors.newFixedThreadPool(Math.max(1, threads));
    }

    /**
     * Set event listener for session events.
     */
    public void setListener(SessionListener listener) {
        this.listener = listener != null ? listener : SessionListener.NOOP;
    }

    /**
     * Compile all blocks; returns one result per block, in order.
     */
    public List<BlockResult> compile(@NotNull List<BlockReader.ParsedBlock> input) {
        log.info("Compiling {} blocks", input.size());
        long startTime = System.currentTimeMillis();

        List<Future<BlockResult>> futures = new ArrayList<>();
        for (BlockReader.ParsedBlock parsed : input) {
            futures.add(workers.submit(() -> compileBlock(parsed)));
        }

        List<BlockResult> results = new ArrayList<>();
        try {
            for (Future<BlockResult> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Compilation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unexpected compilation failure", e.getCause());
        }

        long elapsed = System.currentTimeMillis() - startTime;
        elapsedMs.addAndGet(elapsed);
        SessionStats stats = getStats();
        logDegradedRate(stats);
        listener.onFinished(stats);
        return results;
    }

    /**
     * Lower and optimize one block.
     */
    public BlockResult compileBlock(@NotNull BlockReader.ParsedBlock parsed) {
        BasicBlock block = parsed.block();
        blocks.incrementAndGet();
        try {
            List<Instruction> baseline = lowering.lower(block);
            Selection selection = selector.optimize(block, baseline, parsed.entry());

            if (selection.isSelected()) {
                selected.incrementAndGet();
            } else {
                fallbacks.incrementAndGet();
            }
            baselineCost.addAndGet(selection.outcome().baselineCost());
            chosenCost.addAndGet(selection.outcome().chosenCost());
            if (replayLog != null) {
                replayLog.append(selection.outcome());
            }

            log.debug("{}: {} {} ({} -> {})", block, selection.state(), selection.reason(),
                    selection.outcome().baselineCost(), selection.outcome().chosenCost());
            BlockResult result = BlockResult.compiled(block, selection);
            listener.onBlockCompiled(result);
            return result;
        } catch (EncodingException | LoweringException e) {
            failed.incrementAndGet();
            log.error("{}: compilation aborted: {}", block, e.getMessage());
            listener.onBlockFailed(block, e);
            return BlockResult.failed(block, e.getMessage());
        }
    }

    private void logDegradedRate(SessionStats stats) {
        if (stats.selected() + stats.fallbacks() == 0) {
            return;
        }
        if (stats.selected() == 0) {
            log.warn("All {} compiled blocks fell back to the baseline", stats.fallbacks());
        } else {
            log.info("Fallback rate {}% ({} of {}), cost saved {}%",
                    String.format("%.1f", stats.fallbackRate() * 100), stats.fallbacks(),
                    stats.selected() + stats.fallbacks(), String.format("%.1f", stats.savingPercent()));
        }
    }

    /**
     * Get current statistics snapshot.
     */
    public SessionStats getStats() {
        return new SessionStats(
                blocks.get(),
                selected.get(),
                fallbacks.get(),
                failed.get(),
                baselineCost.get(),
                chosenCost.get(),
                replayLog != null ? replayLog.getWritten() : 0,
                replayLog != null ? replayLog.getDropped() : 0,
                elapsedMs.get()
        );
    }

    @Override
    public void close() {
        workers.shutdown();
    }
}
