package io.github.manjago.talos.pipeline;

import io.github.manjago.talos.ir.BasicBlock;

/**
 * Listener for compilation session events.
 *
 * Called from worker threads; implementations must be thread-safe.
 */
public interface SessionListener {

    /**
     * Called after a block was optimized, whether a candidate was selected or not.
     *
     * @param result the block's result
     */
    default void onBlockCompiled(BlockResult result) {}

    /**
     * Called when a block could not be compiled.
     *
     * @param block the block
     * @param cause encoding or lowering failure
     */
    default void onBlockFailed(BasicBlock block, Exception cause) {}

    /**
     * Called once at the end of a session.
     *
     * @param stats session totals
     */
    default void onFinished(SessionStats stats) {}

    /**
     * No-op listener that does nothing.
     */
    SessionListener NOOP = new SessionListener() {};
}
