package io.github.manjago.talos.pipeline;

import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.ir.BasicBlock;
import io.github.manjago.talos.select.Selection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Outcome of compiling one block: a selection, or the diagnostic that aborted it.
 */
public record BlockResult(@NotNull BasicBlock block, @Nullable Selection selection, @Nullable String error) {

    public static BlockResult compiled(BasicBlock block, Selection selection) {
        return new BlockResult(block, selection, null);
    }

    public static BlockResult failed(BasicBlock block, String error) {
        return new BlockResult(block, null, error);
    }

    public boolean isFailed() {
        return selection == null;
    }

    /**
     * Emitted code, empty for a failed block.
     */
    public List<Instruction> instructions() {
        return selection == null ? List.of() : selection.instructions();
    }
}
