package io.github.manjago.talos.lowering;

import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.ir.BasicBlock;

import java.util.EnumSet;
import java.util.List;

/**
 * Reference baseline: one slot per node, operands copied with dup, dead values removed one by one.
 */
public final class NaiveLowering implements BaselineLowering {

    private final StackScheduler scheduler = new StackScheduler();

    @Override
    public List<Instruction> lower(BasicBlock block) {
        return scheduler.lower(block, EnumSet.noneOf(Strategy.class));
    }
}
