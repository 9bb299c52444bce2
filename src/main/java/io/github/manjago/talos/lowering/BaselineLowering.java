package io.github.manjago.talos.lowering;

import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.ir.BasicBlock;

import java.util.List;

/**
 * Deterministic lowering whose output is the reference for cost comparison and fallback.
 */
@FunctionalInterface
public interface BaselineLowering {

    List<Instruction> lower(BasicBlock block);
}
