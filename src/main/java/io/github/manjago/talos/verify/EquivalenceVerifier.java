package io.github.manjago.talos.verify;

import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.ir.BasicBlock;

import java.util.List;

/**
 * Decides whether a candidate implements a block.
 * <p>
 * Implementations must be sound (never {@link Verdict#VERIFIED} for a non-equivalent
 * candidate) and may be conservative. They must be thread-safe and should respond to
 * interruption, which is how the selector enforces its timeout.
 */
@FunctionalInterface
public interface EquivalenceVerifier {

    Verdict verify(BasicBlock block, List<Instruction> candidate);
}
