package io.github.manjago.talos.verify;

import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.core.Mnemonic;
import io.github.manjago.talos.core.StackMachine;
import io.github.manjago.talos.field.Goldilocks;
import io.github.manjago.talos.ir.BasicBlock;
import io.github.manjago.talos.ir.BlockInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Differential tester: runs the candidate on the stack machine against the IR semantics
 * over several entry stacks.
 * <p>
 * Entry stacks are derived from the block fingerprint, so verdicts are reproducible.
 * The first two trials use small integers and values just below the modulus; the rest
 * are pseudo-random field elements. A candidate must reproduce the whole final stack,
 * entry elements included.
 */
public final class DifferentialVerifier implements EquivalenceVerifier {

    private static final Logger log = LoggerFactory.getLogger(DifferentialVerifier.class);

    private static final long LCG_MULTIPLIER = 6364136223846793005L;
    private static final long LCG_INCREMENT = 1442695040888963407L;

    private final int trials;
    private final StackMachine machine = new StackMachine();

    public DifferentialVerifier(int trials) {
        if (trials < 1) {
            throw new IllegalArgumentException("At least one trial required: " + trials);
        }
        this.trials = trials;
    }

    @Override
    public Verdict verify(BasicBlock block, List<Instruction> candidate) {
        for (Instruction instruction : candidate) {
            if (instruction.mnemonic().isControlFlow()) {
                return Verdict.REFUTED;
            }
        }

        int checked = 0;
        for (int trial = 0; trial < trials; trial++) {
            if (Thread.currentThread().isInterrupted()) {
                return Verdict.INCONCLUSIVE;
            }
            long[] entry = entryStack(block, trial);
            long[] expected;
            try {
                expected = expectedStack(block, entry);
            } catch (ArithmeticException e) {
                log.debug("{}: trial {} undefined for the block ({}), skipped", block, trial, e.getMessage());
                continue;
            }

            StackMachine.RunResult run = machine.run(candidate, entry);
            if (!run.isSuccess()) {
                log.debug("{}: candidate failed with {} at {}", block, run.status(), run.failedAt());
                return Verdict.REFUTED;
            }
            if (!Arrays.equals(expected, run.stack())) {
                return Verdict.REFUTED;
            }
            checked++;
        }
        return checked > 0 ? Verdict.VERIFIED : Verdict.INCONCLUSIVE;
    }

    private static long[] expectedStack(BasicBlock block, long[] entry) {
        long[] outputs = BlockInterpreter.evaluate(block, entry);
        long[] expected = Arrays.copyOf(entry, entry.length + outputs.length);
        System.arraycopy(outputs, 0, expected, entry.length, outputs.length);
        return expected;
    }

    /**
     * Entry stack of one full window for {@code trial}, bottom first.
     */
    static long[] entryStack(BasicBlock block, int trial) {
        long[] entry = new long[Mnemonic.WINDOW];
        switch (trial) {
            case 0 -> {
                for (int i = 0; i < entry.length; i++) {
                    entry[i] = i + 2;
                }
            }
            case 1 -> {
                for (int i = 0; i < entry.length; i++) {
                    entry[i] = Goldilocks.P - 1 - i;
                }
            }
            default -> {
                long state = seed(block) * LCG_MULTIPLIER + LCG_INCREMENT + trial;
                for (int i = 0; i < entry.length; i++) {
                    state = state * LCG_MULTIPLIER + 1;
                    entry[i] = Long.remainderUnsigned(state, Goldilocks.P);
                }
            }
        }
        return entry;
    }

    /**
     * Leading 64 bits of the block fingerprint.
     */
    static long seed(BasicBlock block) {
        return Long.parseUnsignedLong(block.fingerprint().substring(0, 16), 16);
    }
}
