package io.github.manjago.talos.select;

import java.time.Duration;

/**
 * Limits of one selection.
 *
 * @param candidates          how many candidates to ask the generator for
 * @param generationBudget    wall-clock cap on generation, zero for none
 * @param verificationTimeout cap on each verifier call, zero for none
 * @param threads             size of the pool that runs capped calls
 */
public record SelectorSettings(int candidates, Duration generationBudget, Duration verificationTimeout, int threads) {

    public SelectorSettings {
        if (candidates < 0) {
            throw new IllegalArgumentException("candidates must be >= 0: " + candidates);
        }
        if (generationBudget.isNegative() || verificationTimeout.isNegative()) {
            throw new IllegalArgumentException("Negative time limit");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1: " + threads);
        }
    }

    /**
     * No time limits; calls run on the caller's thread.
     */
    public static SelectorSettings unbounded(int candidates) {
        return new SelectorSettings(candidates, Duration.ZERO, Duration.ZERO, 1);
    }

    boolean boundsGeneration() {
        return !generationBudget.isZero();
    }

    boolean boundsVerification() {
        return !verificationTimeout.isZero();
    }
}
