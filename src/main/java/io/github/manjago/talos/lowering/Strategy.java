package io.github.manjago.talos.lowering;

/**
 * Optional scheduling transformations of {@link StackScheduler}.
 */
public enum Strategy {

    /** Move a value to the top at its last use instead of copying it. */
    CONSUME_LAST_USE,

    /** Fetch operands of commutative ops in whichever order emits less code. */
    COMMUTE_OPERANDS,

    /** Evaluate ops on constants at compile time and push constants where used. */
    FOLD_CONSTANTS,

    /** Copy entry-stack inputs at each use instead of once up front. */
    LAZY_INPUTS,

    /** Sink results below dead values with place and drop them with wide pops. */
    BATCH_CLEANUP
}
