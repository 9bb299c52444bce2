package io.github.manjago.talos.select;

import io.github.manjago.talos.cost.CostProfile;

/**
 * Why a selection ended the way it did.
 */
public enum DecisionReason {

    /** The generator declined, failed, timed out or produced only unusable candidates. */
    NO_CANDIDATE(false),

    /** Every well-formed candidate cost at least as much as the baseline. */
    NOT_CHEAPER(false),

    /** Cheaper candidates existed but none verified. */
    UNVERIFIED(false),

    /** Same dominant table, trimmed just below a power-of-two boundary. */
    CLIFF_JUMP(true),

    /** Work moved so that another table dominates. */
    TABLE_REBALANCE(true),

    /** Same dominant table, at least halved by a better stack schedule. */
    STACK_SCHEDULING(true);

    private final boolean selected;

    DecisionReason(boolean selected) {
        this.selected = selected;
    }

    public boolean isSelected() {
        return selected;
    }

    /**
     * Classify a saving from {@code baseline} to {@code chosen}.
     */
    public static DecisionReason classify(CostProfile baseline, CostProfile chosen) {
        if (chosen.isTableRebalance(baseline)) {
            return TABLE_REBALANCE;
        }
        if (chosen.isCliffJump(baseline)) {
            return CLIFF_JUMP;
        }
        return STACK_SCHEDULING;
    }
}
