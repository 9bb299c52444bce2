package io.github.manjago.talos.select;

/**
 * States of one selection, in the order they can be visited.
 */
public enum SelectionState {
    START,
    ENCODED,
    PROPOSED,
    /** One entry per candidate sent to the verifier. */
    VERIFYING,
    SELECTED,
    FALLBACK;

    public boolean isTerminal() {
        return this == SELECTED || this == FALLBACK;
    }
}
