package io.github.manjago.talos.verify;

/**
 * Answer of an equivalence check. Anything but {@link #VERIFIED} counts as failure.
 */
public enum Verdict {
    VERIFIED,
    REFUTED,
    INCONCLUSIVE;

    public boolean isVerified() {
        return this == VERIFIED;
    }
}
