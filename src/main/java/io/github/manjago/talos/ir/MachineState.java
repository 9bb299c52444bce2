package io.github.manjago.talos.ir;

import io.github.manjago.talos.core.Mnemonic;

/**
 * Machine state at block entry, as known to the caller.
 *
 * @param depth number of elements on the stack at entry
 * @param liveMask bit {@code i} set if the element at depth {@code i} of the window is live after the block
 */
public record MachineState(int depth, int liveMask) {

    public MachineState {
        if (depth < 0) {
            throw new IllegalArgumentException("Negative stack depth: " + depth);
        }
        if ((liveMask >>> Mnemonic.WINDOW) != 0) {
            throw new IllegalArgumentException("Live mask wider than the window: 0x" + Integer.toHexString(liveMask));
        }
    }

    /**
     * Entry state with {@code depth} elements, all live.
     */
    public static MachineState allLive(int depth) {
        int slots = Math.min(depth, Mnemonic.WINDOW);
        return new MachineState(depth, (1 << slots) - 1);
    }

    public boolean occupied(int slot) {
        return slot < depth;
    }

    public boolean live(int slot) {
        return ((liveMask >>> slot) & 1) == 1;
    }
}
