package io.github.manjago.talos.select;

import io.github.manjago.talos.core.Instruction;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Result of {@link SpeculativeSelector#optimize}.
 *
 * @param instructions the baseline, untouched, or a verified cheaper candidate
 * @param trace visited states, one {@link SelectionState#VERIFYING} per verifier call
 */
public record Selection(
        @NotNull List<Instruction> instructions,
        @NotNull OutcomeRecord outcome,
        @NotNull SelectionState state,
        @NotNull DecisionReason reason,
        @NotNull List<SelectionState> trace
) {

    public Selection {
        instructions = List.copyOf(instructions);
        trace = List.copyOf(trace);
    }

    public boolean isSelected() {
        return state == SelectionState.SELECTED;
    }

    /**
     * Number of candidates handed to the verifier.
     */
    public int verifications() {
        return (int) trace.stream().filter(s -> s == SelectionState.VERIFYING).count();
    }
}
