package io.github.manjago.talos.train;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Summary of one training session.
 *
 * @param activeHash    parameters active when the session ended
 * @param promotedHash  newly promoted parameters, null unless {@link Outcome#PROMOTED}
 * @param activeFitness fitness of the previously active parameters on the validation batch
 * @param bestFitness   fitness of the best member on the validation batch
 */
public record TrainingResult(
        @NotNull Outcome outcome,
        @NotNull String activeHash,
        @Nullable String promotedHash,
        long activeFitness,
        long bestFitness,
        int generations
) {

    public enum Outcome {
        PROMOTED,
        NOT_PROMOTED,
        CANCELLED,
        INSUFFICIENT_DATA
    }

    public boolean isPromoted() {
        return outcome == Outcome.PROMOTED;
    }

    @Override
    public String toString() {
        return String.format("""
            === Training Result ===
            Outcome:          %s
            Generations:      %d
            Active:           %s
            Promoted:         %s
            Validation cost:  %,d active, %,d best
            """,
            outcome,
            generations,
            activeHash,
            promotedHash == null ? "-" : promotedHash,
            -activeFitness, -bestFitness
        );
    }
}
