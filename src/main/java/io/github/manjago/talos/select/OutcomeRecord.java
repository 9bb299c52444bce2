package io.github.manjago.talos.select;

import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.encode.FeatureTensor;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * What happened to one block: its encoding, both sequences and their costs.
 * <p>
 * Written once to the replay log and never modified. For a fallback {@code chosen}
 * equals {@code baseline} and {@code verified} is false.
 *
 * @param generatorVersion content hash of the parameters that proposed the candidates
 */
public record OutcomeRecord(
        @NotNull FeatureTensor features,
        @NotNull List<Instruction> baseline,
        long baselineCost,
        @NotNull List<Instruction> chosen,
        long chosenCost,
        boolean verified,
        @NotNull String generatorVersion
) {

    public OutcomeRecord {
        baseline = List.copyOf(baseline);
        chosen = List.copyOf(chosen);
        if (chosenCost > baselineCost) {
            throw new IllegalArgumentException(
                    "Chosen cost " + chosenCost + " exceeds baseline cost " + baselineCost);
        }
    }

    public String blockId() {
        return features.blockId();
    }

    /**
     * Cost removed by the chosen sequence, 0 for a fallback.
     */
    public long saving() {
        return baselineCost - chosenCost;
    }

    public boolean isImproved() {
        return verified && chosenCost < baselineCost;
    }
}
