package io.github.manjago.talos.generator;

import io.github.manjago.talos.field.Fixed;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Unverified instruction sequence proposed for one block.
 *
 * @param blockId fingerprint of the block it was generated for
 * @param source assembly lines, possibly ill-formed
 * @param score generator confidence, higher is better
 */
public record Candidate(@NotNull String blockId, @NotNull List<String> source, @NotNull Fixed score) {

    public Candidate {
        source = List.copyOf(source);
    }
}
