package io.github.manjago.talos.generator;

import org.jetbrains.annotations.NotNull;

/**
 * Parameters paired with the generator built from them. Never mutated.
 */
public record GeneratorSnapshot(@NotNull GeneratorParameters parameters, @NotNull CandidateGenerator generator) {

    /**
     * Content hash of the parameters, recorded with every outcome.
     */
    public String version() {
        return parameters.contentHash();
    }
}
