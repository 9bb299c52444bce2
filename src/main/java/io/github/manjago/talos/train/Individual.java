package io.github.manjago.talos.train;

import io.github.manjago.talos.generator.GeneratorParameters;
import org.jetbrains.annotations.NotNull;

/**
 * One population member.
 *
 * @param fitness negative total chosen cost over the training batch, {@link #UNEVALUATED} until scored
 */
public record Individual(@NotNull GeneratorParameters parameters, long fitness) {

    public static final long UNEVALUATED = Long.MIN_VALUE;

    public static Individual unevaluated(GeneratorParameters parameters) {
        return new Individual(parameters, UNEVALUATED);
    }

    public boolean isEvaluated() {
        return fitness != UNEVALUATED;
    }

    public Individual withFitness(long fitness) {
        return new Individual(parameters, fitness);
    }
}
