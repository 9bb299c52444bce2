package io.github.manjago.talos.generator;

/**
 * Builds generators of one kind from parameters.
 */
public interface GeneratorFactory {

    /** Name stored with the parameters. */
    String kind();

    /** Number of weights the generator expects. */
    int parameterCount();

    /**
     * @throws IllegalArgumentException if the parameters are of another kind or size
     */
    CandidateGenerator create(GeneratorParameters parameters);

    /**
     * Starting parameters when nothing has been trained yet.
     */
    default GeneratorParameters defaults() {
        return GeneratorParameters.zeros(kind(), parameterCount());
    }

    default void checkCompatible(GeneratorParameters parameters) {
        if (!kind().equals(parameters.kind())) {
            throw new IllegalArgumentException("Expected " + kind() + " parameters, got " + parameters.kind());
        }
        if (parameters.size() != parameterCount()) {
            throw new IllegalArgumentException(kind() + " expects " + parameterCount()
                    + " weights, got " + parameters.size());
        }
    }
}
