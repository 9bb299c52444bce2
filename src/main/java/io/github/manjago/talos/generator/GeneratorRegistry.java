package io.github.manjago.talos.generator;

import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Generator factories by kind.
 */
public final class GeneratorRegistry {

    private final Map<String, GeneratorFactory> factories = new LinkedHashMap<>();

    /**
     * Registry with the neural and schedule-search generators.
     */
    public static GeneratorRegistry standard() {
        return new GeneratorRegistry()
                .register(new NeuralGenerator.Factory())
                .register(new ScheduleSearchGenerator.Factory());
    }

    public GeneratorRegistry register(GeneratorFactory factory) {
        factories.put(factory.kind(), factory);
        return this;
    }

    public Set<String> kinds() {
        return factories.keySet();
    }

    /**
     * @throws IllegalArgumentException for an unknown kind
     */
    public @NotNull GeneratorFactory factory(String kind) {
        GeneratorFactory factory = factories.get(kind);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown generator kind '" + kind + "', known: " + kinds());
        }
        return factory;
    }

    public @NotNull GeneratorSnapshot snapshot(GeneratorParameters parameters) {
        return new GeneratorSnapshot(parameters, factory(parameters.kind()).create(parameters));
    }
}
