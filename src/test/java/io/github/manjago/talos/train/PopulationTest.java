package io.github.manjago.talos.train;

import io.github.manjago.talos.generator.GeneratorParameters;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PopulationTest {

    private static Individual member(long id, long fitness) {
        return new Individual(new GeneratorParameters("schedule", new long[]{id}), fitness);
    }

    @Test
    @DisplayName("Ranking is by fitness, ties keep member order")
    void ranked() {
        Population population = new Population(List.of(
                member(0, -30), member(1, -10), member(2, -20), member(3, -10)));

        List<Individual> ranked = population.ranked();

        assertEquals(List.of(1L, 3L, 2L, 0L), ranked.stream().map(i -> i.parameters().rawWeights()[0]).toList());
        assertSame(population.get(1), population.best());
    }

    @Test
    @DisplayName("Best quarter survives, at least one")
    void survivors() {
        List<Individual> members = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            members.add(member(i, -i));
        }

        assertEquals(2, new Population(members).survivors().size());
        assertEquals(List.of(members.get(0), members.get(1)), new Population(members).survivors());
        assertEquals(1, new Population(members.subList(0, 3)).survivors().size());
    }

    @Test
    void emptyRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Population(List.of()));
    }

    @Test
    @DisplayName("Fresh members are unevaluated until scored")
    void evaluation() {
        Individual fresh = Individual.unevaluated(new GeneratorParameters("schedule", new long[]{1}));

        assertFalse(fresh.isEvaluated());
        assertTrue(fresh.withFitness(-5).isEvaluated());
        assertEquals(-5, fresh.withFitness(-5).fitness());
    }
}
