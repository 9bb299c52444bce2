package io.github.manjago.talos.generator;

import io.github.manjago.talos.field.Fixed;
import io.github.manjago.talos.field.Goldilocks;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorParametersTest {

    @Test
    @DisplayName("Serialized form restores equal parameters with the same hash")
    void bytesRoundTrip() throws Exception {
        GeneratorParameters original = new GeneratorParameters("schedule",
                new long[]{Fixed.ONE.raw(), Fixed.ofInt(-2).raw(), 0, 7});
        GeneratorParameters restored = GeneratorParameters.fromBytes(original.toBytes());

        assertEquals(original, restored);
        assertEquals(original.contentHash(), restored.contentHash());
        assertEquals(Fixed.ofInt(-2), restored.weight(1));
    }

    @Test
    @DisplayName("Hash identifies content")
    void hashIdentifiesContent() {
        GeneratorParameters a = GeneratorParameters.zeros("schedule", 6);
        GeneratorParameters b = GeneratorParameters.zeros("schedule", 6);
        GeneratorParameters c = a.withWeights(new long[]{1, 0, 0, 0, 0, 0});
        GeneratorParameters d = GeneratorParameters.zeros("neural", 6);

        assertEquals(64, a.contentHash().length());
        assertEquals(a.contentHash(), b.contentHash());
        assertNotEquals(a.contentHash(), c.contentHash());
        assertNotEquals(a.contentHash(), d.contentHash());
        assertEquals(a.contentHash().substring(0, 12), a.shortHash());
    }

    @Test
    @DisplayName("Weights are copied in and out")
    void weightsCopied() {
        long[] raw = {1, 2, 3};
        GeneratorParameters parameters = new GeneratorParameters("schedule", raw);
        String hash = parameters.contentHash();
        raw[0] = 99;
        parameters.rawWeights()[1] = 99;

        assertEquals(1, parameters.rawWeights()[0]);
        assertEquals(2, parameters.rawWeights()[1]);
        assertEquals(hash, parameters.contentHash());
    }

    @Test
    @DisplayName("Weights outside the field are rejected")
    void rejectsNonFieldWeights() {
        assertThrows(IllegalArgumentException.class,
                () -> new GeneratorParameters("schedule", new long[]{Goldilocks.P}));
    }

    @Test
    @DisplayName("Garbage and truncated bytes are rejected")
    void rejectsCorruptBytes() {
        assertThrows(IOException.class, () -> GeneratorParameters.fromBytes(new byte[]{1, 2, 3, 4, 5, 6, 7, 8}));

        byte[] bytes = GeneratorParameters.zeros("schedule", 6).toBytes();
        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 3);
        assertThrows(IOException.class, () -> GeneratorParameters.fromBytes(truncated));
    }

    @Nested
    @DisplayName("GeneratorRegistry")
    class Registry {

        private final GeneratorRegistry registry = GeneratorRegistry.standard();

        @Test
        @DisplayName("Standard registry knows both kinds")
        void kinds() {
            assertTrue(registry.kinds().contains(NeuralGenerator.KIND));
            assertTrue(registry.kinds().contains(ScheduleSearchGenerator.KIND));
            assertThrows(IllegalArgumentException.class, () -> registry.factory("genetic"));
        }

        @Test
        @DisplayName("Snapshot version is the parameter hash")
        void snapshotVersion() {
            GeneratorParameters parameters = registry.factory(ScheduleSearchGenerator.KIND).defaults();
            GeneratorSnapshot snapshot = registry.snapshot(parameters);

            assertEquals(parameters.contentHash(), snapshot.version());
            assertInstanceOf(ScheduleSearchGenerator.class, snapshot.generator());
        }
    }
}
