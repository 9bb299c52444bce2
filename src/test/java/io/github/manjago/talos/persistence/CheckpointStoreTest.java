package io.github.manjago.talos.persistence;

import io.github.manjago.talos.generator.GeneratorParameters;
import io.github.manjago.talos.generator.GeneratorRegistry;
import io.github.manjago.talos.generator.GeneratorSnapshot;
import io.github.manjago.talos.generator.NeuralGenerator;
import io.github.manjago.talos.generator.ScheduleSearchGenerator;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Checkpoint store")
class CheckpointStoreTest {

    @TempDir
    Path tempDir;

    private final GeneratorRegistry registry = GeneratorRegistry.standard();

    private static GeneratorParameters schedule(long... raw) {
        long[] weights = new long[ScheduleSearchGenerator.PARAMETER_COUNT];
        System.arraycopy(raw, 0, weights, 0, raw.length);
        return new GeneratorParameters(ScheduleSearchGenerator.KIND, weights);
    }

    @Test
    @DisplayName("Saving is idempotent and addressed by content hash")
    void saveIdempotent() throws Exception {
        try (CheckpointStore store = CheckpointStore.inMemory()) {
            GeneratorParameters parameters = schedule(1, 2, 3);

            String first = store.save(parameters);
            String second = store.save(schedule(1, 2, 3));

            assertEquals(parameters.contentHash(), first);
            assertEquals(first, second);
            assertEquals(List.of(first), store.list());
            assertEquals(parameters, store.load(first));
        }
    }

    @Test
    @DisplayName("Unknown hash is not found")
    void notFound() {
        try (CheckpointStore store = CheckpointStore.inMemory()) {
            CheckpointNotFoundException e = assertThrows(CheckpointNotFoundException.class,
                    () -> store.load("deadbeef"));
            assertEquals("deadbeef", e.getHash());
            assertThrows(CheckpointNotFoundException.class, () -> store.setActive("deadbeef"));
            assertFalse(store.contains("deadbeef"));
        }
    }

    @Test
    @DisplayName("Activation is recorded and rolled back")
    void activationHistory() throws Exception {
        try (CheckpointStore store = CheckpointStore.inMemory()) {
            assertEquals(Optional.empty(), store.active());

            String a = store.save(schedule(1));
            String b = store.save(schedule(2));
            store.setActive(a);
            store.setActive(b);

            assertEquals(Optional.of(b), store.active());
            assertEquals(List.of(a, b), store.history());

            assertEquals(a, store.rollback());
            assertEquals(Optional.of(a), store.active());
            assertEquals(List.of(a), store.history());
            assertThrows(IllegalStateException.class, store::rollback);
            assertTrue(store.contains(b), "rolled back parameters stay stored");
        }
    }

    @Test
    @DisplayName("Unique prefixes resolve, unknown ones do not")
    void resolvePrefix() throws Exception {
        try (CheckpointStore store = CheckpointStore.inMemory()) {
            String hash = store.save(schedule(5));

            assertEquals(hash, store.resolve(hash.substring(0, 10)));
            assertEquals(hash, store.resolve(hash));
            assertThrows(CheckpointNotFoundException.class, () -> store.resolve("zz"));
        }
    }

    @Test
    @DisplayName("Contents survive reopening the file")
    void persistsAcrossReopen() throws Exception {
        Path file = tempDir.resolve("checkpoints.mv");
        String hash;
        try (CheckpointStore store = CheckpointStore.open(file)) {
            hash = store.save(schedule(7, 8));
            store.setActive(hash);
        }

        try (CheckpointStore store = CheckpointStore.open(file)) {
            assertEquals(Optional.of(hash), store.active());
            assertEquals(schedule(7, 8), store.load(hash));
            assertEquals(file, store.getPath());
        }
    }

    @Nested
    @DisplayName("Active snapshot")
    class ActiveSnapshot {

        @Test
        @DisplayName("Empty store is bootstrapped with the kind's defaults")
        void bootstrap() throws Exception {
            try (CheckpointStore store = CheckpointStore.inMemory()) {
                GeneratorSnapshot snapshot = store.loadActiveSnapshot(registry, "", ScheduleSearchGenerator.KIND);

                GeneratorParameters defaults = new ScheduleSearchGenerator.Factory().defaults();
                assertEquals(defaults, snapshot.parameters());
                assertEquals(Optional.of(defaults.contentHash()), store.active());
            }
        }

        @Test
        @DisplayName("Recorded active checkpoint is loaded")
        void loadsActive() throws Exception {
            try (CheckpointStore store = CheckpointStore.inMemory()) {
                GeneratorParameters parameters = schedule(3);
                store.setActive(store.save(parameters));

                GeneratorSnapshot snapshot = store.loadActiveSnapshot(registry, null, NeuralGenerator.KIND);

                assertEquals(parameters, snapshot.parameters());
            }
        }

        @Test
        @DisplayName("Explicit hash wins over the active one")
        void explicitHash() throws Exception {
            try (CheckpointStore store = CheckpointStore.inMemory()) {
                String active = store.save(schedule(1));
                String explicit = store.save(schedule(2));
                store.setActive(active);

                GeneratorSnapshot snapshot = store.loadActiveSnapshot(registry, explicit.substring(0, 16),
                        ScheduleSearchGenerator.KIND);

                assertEquals(explicit, snapshot.version());
                assertEquals(Optional.of(active), store.active());
            }
        }

        @Test
        @DisplayName("Missing explicit hash fails instead of falling back")
        void missingExplicitHash() {
            try (CheckpointStore store = CheckpointStore.inMemory()) {
                assertThrows(CheckpointNotFoundException.class,
                        () -> store.loadActiveSnapshot(registry, "0123abcd", ScheduleSearchGenerator.KIND));
                assertEquals(Optional.empty(), store.active());
            }
        }
    }
}
