package io.github.manjago.talos.persistence;

import io.github.manjago.talos.generator.GeneratorFactory;
import io.github.manjago.talos.generator.GeneratorParameters;
import io.github.manjago.talos.generator.GeneratorRegistry;
import io.github.manjago.talos.generator.GeneratorSnapshot;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.h2.mvstore.MVStoreException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generator parameter storage using H2 MVStore.
 * <p>
 * Structure:
 * <ul>
 *   <li>"params" map: content hash to serialized parameters</li>
 *   <li>"meta" map: format version and the active hash</li>
 *   <li>"history" map: activation sequence number to hash</li>
 * </ul>
 * Every mutation is committed before returning. MVStore writes copy-on-write chunks, so
 * a reader never sees a partially written entry. Parameters are never deleted, which
 * keeps every activated hash available for rollback.
 */
public class CheckpointStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private static final String VERSION = "1";

    // Meta keys
    private static final String KEY_VERSION = "version";
    private static final String KEY_ACTIVE = "active";

    private final Path path;
    private final MVStore store;
    private final MVMap<String, byte[]> params;
    private final MVMap<String, String> meta;
    private final MVMap<Long, String> history;

    private CheckpointStore(Path path, MVStore store) throws IOException {
        this.path = path;
        this.store = store;
        this.params = store.openMap("params");
        this.meta = store.openMap("meta");
        this.history = store.openMap("history");

        String version = meta.putIfAbsent(KEY_VERSION, VERSION);
        if (version != null && !VERSION.equals(version)) {
            store.close();
            throw new IOException("Unsupported checkpoint store version: " + version);
        }
        store.commit();
    }

    /**
     * Open or create the store file.
     */
    public static CheckpointStore open(Path path) throws IOException {
        log.debug("Opening checkpoint store {}", path);
        try {
            MVStore store = new MVStore.Builder()
                    .fileName(path.toString())
                    .compress()
                    .open();
            return new CheckpointStore(path, store);
        } catch (MVStoreException e) {
            throw new IOException("Cannot open checkpoint store " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Store without a file, for tests and dry runs.
     */
    public static CheckpointStore inMemory() {
        try {
            return new CheckpointStore(null, new MVStore.Builder().open());
        } catch (IOException e) {
            throw new IllegalStateException("Fresh in-memory store has a version", e);
        }
    }

    /**
     * Store {@code parameters}; storing the same parameters again is a no-op.
     *
     * @return content hash
     */
    public synchronized String save(@NotNull GeneratorParameters parameters) {
        String hash = parameters.contentHash();
        if (params.putIfAbsent(hash, parameters.toBytes()) == null) {
            store.commit();
            log.info("Saved checkpoint {}", parameters);
        } else {
            log.debug("Checkpoint {} already stored", parameters.shortHash());
        }
        return hash;
    }

    /**
     * @throws CheckpointNotFoundException if nothing is stored under {@code hash}
     * @throws IOException if the stored bytes are not parameters
     */
    public @NotNull GeneratorParameters load(@NotNull String hash) throws CheckpointNotFoundException, IOException {
        byte[] bytes = params.get(hash);
        if (bytes == null) {
            throw new CheckpointNotFoundException(hash);
        }
        GeneratorParameters parameters = GeneratorParameters.fromBytes(bytes);
        if (!parameters.contentHash().equals(hash)) {
            throw new IOException("Checkpoint " + hash + " is corrupt (content hash " + parameters.contentHash() + ")");
        }
        return parameters;
    }

    public boolean contains(@NotNull String hash) {
        return params.containsKey(hash);
    }

    /**
     * Full hash for a unique prefix, as typed on the command line.
     *
     * @throws CheckpointNotFoundException if no stored hash or several start with {@code prefix}
     */
    public String resolve(@NotNull String prefix) throws CheckpointNotFoundException {
        if (params.containsKey(prefix)) {
            return prefix;
        }
        List<String> matches = new ArrayList<>();
        for (String hash : params.keySet()) {
            if (hash.startsWith(prefix)) {
                matches.add(hash);
            }
        }
        if (matches.size() != 1) {
            if (matches.size() > 1) {
                log.warn("Hash prefix {} is ambiguous: {} matches", prefix, matches.size());
            }
            throw new CheckpointNotFoundException(prefix);
        }
        return matches.get(0);
    }

    public Optional<String> active() {
        return Optional.ofNullable(meta.get(KEY_ACTIVE));
    }

    /**
     * Make {@code hash} active and record the activation.
     *
     * @throws CheckpointNotFoundException if it was never saved
     */
    public synchronized void setActive(@NotNull String hash) throws CheckpointNotFoundException {
        if (!params.containsKey(hash)) {
            throw new CheckpointNotFoundException(hash);
        }
        String previous = meta.put(KEY_ACTIVE, hash);
        Long last = history.lastKey();
        history.put(last == null ? 1L : last + 1, hash);
        store.commit();
        log.info("Active checkpoint {} -> {}", previous == null ? "none" : shortHash(previous), shortHash(hash));
    }

    /**
     * Re-activate the hash that was active before the current one.
     *
     * @return the hash now active
     * @throws IllegalStateException if there is no earlier activation
     */
    public synchronized String rollback() {
        Long last = history.lastKey();
        Long before = last == null ? null : history.lowerKey(last);
        if (before == null) {
            throw new IllegalStateException("No earlier activation to roll back to");
        }
        String current = history.remove(last);
        String restored = history.get(before);
        meta.put(KEY_ACTIVE, restored);
        store.commit();
        log.info("Rolled back active checkpoint {} -> {}", shortHash(current), shortHash(restored));
        return restored;
    }

    /**
     * Stored hashes in key order.
     */
    public List<String> list() {
        return new ArrayList<>(params.keySet());
    }

    /**
     * Activated hashes, oldest first.
     */
    public List<String> history() {
        List<String> result = new ArrayList<>();
        for (Map.Entry<Long, String> entry : history.entrySet()) {
            result.add(entry.getValue());
        }
        return result;
    }

    /**
     * Snapshot to start compilation with.
     * <p>
     * An explicitly requested hash must exist, as must the recorded active hash. A store
     * with nothing active is bootstrapped with the default parameters of
     * {@code defaultKind}, which are saved and activated.
     *
     * @param explicitHash hash or unique prefix from configuration, null or blank for the active one
     * @throws CheckpointNotFoundException if a requested or recorded hash is missing
     */
    public GeneratorSnapshot loadActiveSnapshot(@NotNull GeneratorRegistry registry,
                                                @Nullable String explicitHash,
                                                @NotNull String defaultKind)
            throws CheckpointNotFoundException, IOException {
        if (explicitHash != null && !explicitHash.isBlank()) {
            GeneratorParameters parameters = load(resolve(explicitHash.trim()));
            log.info("Using configured checkpoint {}", parameters);
            return registry.snapshot(parameters);
        }

        Optional<String> active = active();
        if (active.isPresent()) {
            GeneratorParameters parameters = load(active.get());
            log.info("Using active checkpoint {}", parameters);
            return registry.snapshot(parameters);
        }

        GeneratorFactory factory = registry.factory(defaultKind);
        GeneratorParameters defaults = factory.defaults();
        setActive(save(defaults));
        log.info("No active checkpoint, bootstrapped {}", defaults);
        return registry.snapshot(defaults);
    }

    public @Nullable Path getPath() {
        return path;
    }

    @Override
    public void close() {
        if (!store.isClosed()) {
            store.close();
        }
    }

    private static String shortHash(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
