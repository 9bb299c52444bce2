package io.github.manjago.talos.select;

import io.github.manjago.talos.generator.GeneratorSnapshot;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Handle on the generator used by live compilation.
 * <p>
 * Readers take one snapshot per block and keep it for the whole selection, so a
 * promotion is seen either completely or not at all.
 */
public final class ActiveGenerator implements Supplier<GeneratorSnapshot> {

    private static final Logger log = LoggerFactory.getLogger(ActiveGenerator.class);

    private final AtomicReference<GeneratorSnapshot> current;

    public ActiveGenerator(@NotNull GeneratorSnapshot initial) {
        this.current = new AtomicReference<>(initial);
    }

    @Override
    public @NotNull GeneratorSnapshot get() {
        return current.get();
    }

    public String version() {
        return current.get().version();
    }

    /**
     * Replace the active snapshot.
     *
     * @return the snapshot that was active before
     */
    public GeneratorSnapshot swap(@NotNull GeneratorSnapshot next) {
        GeneratorSnapshot previous = current.getAndSet(next);
        log.info("Active generator {} -> {}", previous.parameters(), next.parameters());
        return previous;
    }
}
