package io.github.manjago.talos.cli;

import io.github.manjago.talos.config.OptimizerConfig;
import io.github.manjago.talos.field.Fixed;
import io.github.manjago.talos.generator.GeneratorFactory;
import io.github.manjago.talos.generator.GeneratorParameters;
import io.github.manjago.talos.generator.GeneratorRegistry;
import io.github.manjago.talos.persistence.CheckpointNotFoundException;
import io.github.manjago.talos.persistence.CheckpointStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: checkpoint
 *
 * Work with the generator checkpoint store.
 *
 * Usage:
 *   talos checkpoint list              # Stored parameters, active marked
 *   talos checkpoint info 3fa2c1       # Details of one checkpoint
 *   talos checkpoint activate 3fa2c1   # Make it active
 *   talos checkpoint init neural       # Store and activate default parameters
 *   talos checkpoint rollback          # Re-activate the previous checkpoint
 */
@Command(
    name = "checkpoint",
    description = "Work with generator checkpoints",
    mixinStandardHelpOptions = true,
    subcommands = {
        CheckpointCommand.ListCommand.class,
        CheckpointCommand.InfoCommand.class,
        CheckpointCommand.ActivateCommand.class,
        CheckpointCommand.InitCommand.class,
        CheckpointCommand.RollbackCommand.class
    }
)
public class CheckpointCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Use 'checkpoint list', 'info', 'activate', 'init' or 'rollback'");
        System.out.println("Run 'talos checkpoint --help' for usage");
        return 0;
    }

    /**
     * Body of a subcommand that works on an open store.
     */
    @FunctionalInterface
    interface StoreAction {
        int run(CheckpointStore store) throws IOException, CheckpointNotFoundException;
    }

    static int withStore(ConfigOptions options, StoreAction action) {
        OptimizerConfig config = options.builder().build();
        try (CheckpointStore store = CheckpointStore.open(config.checkpointFile())) {
            return action.run(store);
        } catch (CheckpointNotFoundException e) {
            System.err.println("❌ " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("❌ " + e.getMessage());
            return 2;
        }
    }

    // ========== Subcommand: list ==========

    @Command(
        name = "list",
        description = "List stored checkpoints",
        mixinStandardHelpOptions = true
    )
    public static class ListCommand implements Callable<Integer> {

        @Mixin
        private ConfigOptions configOptions;

        @Override
        public Integer call() {
            return withStore(configOptions, store -> {
                String active = store.active().orElse("");
                List<String> hashes = store.list();
                System.out.printf("%d checkpoints in %s%n", hashes.size(), store.getPath());
                for (String hash : hashes) {
                    GeneratorParameters parameters = store.load(hash);
                    System.out.printf("%s %s  %-9s %,7d weights%n",
                            hash.equals(active) ? "*" : " ", hash, parameters.kind(), parameters.size());
                }
                return 0;
            });
        }
    }

    // ========== Subcommand: info ==========

    @Command(
        name = "info",
        description = "Show checkpoint details",
        mixinStandardHelpOptions = true
    )
    public static class InfoCommand implements Callable<Integer> {

        @Parameters(index = "0", arity = "0..1", description = "Hash or unique prefix (default: active)")
        private String hash;

        @Mixin
        private ConfigOptions configOptions;

        @Override
        public Integer call() {
            return withStore(configOptions, store -> {
                Optional<String> target = hash != null ? Optional.of(store.resolve(hash)) : store.active();
                if (target.isEmpty()) {
                    System.out.println("No active checkpoint");
                    return 1;
                }
                GeneratorParameters parameters = store.load(target.get());

                int zeros = 0;
                double sumAbs = 0;
                double maxAbs = 0;
                for (int i = 0; i < parameters.size(); i++) {
                    Fixed w = parameters.weight(i);
                    if (w.isZero()) zeros++;
                    double abs = Math.abs(w.toDouble());
                    sumAbs += abs;
                    maxAbs = Math.max(maxAbs, abs);
                }

                System.out.println("📋 Checkpoint " + parameters.contentHash());
                System.out.printf("   Kind:        %s%n", parameters.kind());
                System.out.printf("   Weights:     %,d (%,d zero)%n", parameters.size(), zeros);
                System.out.printf("   Mean |w|:    %.5f%n", parameters.size() > 0 ? sumAbs / parameters.size() : 0);
                System.out.printf("   Max |w|:     %.5f%n", maxAbs);
                System.out.printf("   Active:      %s%n",
                        store.active().map(parameters.contentHash()::equals).orElse(false) ? "yes" : "no");
                List<String> history = store.history();
                System.out.printf("   Activations: %d%n", history.stream().filter(parameters.contentHash()::equals).count());
                return 0;
            });
        }
    }

    // ========== Subcommand: activate ==========

    @Command(
        name = "activate",
        description = "Make a stored checkpoint active",
        mixinStandardHelpOptions = true
    )
    public static class ActivateCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Hash or unique prefix")
        private String hash;

        @Mixin
        private ConfigOptions configOptions;

        @Override
        public Integer call() {
            return withStore(configOptions, store -> {
                String full = store.resolve(hash);
                store.setActive(full);
                System.out.println("✅ Active: " + full);
                return 0;
            });
        }
    }

    // ========== Subcommand: init ==========

    @Command(
        name = "init",
        description = "Store default parameters of a generator kind",
        mixinStandardHelpOptions = true
    )
    public static class InitCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Generator kind: ${COMPLETION-CANDIDATES}",
                completionCandidates = KindCandidates.class)
        private String kind;

        @Option(names = {"--no-activate"}, description = "Only store, keep the current active checkpoint")
        private boolean noActivate;

        @Mixin
        private ConfigOptions configOptions;

        @Override
        public Integer call() {
            GeneratorFactory factory;
            try {
                factory = GeneratorRegistry.standard().factory(kind);
            } catch (IllegalArgumentException e) {
                System.err.println("❌ " + e.getMessage());
                return 2;
            }
            return withStore(configOptions, store -> {
                String hash = store.save(factory.defaults());
                if (!noActivate) {
                    store.setActive(hash);
                }
                System.out.printf("✅ Stored %s defaults: %s%s%n", kind, hash, noActivate ? "" : " (active)");
                return 0;
            });
        }
    }

    static class KindCandidates implements Iterable<String> {
        @Override
        public Iterator<String> iterator() {
            return GeneratorRegistry.standard().kinds().iterator();
        }
    }

    // ========== Subcommand: rollback ==========

    @Command(
        name = "rollback",
        description = "Re-activate the previously active checkpoint",
        mixinStandardHelpOptions = true
    )
    public static class RollbackCommand implements Callable<Integer> {

        @Mixin
        private ConfigOptions configOptions;

        @Override
        public Integer call() {
            return withStore(configOptions, store -> {
                try {
                    System.out.println("✅ Active: " + store.rollback());
                    return 0;
                } catch (IllegalStateException e) {
                    System.err.println("❌ " + e.getMessage());
                    return 1;
                }
            });
        }
    }
}
