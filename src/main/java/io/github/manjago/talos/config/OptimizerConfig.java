package io.github.manjago.talos.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.talos.select.SelectorSettings;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for the Talos optimizer.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record OptimizerConfig(
    // Generator
    String generatorKind,
    int candidates,
    long generationBudgetMs,   // 0 = unlimited
    String checkpoint,         // empty = active checkpoint

    // Verification
    long verificationTimeoutMs,
    int verificationThreads,
    int verificationTrials,

    // Trainer
    int population,
    int generations,
    int batchSize,
    int validationSize,
    double mutationRate,
    double perturbation,
    double minImprovement,
    long seed,
    int trainerThreads,
    int convergenceWindow,     // 0 = never stop early

    // Persistence
    Path checkpointFile,
    Path replayLog,
    int replayQueue,

    // Compilation
    int compileThreads
) {

    /**
     * Load default configuration.
     */
    public static OptimizerConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static OptimizerConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged.resolve());
    }

    /**
     * Load from Config object.
     */
    public static OptimizerConfig fromConfig(Config config) {
        Config c = config.getConfig("talos");

        return new OptimizerConfig(
            c.getString("generator.kind"),
            c.getInt("generator.candidates"),
            c.getLong("generator.budget-ms"),
            c.getString("generator.checkpoint"),
            c.getLong("verification.timeout-ms"),
            c.getInt("verification.threads"),
            c.getInt("verification.trials"),
            c.getInt("trainer.population"),
            c.getInt("trainer.generations"),
            c.getInt("trainer.batch-size"),
            c.getInt("trainer.validation-size"),
            c.getDouble("trainer.mutation-rate"),
            c.getDouble("trainer.perturbation"),
            c.getDouble("trainer.min-improvement"),
            c.getLong("trainer.seed"),
            c.getInt("trainer.threads"),
            c.getInt("trainer.convergence-window"),
            Path.of(c.getString("persistence.checkpoint-file")),
            Path.of(c.getString("persistence.replay-log")),
            c.getInt("persistence.replay-queue"),
            c.getInt("compile.threads")
        );
    }

    /**
     * Limits for the speculative selector.
     */
    public SelectorSettings selectorSettings() {
        return new SelectorSettings(candidates,
                Duration.ofMillis(generationBudgetMs),
                Duration.ofMillis(verificationTimeoutMs),
                verificationThreads);
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder starting from this configuration, for command-line overrides.
     */
    public Builder toBuilder() {
        return new Builder()
                .generatorKind(generatorKind).candidates(candidates)
                .generationBudgetMs(generationBudgetMs).checkpoint(checkpoint)
                .verificationTimeoutMs(verificationTimeoutMs).verificationThreads(verificationThreads)
                .verificationTrials(verificationTrials)
                .population(population).generations(generations)
                .batchSize(batchSize).validationSize(validationSize)
                .mutationRate(mutationRate).perturbation(perturbation).minImprovement(minImprovement)
                .seed(seed).trainerThreads(trainerThreads).convergenceWindow(convergenceWindow)
                .checkpointFile(checkpointFile).replayLog(replayLog).replayQueue(replayQueue)
                .compileThreads(compileThreads);
    }

    public static class Builder {
        private String generatorKind = "schedule";
        private int candidates = 32;
        private long generationBudgetMs = 250;
        private String checkpoint = "";
        private long verificationTimeoutMs = 1000;
        private int verificationThreads = 4;
        private int verificationTrials = 4;
        private int population = 16;
        private int generations = 20;
        private int batchSize = 64;
        private int validationSize = 64;
        private double mutationRate = 0.05;
        private double perturbation = 0.05;
        private double minImprovement = 0.0;
        private long seed = 42;
        private int trainerThreads = 4;
        private int convergenceWindow = 8;
        private Path checkpointFile = Path.of("talos-checkpoints.mv");
        private Path replayLog = Path.of("talos-replay.log");
        private int replayQueue = 10_000;
        private int compileThreads = 4;

        public Builder generatorKind(String kind) { this.generatorKind = kind; return this; }
        public Builder candidates(int k) { this.candidates = k; return this; }
        public Builder generationBudgetMs(long ms) { this.generationBudgetMs = ms; return this; }
        public Builder checkpoint(String hash) { this.checkpoint = hash; return this; }
        public Builder verificationTimeoutMs(long ms) { this.verificationTimeoutMs = ms; return this; }
        public Builder verificationThreads(int threads) { this.verificationThreads = threads; return this; }
        public Builder verificationTrials(int trials) { this.verificationTrials = trials; return this; }
        public Builder population(int size) { this.population = size; return this; }
        public Builder generations(int count) { this.generations = count; return this; }
        public Builder batchSize(int size) { this.batchSize = size; return this; }
        public Builder validationSize(int size) { this.validationSize = size; return this; }
        public Builder mutationRate(double rate) { this.mutationRate = rate; return this; }
        public Builder perturbation(double magnitude) { this.perturbation = magnitude; return this; }
        public Builder minImprovement(double fraction) { this.minImprovement = fraction; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder trainerThreads(int threads) { this.trainerThreads = threads; return this; }
        public Builder convergenceWindow(int window) { this.convergenceWindow = window; return this; }
        public Builder checkpointFile(Path file) { this.checkpointFile = file; return this; }
        public Builder replayLog(Path file) { this.replayLog = file; return this; }
        public Builder replayQueue(int capacity) { this.replayQueue = capacity; return this; }
        public Builder compileThreads(int threads) { this.compileThreads = threads; return this; }

        public OptimizerConfig build() {
            return new OptimizerConfig(
                generatorKind, candidates, generationBudgetMs, checkpoint,
                verificationTimeoutMs, verificationThreads, verificationTrials,
                population, generations, batchSize, validationSize,
                mutationRate, perturbation, minImprovement, seed, trainerThreads, convergenceWindow,
                checkpointFile, replayLog, replayQueue, compileThreads
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            OptimizerConfig:
              generator.kind:           %s
              generator.candidates:     %d
              generator.budget:         %s
              generator.checkpoint:     %s
              verification.timeout:     %s
              verification.threads:     %d
              verification.trials:      %d
              trainer.population:       %d
              trainer.generations:      %d
              trainer.batch/validation: %d / %d
              trainer.mutation-rate:    %.4f (%.2f%%)
              trainer.perturbation:     %.4f
              trainer.min-improvement:  %.4f
              trainer.seed:             %d
              trainer.threads:          %d
              trainer.convergence:      %s
              persistence.checkpoints:  %s
              persistence.replay-log:   %s (queue %,d)
              compile.threads:          %d
            """,
            generatorKind,
            candidates,
            generationBudgetMs == 0 ? "unlimited" : generationBudgetMs + " ms",
            checkpoint.isBlank() ? "(active)" : checkpoint,
            verificationTimeoutMs == 0 ? "unlimited" : verificationTimeoutMs + " ms",
            verificationThreads,
            verificationTrials,
            population,
            generations,
            batchSize, validationSize,
            mutationRate, mutationRate * 100,
            perturbation,
            minImprovement,
            seed,
            trainerThreads,
            convergenceWindow == 0 ? "never" : convergenceWindow + " generations",
            checkpointFile,
            replayLog, replayQueue,
            compileThreads
        );
    }
}
