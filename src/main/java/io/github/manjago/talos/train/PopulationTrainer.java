package io.github.manjago.talos.train;

import io.github.manjago.talos.config.OptimizerConfig;
import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.core.SeededRng;
import io.github.manjago.talos.cost.CostOracle;
import io.github.manjago.talos.encode.BlockEncoder;
import io.github.manjago.talos.encode.EncodingException;
import io.github.manjago.talos.field.Fixed;
import io.github.manjago.talos.field.Goldilocks;
import io.github.manjago.talos.generator.GeneratorParameters;
import io.github.manjago.talos.generator.GeneratorRegistry;
import io.github.manjago.talos.generator.GeneratorSnapshot;
import io.github.manjago.talos.ir.BasicBlock;
import io.github.manjago.talos.ir.MachineState;
import io.github.manjago.talos.persistence.CheckpointNotFoundException;
import io.github.manjago.talos.persistence.CheckpointStore;
import io.github.manjago.talos.select.ActiveGenerator;
import io.github.manjago.talos.select.OutcomeRecord;
import io.github.manjago.talos.select.SelectorSettings;
import io.github.manjago.talos.select.SpeculativeSelector;
import io.github.manjago.talos.verify.CachingVerifier;
import io.github.manjago.talos.verify.EquivalenceVerifier;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Gradient-free improvement of the active generator's parameters.
 *
 * <h2>Session</h2>
 * <ol>
 *   <li>Shuffle the outcome records with the session seed and split them into a
 *       validation batch and a training batch.</li>
 *   <li>Seed the population with the active parameters and perturbed copies of them.</li>
 *   <li>Per generation: score every member by replaying the training batch through a
 *       selector bound to it (fitness is the negative total chosen cost, so only
 *       verified improvements count), keep the best quarter and refill the rest with
 *       uniform crossover of two survivors plus per-weight perturbation.</li>
 *   <li>Score the best member and the active parameters on the validation batch and
 *       promote only when the best wins by the configured margin.</li>
 * </ol>
 * All randomness comes from one {@link SeededRng}, so a session is reproducible.
 * Verification runs through a {@link CachingVerifier} shared by all members.
 * A cancelled session discards its population and never promotes.
 */
public class PopulationTrainer {

    private static final Logger log = LoggerFactory.getLogger(PopulationTrainer.class);

    /** Perturbations move weights in whole steps of the product grid. */
    private static final long GRID_STEP = 1L << (Fixed.SCALE_BITS - Fixed.GRID_BITS);

    /** Adaptive mutation never exceeds this probability. */
    private static final double MAX_MUTATION_RATE = 0.5;

    private final GeneratorRegistry registry;
    private final CheckpointStore store;
    private final ActiveGenerator active;
    private final CachingVerifier verifier;
    private final CostOracle oracle;
    private final OptimizerConfig config;
    private final BlockEncoder encoder = new BlockEncoder();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private record Sample(BasicBlock block, MachineState entry, List<Instruction> baseline) {}

    public PopulationTrainer(@NotNull GeneratorRegistry registry,
                             @NotNull CheckpointStore store,
                             @NotNull ActiveGenerator active,
                             @NotNull EquivalenceVerifier verifier,
                             @NotNull CostOracle oracle,
                             @NotNull OptimizerConfig config) {
        this.registry = registry;
        this.store = store;
        this.active = active;
        this.verifier = verifier instanceof CachingVerifier caching ? caching : new CachingVerifier(verifier);
        this.oracle = oracle;
        this.config = config;
    }

    /**
     * Run a session in the background.
     */
    public CompletableFuture<TrainingResult> trainAsync(@NotNull List<OutcomeRecord> records, @NotNull Executor executor) {
        return CompletableFuture.supplyAsync(() -> train(records), executor);
    }

    /**
     * Stop the running session at the next member evaluation. A request made while
     * no session runs cancels the next one.
     */
    public void cancel() {
        log.info("Training cancellation requested");
        cancelled.set(true);
    }

    /**
     * Run one session over {@code records}. The session consumes any pending
     * cancellation request.
     */
    public TrainingResult train(@NotNull List<OutcomeRecord> records) {
        try {
            checkCancelled();
            return session(records);
        } catch (CancellationException e) {
            log.info("Training cancelled, population discarded");
            return new TrainingResult(TrainingResult.Outcome.CANCELLED, active.version(), null, 0, 0, 0);
        } finally {
            cancelled.set(false);
        }
    }

    private TrainingResult session(List<OutcomeRecord> records) {
        SeededRng rng = new SeededRng(config.seed());
        GeneratorSnapshot incumbent = active.get();
        String activeHash = incumbent.version();

        List<Sample> samples = decode(records);
        shuffle(samples, rng);
        int validationSize = Math.min(config.validationSize(), samples.size() / 2);
        int batchSize = Math.min(config.batchSize(), samples.size() - validationSize);
        if (validationSize == 0 || batchSize == 0) {
            log.warn("Not enough usable outcome records to train: {}", samples.size());
            return new TrainingResult(TrainingResult.Outcome.INSUFFICIENT_DATA, activeHash, null, 0, 0, 0);
        }
        List<Sample> validation = samples.subList(0, validationSize);
        List<Sample> batch = samples.subList(validationSize, validationSize + batchSize);

        log.info("Training {} (population {}, {} generations, batch {}, validation {}, seed {})",
                incumbent.parameters(), config.population(), config.generations(),
                batch.size(), validation.size(), config.seed());

        ExecutorService workers = Executors.newFixedThreadPool(Math.max(1, config.trainerThreads()));
        SelectorSettings settings = new SelectorSettings(config.candidates(), Duration.ZERO,
                Duration.ofMillis(config.verificationTimeoutMs()), Math.max(1, config.verificationThreads()));
        try (SpeculativeSelector selector = new SpeculativeSelector(active, verifier, oracle, settings)) {
            Population population = initialPopulation(incumbent.parameters(), rng);
            ConvergenceTracker tracker = new ConvergenceTracker(config.convergenceWindow());
            double mutationRate = config.mutationRate();
            int generation = 0;

            while (generation < config.generations()) {
                population = evaluate(population, batch, selector, workers);
                generation++;
                Individual best = population.best();
                ConvergenceTracker.Status status = tracker.record(best.fitness());
                log.info("Generation {}: best cost {}, {} ({} verifier cache hits)",
                        generation, -best.fitness(), status, verifier.getHits());

                if (status == ConvergenceTracker.Status.CONVERGED) {
                    log.info("Converged after {} generations without improvement", tracker.getStaleGenerations());
                    break;
                }
                mutationRate = status == ConvergenceTracker.Status.PLATEAUED
                        ? Math.min(MAX_MUTATION_RATE, mutationRate * 2)
                        : config.mutationRate();
                if (generation < config.generations()) {
                    population = breed(population, mutationRate, rng);
                }
            }

            GeneratorParameters best = population.best().parameters();
            long activeFitness = fitness(incumbent, validation, selector);
            long bestFitness = best.equals(incumbent.parameters())
                    ? activeFitness
                    : fitness(registry.snapshot(best), validation, selector);
            checkCancelled();

            long margin = Math.max(1, (long) Math.ceil(Math.abs(activeFitness) * config.minImprovement()));
            if (bestFitness - activeFitness < margin) {
                log.info("No promotion: validation cost {} vs active {} (margin {})",
                        -bestFitness, -activeFitness, margin);
                return new TrainingResult(TrainingResult.Outcome.NOT_PROMOTED, activeHash, null,
                        activeFitness, bestFitness, generation);
            }

            checkCancelled();
            String promoted = promote(best);
            log.info("Promoted {}: validation cost {} -> {}", best, -activeFitness, -bestFitness);
            return new TrainingResult(TrainingResult.Outcome.PROMOTED, promoted, promoted,
                    activeFitness, bestFitness, generation);
        } finally {
            workers.shutdownNow();
        }
    }

    // ========== Population ==========

    private Population initialPopulation(GeneratorParameters seed, SeededRng rng) {
        List<Individual> members = new ArrayList<>();
        members.add(Individual.unevaluated(seed));
        while (members.size() < Math.max(1, config.population())) {
            members.add(Individual.unevaluated(mutate(seed.rawWeights(), seed, 1.0, rng)));
        }
        return new Population(members);
    }

    private Population breed(Population population, double mutationRate, SeededRng rng) {
        List<Individual> survivors = population.survivors();
        List<Individual> next = new ArrayList<>(survivors);
        while (next.size() < population.size()) {
            long[] a = survivors.get(rng.nextInt(survivors.size())).parameters().rawWeights();
            long[] b = survivors.get(rng.nextInt(survivors.size())).parameters().rawWeights();
            long[] child = new long[a.length];
            for (int i = 0; i < child.length; i++) {
                child[i] = rng.nextBoolean() ? a[i] : b[i];
            }
            next.add(Individual.unevaluated(mutate(child, survivors.get(0).parameters(), mutationRate, rng)));
        }
        return new Population(next);
    }

    /**
     * Perturb each weight with probability {@code rate} by a whole number of grid steps.
     */
    private GeneratorParameters mutate(long[] weights, GeneratorParameters template, double rate, SeededRng rng) {
        long steps = Math.max(1, Math.round(config.perturbation() * Fixed.SCALE / GRID_STEP));
        for (int i = 0; i < weights.length; i++) {
            if (rng.nextBoolean(rate)) {
                long delta = rng.nextSymmetric(steps) * GRID_STEP;
                Fixed moved = Fixed.ofRaw(Goldilocks.add(weights[i], Goldilocks.fromSigned(delta)));
                weights[i] = moved.clamp(Fixed.WEIGHT_BOUND).raw();
            }
        }
        return template.withWeights(weights);
    }

    // ========== Evaluation ==========

    private Population evaluate(Population population, List<Sample> batch,
                                SpeculativeSelector selector, ExecutorService workers) {
        List<Callable<Individual>> tasks = new ArrayList<>();
        for (Individual member : population.members()) {
            tasks.add(() -> member.isEvaluated()
                    ? member
                    : member.withFitness(fitness(registry.snapshot(member.parameters()), batch, selector)));
        }
        List<Individual> scored = new ArrayList<>();
        try {
            for (Future<Individual> future : workers.invokeAll(tasks)) {
                scored.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while evaluating");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException cancel) {
                throw cancel;
            }
            throw new IllegalStateException("Member evaluation failed", e.getCause());
        }
        return new Population(scored);
    }

    /**
     * Negative total cost of what the selector returns for every sample.
     */
    private long fitness(GeneratorSnapshot snapshot, List<Sample> samples, SpeculativeSelector selector) {
        long total = 0;
        for (Sample sample : samples) {
            checkCancelled();
            try {
                total += selector.optimize(sample.block(), sample.baseline(), sample.entry(), snapshot)
                        .outcome().chosenCost();
            } catch (EncodingException e) {
                log.warn("Sample {} no longer encodes: {}", sample.block(), e.getMessage());
                total += oracle.cost(sample.baseline());
            }
        }
        return -total;
    }

    private void checkCancelled() {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Training cancelled");
        }
    }

    // ========== Data ==========

    private List<Sample> decode(List<OutcomeRecord> records) {
        List<Sample> samples = new ArrayList<>();
        for (OutcomeRecord record : records) {
            try {
                BlockEncoder.Decoded decoded = encoder.decode(record.features());
                samples.add(new Sample(decoded.block(), decoded.entry(), record.baseline()));
            } catch (EncodingException e) {
                log.warn("Skipping outcome record {}: {}", record.blockId(), e.getMessage());
            }
        }
        return samples;
    }

    private static void shuffle(List<Sample> samples, SeededRng rng) {
        for (int i = samples.size() - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            Sample tmp = samples.get(i);
            samples.set(i, samples.get(j));
            samples.set(j, tmp);
        }
    }

    private String promote(GeneratorParameters best) {
        String hash = store.save(best);
        try {
            store.setActive(hash);
        } catch (CheckpointNotFoundException e) {
            throw new IllegalStateException("Checkpoint vanished right after saving: " + hash, e);
        }
        active.swap(registry.snapshot(best));
        return hash;
    }
}
