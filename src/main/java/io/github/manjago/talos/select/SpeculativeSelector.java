package io.github.manjago.talos.select;

import io.github.manjago.talos.core.Assembler;
import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.cost.CostOracle;
import io.github.manjago.talos.cost.CostProfile;
import io.github.manjago.talos.encode.BlockEncoder;
import io.github.manjago.talos.encode.EncodingException;
import io.github.manjago.talos.encode.FeatureTensor;
import io.github.manjago.talos.generator.Candidate;
import io.github.manjago.talos.generator.GeneratorSnapshot;
import io.github.manjago.talos.ir.BasicBlock;
import io.github.manjago.talos.ir.MachineState;
import io.github.manjago.talos.verify.EquivalenceVerifier;
import io.github.manjago.talos.verify.Verdict;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Compile-time post-pass that swaps a block's baseline for a cheaper verified candidate.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Cost the baseline.</li>
 *   <li>Encode the block and ask the generator for up to {@code k} candidates.</li>
 *   <li>Skip candidates for another block, ill-formed ones and those using control flow;
 *       discard those costing at least as much as the baseline.</li>
 *   <li>Verify the rest cheapest first (ties: higher score, then proposal order) and
 *       stop at the first verified one.</li>
 *   <li>Return it, or the untouched baseline.</li>
 * </ol>
 * Generator failures and timeouts count as zero candidates, verifier failures and
 * timeouts as "not verified". Only encoding errors reach the caller.
 * <p>
 * Thread-safe: one selector serves all compilation workers. Each call reads the active
 * generator once.
 */
public final class SpeculativeSelector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SpeculativeSelector.class);

    private static final AtomicInteger POOL_IDS = new AtomicInteger();

    private final Supplier<GeneratorSnapshot> generators;
    private final EquivalenceVerifier verifier;
    private final CostOracle oracle;
    private final SelectorSettings settings;
    private final BlockEncoder encoder = new BlockEncoder();
    private final Assembler assembler = new Assembler();
    private final ExecutorService pool;

    private record Ranked(Candidate candidate, List<Instruction> code, CostProfile profile, long cost, int order) {}

    public SpeculativeSelector(@NotNull Supplier<GeneratorSnapshot> generators,
                               @NotNull EquivalenceVerifier verifier,
                               @NotNull CostOracle oracle,
                               @NotNull SelectorSettings settings) {
        this.generators = generators;
        this.verifier = verifier;
        this.oracle = oracle;
        this.settings = settings;
        this.pool = settings.boundsGeneration() || settings.boundsVerification()
                ? Executors.newFixedThreadPool(settings.threads(), daemonThreads())
                : null;
    }

    /**
     * Optimize with the currently active generator.
     *
     * @throws EncodingException if the block cannot be encoded
     */
    public @NotNull Selection optimize(@NotNull BasicBlock block, @NotNull List<Instruction> baseline,
                                       @NotNull MachineState entry) throws EncodingException {
        return optimize(block, baseline, entry, generators.get());
    }

    /**
     * Optimize with an explicit generator snapshot.
     */
    public @NotNull Selection optimize(@NotNull BasicBlock block, @NotNull List<Instruction> baseline,
                                       @NotNull MachineState entry, @NotNull GeneratorSnapshot snapshot)
            throws EncodingException {
        List<SelectionState> trace = new ArrayList<>();
        trace.add(SelectionState.START);

        CostProfile baselineProfile = oracle.profile(baseline);
        long baselineCost = CostOracle.cost(baselineProfile);

        FeatureTensor tensor = encoder.encode(block, entry);
        trace.add(SelectionState.ENCODED);

        List<Candidate> proposed = generate(snapshot, tensor, block);
        trace.add(SelectionState.PROPOSED);

        int wellFormed = 0;
        List<Ranked> cheaper = new ArrayList<>();
        for (int i = 0; i < proposed.size(); i++) {
            Candidate candidate = proposed.get(i);
            List<Instruction> code = parse(candidate, tensor, block);
            if (code == null) {
                continue;
            }
            wellFormed++;
            CostProfile profile = oracle.profile(code);
            long cost = CostOracle.cost(profile);
            if (cost < baselineCost) {
                cheaper.add(new Ranked(candidate, code, profile, cost, i));
            }
        }
        cheaper.sort(Comparator.comparingLong(Ranked::cost)
                .thenComparing(r -> r.candidate().score(), Comparator.reverseOrder())
                .thenComparingInt(Ranked::order));

        for (Ranked ranked : cheaper) {
            trace.add(SelectionState.VERIFYING);
            if (verify(block, ranked)) {
                trace.add(SelectionState.SELECTED);
                DecisionReason reason = DecisionReason.classify(baselineProfile, ranked.profile());
                log.debug("{}: selected candidate {} ({} -> {}, {})",
                        block, ranked.order(), baselineCost, ranked.cost(), reason);
                OutcomeRecord outcome = new OutcomeRecord(tensor, baseline, baselineCost,
                        ranked.code(), ranked.cost(), true, snapshot.version());
                return new Selection(ranked.code(), outcome, SelectionState.SELECTED, reason, trace);
            }
        }

        DecisionReason reason;
        if (wellFormed == 0) {
            reason = DecisionReason.NO_CANDIDATE;
        } else if (cheaper.isEmpty()) {
            reason = DecisionReason.NOT_CHEAPER;
        } else {
            reason = DecisionReason.UNVERIFIED;
        }
        trace.add(SelectionState.FALLBACK);
        log.debug("{}: fallback to baseline ({}, {} proposed, {} cheaper)",
                block, reason, proposed.size(), cheaper.size());
        OutcomeRecord outcome = new OutcomeRecord(tensor, baseline, baselineCost,
                baseline, baselineCost, false, snapshot.version());
        return new Selection(baseline, outcome, SelectionState.FALLBACK, reason, trace);
    }

    private List<Candidate> generate(GeneratorSnapshot snapshot, FeatureTensor tensor, BasicBlock block) {
        Callable<List<Candidate>> task = () -> snapshot.generator().propose(tensor, settings.candidates());
        try {
            List<Candidate> candidates = settings.boundsGeneration()
                    ? bounded(task, settings.generationBudget())
                    : task.call();
            if (candidates == null) {
                log.warn("{}: generator {} returned no list, no candidates", block, snapshot.parameters());
                return List.of();
            }
            if (candidates.size() > settings.candidates()) {
                log.warn("{}: generator returned {} candidates, keeping {}",
                        block, candidates.size(), settings.candidates());
                return candidates.subList(0, settings.candidates());
            }
            return candidates;
        } catch (TimeoutException e) {
            log.warn("{}: generation exceeded {} ms, no candidates", block, settings.generationBudget().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{}: interrupted during generation", block);
        } catch (Exception e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.warn("{}: generator {} failed, no candidates", block, snapshot.parameters(), cause);
        }
        return List.of();
    }

    /**
     * Assembled candidate, or null when it has to be skipped.
     */
    private @Nullable List<Instruction> parse(@Nullable Candidate candidate, FeatureTensor tensor, BasicBlock block) {
        if (candidate == null || candidate.score() == null) {
            log.debug("{}: skipped incomplete candidate {}", block, candidate);
            return null;
        }
        if (!tensor.blockId().equals(candidate.blockId())) {
            log.warn("{}: rejected candidate generated for block {}", block, candidate.blockId());
            return null;
        }
        List<Instruction> code;
        try {
            code = assembler.assembleLines(candidate.source());
        } catch (Assembler.AssemblerException e) {
            log.debug("{}: skipped malformed candidate: {}", block, e.getMessage());
            return null;
        }
        for (Instruction instruction : code) {
            if (instruction.mnemonic().isControlFlow()) {
                log.debug("{}: skipped candidate with control flow ({})", block, instruction);
                return null;
            }
        }
        return code;
    }

    private boolean verify(BasicBlock block, Ranked ranked) {
        Callable<Verdict> task = () -> verifier.verify(block, ranked.code());
        try {
            Verdict verdict = settings.boundsVerification()
                    ? bounded(task, settings.verificationTimeout())
                    : task.call();
            log.debug("{}: candidate {} at cost {} {}", block, ranked.order(), ranked.cost(), verdict);
            return verdict == Verdict.VERIFIED;
        } catch (TimeoutException e) {
            log.debug("{}: verification of candidate {} timed out", block, ranked.order());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{}: interrupted during verification", block);
        } catch (Exception e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.warn("{}: verifier failed on candidate {}", block, ranked.order(), cause);
        }
        return false;
    }

    private <T> T bounded(Callable<T> task, Duration limit)
            throws InterruptedException, ExecutionException, TimeoutException {
        Future<T> future = pool.submit(task);
        try {
            return future.get(limit.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            future.cancel(true);
        }
    }

    private static ThreadFactory daemonThreads() {
        int poolId = POOL_IDS.incrementAndGet();
        AtomicInteger threadIds = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "talos-select-" + poolId + "-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public SelectorSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }
}
