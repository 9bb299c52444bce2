package io.github.manjago.talos.pipeline;

import io.github.manjago.talos.config.OptimizerConfig;
import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.cost.CostOracle;
import io.github.manjago.talos.cost.TritonCostModel;
import io.github.manjago.talos.encode.EncodingException;
import io.github.manjago.talos.generator.GeneratorRegistry;
import io.github.manjago.talos.ir.BasicBlock;
import io.github.manjago.talos.ir.MachineState;
import io.github.manjago.talos.lowering.BaselineLowering;
import io.github.manjago.talos.lowering.NaiveLowering;
import io.github.manjago.talos.persistence.CheckpointNotFoundException;
import io.github.manjago.talos.persistence.CheckpointStore;
import io.github.manjago.talos.replay.ReplayLog;
import io.github.manjago.talos.select.ActiveGenerator;
import io.github.manjago.talos.select.Selection;
import io.github.manjago.talos.select.SpeculativeSelector;
import io.github.manjago.talos.train.PopulationTrainer;
import io.github.manjago.talos.verify.CachingVerifier;
import io.github.manjago.talos.verify.DifferentialVerifier;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Wires the optimizer from configuration: checkpoint store, active generator, selector,
 * replay log and trainer.
 * <p>
 * Opening fails loudly when a configured or recorded checkpoint is missing; everything
 * after that degrades to the baseline instead of failing.
 */
public class Optimizer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Optimizer.class);

    private final OptimizerConfig config;
    private final GeneratorRegistry registry;
    private final CheckpointStore store;
    private final ActiveGenerator active;
    private final CachingVerifier verifier;
    private final CostOracle oracle;
    private final BaselineLowering lowering;
    private final SpeculativeSelector selector;
    private final ReplayLog replayLog;

    private Optimizer(OptimizerConfig config, GeneratorRegistry registry, CheckpointStore store,
                      ActiveGenerator active, ReplayLog replayLog) {
        this.config = config;
        this.registry = registry;
        this.store = store;
        this.active = active;
        this.replayLog = replayLog;
        this.verifier = new CachingVerifier(new DifferentialVerifier(config.verificationTrials()));
        this.oracle = new CostOracle(new TritonCostModel());
        this.lowering = new NaiveLowering();
        this.selector = new SpeculativeSelector(active, verifier, oracle, config.selectorSettings());
    }

    /**
     * Open the store, load the active generator and open the replay log.
     *
     * @param withReplayLog false to compile without recording outcomes
     * @throws CheckpointNotFoundException if the configured or recorded checkpoint is missing
     */
    public static Optimizer open(@NotNull OptimizerConfig config, boolean withReplayLog)
            throws IOException, CheckpointNotFoundException {
        GeneratorRegistry registry = GeneratorRegistry.standard();
        CheckpointStore store = CheckpointStore.open(config.checkpointFile());
        try {
            ActiveGenerator active = new ActiveGenerator(
                    store.loadActiveSnapshot(registry, config.checkpoint(), config.generatorKind()));
            ReplayLog replayLog = withReplayLog ? ReplayLog.open(config.replayLog(), config.replayQueue()) : null;
            log.info("Optimizer ready with generator {}", active.get().parameters());
            return new Optimizer(config, registry, store, active, replayLog);
        } catch (IOException | CheckpointNotFoundException | RuntimeException e) {
            store.close();
            throw e;
        }
    }

    /**
     * Optimize one block that was already lowered.
     */
    public Selection optimize(@NotNull BasicBlock block, @NotNull List<Instruction> baseline,
                              @NotNull MachineState entry) throws EncodingException {
        Selection selection = selector.optimize(block, baseline, entry);
        if (replayLog != null) {
            replayLog.append(selection.outcome());
        }
        return selection;
    }

    /**
     * New session over this optimizer's selector; close it when done.
     */
    public CompilationSession newSession() {
        return new CompilationSession(selector, lowering, replayLog, config.compileThreads());
    }

    public PopulationTrainer newTrainer() {
        return new PopulationTrainer(registry, store, active, verifier, oracle, config);
    }

    public OptimizerConfig getConfig() {
        return config;
    }

    public ActiveGenerator getActive() {
        return active;
    }

    public CheckpointStore getStore() {
        return store;
    }

    public CostOracle getOracle() {
        return oracle;
    }

    public BaselineLowering getLowering() {
        return lowering;
    }

    @Override
    public void close() {
        selector.close();
        if (replayLog != null) {
            replayLog.close();
        }
        store.close();
    }
}
