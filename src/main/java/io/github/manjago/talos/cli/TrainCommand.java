package io.github.manjago.talos.cli;

import io.github.manjago.talos.config.OptimizerConfig;
import io.github.manjago.talos.persistence.CheckpointNotFoundException;
import io.github.manjago.talos.pipeline.Optimizer;
import io.github.manjago.talos.replay.ReplayLog;
import io.github.manjago.talos.select.OutcomeRecord;
import io.github.manjago.talos.train.PopulationTrainer;
import io.github.manjago.talos.train.TrainingResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Train command: one population training session over the replay log.
 *
 * Examples:
 *   talos train                       # Defaults from reference.conf
 *   talos train -g 50 -p 32 --seed 7  # Longer session, other seed
 *   talos train --recent 500          # Only the newest 500 outcomes
 */
@Command(
    name = "train",
    description = "Improve the active generator from recorded outcomes",
    mixinStandardHelpOptions = true
)
public class TrainCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions configOptions;

    @Option(names = {"-g", "--generations"}, description = "Generations per session")
    private Integer generations;

    @Option(names = {"-p", "--population"}, description = "Population size")
    private Integer population;

    @Option(names = {"-s", "--seed"}, description = "Random seed")
    private Long seed;

    @Option(names = {"--min-improvement"}, description = "Relative promotion margin (0.0-1.0)")
    private Double minImprovement;

    @Option(names = {"--recent"}, description = "Use only the newest N outcome records")
    private Integer recent;

    @Override
    public Integer call() {
        OptimizerConfig config = buildConfig();

        List<OutcomeRecord> records;
        try {
            records = recent != null
                    ? ReplayLog.readRecent(config.replayLog(), recent)
                    : ReplayLog.read(config.replayLog());
        } catch (IOException e) {
            System.err.println("❌ Cannot read replay log: " + e.getMessage());
            return 2;
        }
        System.out.printf("Outcome records: %,d from %s%n", records.size(), config.replayLog());

        try (Optimizer optimizer = Optimizer.open(config, false)) {
            PopulationTrainer trainer = optimizer.newTrainer();

            Thread main = Thread.currentThread();
            Thread hook = new Thread(() -> {
                trainer.cancel();
                main.interrupt();
            });
            Runtime.getRuntime().addShutdownHook(hook);

            TrainingResult result = trainer.train(records);
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                System.out.println("⏸️  Shutting down, session " + result.outcome());
            }

            System.out.println(result);
            return result.outcome() == TrainingResult.Outcome.INSUFFICIENT_DATA ? 1 : 0;
        } catch (CheckpointNotFoundException e) {
            System.err.println("❌ " + e.getMessage());
            return 2;
        } catch (IOException e) {
            System.err.println("❌ " + e.getMessage());
            return 2;
        }
    }

    private OptimizerConfig buildConfig() {
        OptimizerConfig.Builder builder = configOptions.builder();

        // Override from CLI options
        if (generations != null) builder.generations(generations);
        if (population != null) builder.population(population);
        if (seed != null) builder.seed(seed);
        if (minImprovement != null) builder.minImprovement(minImprovement);

        return builder.build();
    }
}
