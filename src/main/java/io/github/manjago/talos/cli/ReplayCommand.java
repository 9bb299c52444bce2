package io.github.manjago.talos.cli;

import io.github.manjago.talos.config.OptimizerConfig;
import io.github.manjago.talos.core.Disassembler;
import io.github.manjago.talos.replay.ReplayLog;
import io.github.manjago.talos.select.OutcomeRecord;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * Summarize the replay log.
 */
@Command(
    name = "replay",
    description = "Summarize recorded compilation outcomes",
    mixinStandardHelpOptions = true
)
public class ReplayCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions configOptions;

    @Option(names = {"-n", "--show"}, description = "Print the last N records in detail")
    private int show;

    @Override
    public Integer call() {
        OptimizerConfig config = configOptions.builder().build();
        List<OutcomeRecord> records;
        try {
            records = ReplayLog.read(config.replayLog());
        } catch (IOException e) {
            System.err.println("❌ Cannot read replay log: " + e.getMessage());
            return 2;
        }

        long verified = 0;
        long baseline = 0;
        long chosen = 0;
        Map<String, Integer> byVersion = new TreeMap<>();
        for (OutcomeRecord record : records) {
            if (record.verified()) verified++;
            baseline += record.baselineCost();
            chosen += record.chosenCost();
            byVersion.merge(record.generatorVersion().substring(0, Math.min(12, record.generatorVersion().length())),
                    1, Integer::sum);
        }

        System.out.println("📜 Replay log: " + config.replayLog());
        System.out.printf("   Records:   %,d%n", records.size());
        System.out.printf("   Improved:  %,d (%.1f%%)%n", verified,
                records.isEmpty() ? 0.0 : 100.0 * verified / records.size());
        System.out.printf("   Cost:      %,d baseline -> %,d chosen%n", baseline, chosen);
        System.out.println("   Generators:");
        byVersion.forEach((version, count) -> System.out.printf("     %s  %,d%n", version, count));

        List<OutcomeRecord> tail = records.subList(Math.max(0, records.size() - show), records.size());
        for (OutcomeRecord record : tail) {
            System.out.println();
            System.out.printf("%s: %d -> %d%s%n", record.blockId(), record.baselineCost(), record.chosenCost(),
                    record.verified() ? " (verified)" : "");
            System.out.println(Disassembler.listing(record.chosen()));
        }
        return 0;
    }
}
