package io.github.manjago.talos.cli;

import io.github.manjago.talos.config.OptimizerConfig;
import io.github.manjago.talos.core.Disassembler;
import io.github.manjago.talos.ir.BlockReader;
import io.github.manjago.talos.persistence.CheckpointNotFoundException;
import io.github.manjago.talos.pipeline.BlockResult;
import io.github.manjago.talos.pipeline.CompilationSession;
import io.github.manjago.talos.pipeline.Optimizer;
import io.github.manjago.talos.select.Selection;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Optimize blocks command.
 *
 * Examples:
 *   talos optimize blocks.ir                    # Optimize with the active generator
 *   talos optimize blocks.ir -o out.tasm        # Write the chosen code
 *   talos optimize blocks.ir -k 8 --no-replay   # Fewer candidates, do not record outcomes
 */
@Command(
    name = "optimize",
    description = "Lower blocks and replace each baseline by a cheaper verified candidate",
    mixinStandardHelpOptions = true
)
public class OptimizeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Block file")
    private Path blocksFile;

    @Mixin
    private ConfigOptions configOptions;

    @Option(names = {"-k", "--candidates"}, description = "Candidates requested per block")
    private Integer candidates;

    @Option(names = {"--checkpoint"}, description = "Generator checkpoint hash (or unique prefix)")
    private String checkpoint;

    @Option(names = {"-t", "--threads"}, description = "Compilation worker threads")
    private Integer threads;

    @Option(names = {"-o", "--output"}, description = "Output file for the chosen code")
    private Path outputFile;

    @Option(names = {"--no-replay"}, description = "Do not append outcomes to the replay log")
    private boolean noReplay;

    @Option(names = {"-l", "--listing"}, description = "Print the chosen code of every block")
    private boolean listing;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (minimal output)")
    private boolean quiet;

    @Override
    public Integer call() {
        OptimizerConfig config = buildConfig();

        List<BlockReader.ParsedBlock> blocks;
        try {
            blocks = new BlockReader().readFile(blocksFile);
        } catch (BlockReader.BlockFormatException e) {
            System.err.println("❌ " + e.getMessage());
            return 2;
        }

        try (Optimizer optimizer = Optimizer.open(config, !noReplay);
             CompilationSession session = optimizer.newSession()) {

            if (!quiet) {
                System.out.printf("Generator: %s%n", optimizer.getActive().get().parameters());
                System.out.printf("Blocks:    %d from %s%n%n", blocks.size(), blocksFile);
            }

            List<BlockResult> results = session.compile(blocks);

            if (!quiet) {
                printResults(results);
                System.out.println(session.getStats());
            }
            if (outputFile != null) {
                writeOutput(results);
            }
            return results.stream().anyMatch(BlockResult::isFailed) ? 1 : 0;
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
        if (candidates != null) builder.candidates(candidates);
        if (checkpoint != null) builder.checkpoint(checkpoint);
        if (threads != null) builder.compileThreads(threads);

        return builder.build();
    }

    private void printResults(List<BlockResult> results) {
        System.out.printf("%-20s %-9s %-17s %8s %8s%n", "BLOCK", "STATE", "REASON", "BASELINE", "CHOSEN");
        for (BlockResult result : results) {
            Selection selection = result.selection();
            if (selection == null) {
                System.out.printf("%-20s %-9s %s%n", result.block().name(), "FAILED", result.error());
                continue;
            }
            System.out.printf("%-20s %-9s %-17s %8d %8d%n",
                    result.block().name(), selection.state(), selection.reason(),
                    selection.outcome().baselineCost(), selection.outcome().chosenCost());
            if (listing) {
                System.out.println(Disassembler.listing(selection.instructions()));
            }
        }
        System.out.println();
    }

    private void writeOutput(List<BlockResult> results) throws IOException {
        List<String> lines = new ArrayList<>();
        for (BlockResult result : results) {
            lines.add("// block " + result.block().name());
            if (result.isFailed()) {
                lines.add("// failed: " + result.error());
            } else {
                lines.addAll(Disassembler.toLines(result.instructions()));
            }
            lines.add("");
        }
        Files.write(outputFile, lines);
        if (!quiet) {
            System.out.println("💾 Code written to " + outputFile);
        }
    }
}
