package io.github.manjago.talos.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Talos CLI - cliff-cost-aware speculative code generation.
 *
 * Usage:
 *   talos optimize blocks.ir            - Lower and optimize blocks
 *   talos train                         - Train the generator on the replay log
 *   talos checkpoint list|info|activate|init|rollback
 *   talos replay [file]                 - Summarize the replay log
 *   talos info                          - Show version and config
 */
@Command(
    name = "talos",
    description = "Self-optimizing speculative code generator for a stack VM",
    mixinStandardHelpOptions = true,
    version = "Talos 1.0.0",
    subcommands = {
        OptimizeCommand.class,
        TrainCommand.class,
        CheckpointCommand.class,
        ReplayCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class TalosCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TalosCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
