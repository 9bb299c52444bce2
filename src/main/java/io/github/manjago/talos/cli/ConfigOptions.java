package io.github.manjago.talos.cli;

import io.github.manjago.talos.config.OptimizerConfig;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by commands that touch the checkpoint store or replay log.
 */
public class ConfigOptions {

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"--store"}, description = "Checkpoint store file (.mv)")
    private Path storeFile;

    @Option(names = {"--replay-log"}, description = "Replay log file")
    private Path replayLog;

    /**
     * Configuration file or defaults, with the shared overrides applied.
     */
    public OptimizerConfig.Builder builder() {
        OptimizerConfig base = configFile != null
                ? OptimizerConfig.fromFile(configFile)
                : OptimizerConfig.defaults();
        OptimizerConfig.Builder builder = base.toBuilder();
        if (storeFile != null) builder.checkpointFile(storeFile);
        if (replayLog != null) builder.replayLog(replayLog);
        return builder;
    }
}
