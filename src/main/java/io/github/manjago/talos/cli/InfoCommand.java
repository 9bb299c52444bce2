package io.github.manjago.talos.cli;

import io.github.manjago.talos.config.OptimizerConfig;
import io.github.manjago.talos.cost.TritonCostModel;
import io.github.manjago.talos.encode.FeatureTensor;
import io.github.manjago.talos.generator.GeneratorFactory;
import io.github.manjago.talos.generator.GeneratorRegistry;
import io.github.manjago.talos.generator.InstructionVocabulary;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about Talos.
 */
@Command(
    name = "info",
    description = "Show version and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║               TALOS                   ║");
        System.out.println("║   Speculative Stack-VM Code Generator ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(OptimizerConfig.defaults());

        System.out.println("Generators:");
        GeneratorRegistry registry = GeneratorRegistry.standard();
        for (String kind : registry.kinds()) {
            GeneratorFactory factory = registry.factory(kind);
            System.out.printf("  %-9s %,7d weights%n", kind, factory.parameterCount());
        }
        System.out.printf("  Feature tensor: %d values, vocabulary: %d tokens%n",
                FeatureTensor.LENGTH, InstructionVocabulary.size());
        System.out.println();

        System.out.println("Cost tables: " + String.join(", ", new TritonCostModel().tableNames()));
        return 0;
    }
}
