package io.github.manjago.talos.generator;

import io.github.manjago.talos.core.Disassembler;
import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.encode.BlockEncoder;
import io.github.manjago.talos.encode.EncodingException;
import io.github.manjago.talos.encode.FeatureTensor;
import io.github.manjago.talos.field.Fixed;
import io.github.manjago.talos.ir.BasicBlock;
import io.github.manjago.talos.lowering.LoweringException;
import io.github.manjago.talos.lowering.StackScheduler;
import io.github.manjago.talos.lowering.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Constraint-guided enumeration over scheduling strategies.
 * <p>
 * Each non-empty subset of {@link Strategy} is scored as {@code bias + sum of its
 * strategy weights}. Subsets scoring above zero are lowered in descending score order
 * (ties by subset bit mask) and distinct results are proposed. With all-zero weights
 * the generator declines; the factory defaults enable every strategy.
 */
public final class ScheduleSearchGenerator implements CandidateGenerator {

    private static final Logger log = LoggerFactory.getLogger(ScheduleSearchGenerator.class);

    public static final String KIND = "schedule";

    private static final Strategy[] STRATEGIES = Strategy.values();

    /** One weight per strategy plus a bias. */
    public static final int PARAMETER_COUNT = STRATEGIES.length + 1;

    private final Fixed[] weights;
    private final Fixed bias;
    private final BlockEncoder encoder = new BlockEncoder();
    private final StackScheduler scheduler = new StackScheduler();

    private record Combination(int mask, Fixed score) {}

    public ScheduleSearchGenerator(GeneratorParameters parameters) {
        this.weights = new Fixed[STRATEGIES.length];
        for (int i = 0; i < STRATEGIES.length; i++) {
            weights[i] = parameters.weight(i);
        }
        this.bias = parameters.weight(STRATEGIES.length);
    }

    @Override
    public List<Candidate> propose(FeatureTensor tensor, int k) {
        List<Combination> ranked = rank();
        if (ranked.isEmpty() || k <= 0) {
            return List.of();
        }

        BasicBlock block;
        try {
            block = encoder.decode(tensor).block();
        } catch (EncodingException e) {
            throw new GenerationException("Cannot decode tensor of " + tensor.blockId(), e);
        }

        Map<String, Candidate> distinct = new LinkedHashMap<>();
        for (Combination combination : ranked) {
            if (distinct.size() >= k) {
                break;
            }
            List<Instruction> code;
            try {
                code = scheduler.lower(block, strategies(combination.mask()));
            } catch (LoweringException e) {
                log.trace("Strategy set {} does not fit: {}", strategies(combination.mask()), e.getMessage());
                continue;
            }
            List<String> source = Disassembler.toLines(code);
            distinct.putIfAbsent(String.join("\n", source),
                    new Candidate(tensor.blockId(), source, combination.score()));
        }
        return List.copyOf(distinct.values());
    }

    /**
     * Positively scored strategy subsets, best first.
     */
    List<Combination> rank() {
        List<Combination> ranked = new ArrayList<>();
        for (int mask = 1; mask < (1 << STRATEGIES.length); mask++) {
            Fixed score = bias;
            for (int s = 0; s < STRATEGIES.length; s++) {
                if ((mask & (1 << s)) != 0) {
                    score = score.add(weights[s]);
                }
            }
            if (!score.isNegative() && !score.isZero()) {
                ranked.add(new Combination(mask, score));
            }
        }
        ranked.sort(Comparator.comparing(Combination::score).reversed()
                .thenComparingInt(Combination::mask));
        return ranked;
    }

    static Set<Strategy> strategies(int mask) {
        Set<Strategy> set = EnumSet.noneOf(Strategy.class);
        for (int s = 0; s < STRATEGIES.length; s++) {
            if ((mask & (1 << s)) != 0) {
                set.add(STRATEGIES[s]);
            }
        }
        return set;
    }

    /**
     * Factory for {@value #KIND} generators.
     */
    public static final class Factory implements GeneratorFactory {

        @Override
        public String kind() {
            return KIND;
        }

        @Override
        public int parameterCount() {
            return PARAMETER_COUNT;
        }

        @Override
        public CandidateGenerator create(GeneratorParameters parameters) {
            checkCompatible(parameters);
            return new ScheduleSearchGenerator(parameters);
        }

        /**
         * Every strategy weighted one, no bias: all combinations are tried, the full set first.
         */
        @Override
        public GeneratorParameters defaults() {
            long[] weights = new long[PARAMETER_COUNT];
            for (int s = 0; s < STRATEGIES.length; s++) {
                weights[s] = Fixed.ONE.raw();
            }
            return new GeneratorParameters(KIND, weights);
        }
    }
}
