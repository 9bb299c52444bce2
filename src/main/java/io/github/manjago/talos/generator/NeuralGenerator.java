package io.github.manjago.talos.generator;

import io.github.manjago.talos.encode.FeatureTensor;
import io.github.manjago.talos.field.Fixed;
import io.github.manjago.talos.field.Goldilocks;
import io.github.manjago.talos.field.RawAccumulator;
import io.github.manjago.talos.ir.IrOp;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small fixed-point network with an autoregressive decoder and beam search.
 *
 * <h2>Architecture</h2>
 * <pre>
 * latent  = relu(W2 . relu(W1 . x + b1) + b2)              x: the feature tensor
 * step t  = relu(Wd . [latent; onehot(token[t-1])] + bd)
 * logits  = Wo . step + bo                                 one score per vocabulary token
 * </pre>
 * Every activation is clamped to {@link Fixed#ACTIVATION_BOUND} and quantized to the
 * product grid, and weights are quantized and clamped to {@link Fixed#WEIGHT_BOUND}, so
 * all arithmetic is exact and the fan-in checks keep accumulation below the field
 * half-point.
 * <p>
 * Beam search keeps {@code min(k, MAX_BEAM)} partial sequences, scores them by summed
 * logits and stops after {@link #MAX_OUTPUT} tokens. The result is deterministic: ties
 * are broken by beam order then token id. An all-zero input projection declines.
 */
public final class NeuralGenerator implements CandidateGenerator {

    public static final String KIND = "neural";

    public static final int INPUT = FeatureTensor.LENGTH;
    public static final int HIDDEN = 16;
    public static final int DECODER = 24;
    public static final int VOCAB = InstructionVocabulary.size();
    public static final int MAX_OUTPUT = 24;
    public static final int MAX_BEAM = 8;

    public static final int PARAMETER_COUNT =
            HIDDEN * INPUT + HIDDEN
            + HIDDEN * HIDDEN + HIDDEN
            + DECODER * (HIDDEN + VOCAB) + DECODER
            + VOCAB * DECODER + VOCAB;

    private final Fixed[][] w1;
    private final Fixed[] b1;
    private final Fixed[][] w2;
    private final Fixed[] b2;
    private final Fixed[][] wd;
    private final Fixed[] bd;
    private final Fixed[][] wo;
    private final Fixed[] bo;
    private final boolean inputProjectionZero;

    static {
        RawAccumulator.checkFanIn(INPUT);
        RawAccumulator.checkFanIn(HIDDEN + VOCAB);
        RawAccumulator.checkFanIn(DECODER);
    }

    public NeuralGenerator(GeneratorParameters parameters) {
        Reader reader = new Reader(parameters);
        this.w1 = reader.matrix(HIDDEN, INPUT);
        this.b1 = reader.vector(HIDDEN);
        this.w2 = reader.matrix(HIDDEN, HIDDEN);
        this.b2 = reader.vector(HIDDEN);
        this.wd = reader.matrix(DECODER, HIDDEN + VOCAB);
        this.bd = reader.vector(DECODER);
        this.wo = reader.matrix(VOCAB, DECODER);
        this.bo = reader.vector(VOCAB);

        boolean zero = true;
        for (Fixed[] row : w1) {
            for (Fixed w : row) {
                zero &= w.isZero();
            }
        }
        this.inputProjectionZero = zero;
    }

    private record Beam(List<Integer> tokens, Fixed score) {

        int last() {
            return tokens.isEmpty() ? InstructionVocabulary.END : tokens.get(tokens.size() - 1);
        }
    }

    @Override
    public List<Candidate> propose(FeatureTensor tensor, int k) {
        if (inputProjectionZero || k <= 0) {
            return List.of();
        }

        Fixed[] x = tensor.toArray();
        for (int i = 0; i < x.length; i++) {
            x[i] = activation(x[i]);
        }
        Fixed[] latent = layer(w2, b2, layer(w1, b1, x));
        Fixed[] latentPart = new Fixed[DECODER];
        for (int j = 0; j < DECODER; j++) {
            RawAccumulator acc = new RawAccumulator();
            for (int h = 0; h < HIDDEN; h++) {
                acc.addProduct(wd[j][h], latent[h]);
            }
            latentPart[j] = acc.addBias(bd[j]).finish();
        }

        int width = Math.min(k, MAX_BEAM);
        List<Beam> open = List.of(new Beam(List.of(), Fixed.ZERO));
        List<Beam> finished = new ArrayList<>();

        for (int step = 0; step < MAX_OUTPUT && !open.isEmpty(); step++) {
            List<Beam> expanded = new ArrayList<>();
            for (Beam beam : open) {
                Fixed[] logits = logits(latentPart, beam.last());
                for (int token = 0; token < VOCAB; token++) {
                    List<Integer> tokens = new ArrayList<>(beam.tokens());
                    tokens.add(token);
                    expanded.add(new Beam(tokens, beam.score().add(logits[token])));
                }
            }
            expanded.sort(Comparator.comparing(Beam::score).reversed());

            List<Beam> next = new ArrayList<>();
            for (Beam beam : expanded.subList(0, Math.min(width, expanded.size()))) {
                if (beam.last() == InstructionVocabulary.END) {
                    finished.add(beam);
                } else {
                    next.add(beam);
                }
            }
            open = next;
        }
        finished.addAll(open);
        finished.sort(Comparator.comparing(Beam::score).reversed());

        List<String> constants = constants(tensor);
        Map<String, Candidate> distinct = new LinkedHashMap<>();
        for (Beam beam : finished) {
            if (distinct.size() >= k) {
                break;
            }
            List<String> source = new ArrayList<>();
            for (int token : beam.tokens()) {
                if (token != InstructionVocabulary.END) {
                    source.add(InstructionVocabulary.render(token, constants));
                }
            }
            if (!source.isEmpty()) {
                distinct.putIfAbsent(String.join("\n", source),
                        new Candidate(tensor.blockId(), source, beam.score()));
            }
        }
        return List.copyOf(distinct.values());
    }

    private Fixed[] logits(Fixed[] latentPart, int previous) {
        Fixed[] step = new Fixed[DECODER];
        for (int j = 0; j < DECODER; j++) {
            step[j] = activation(latentPart[j].add(wd[j][HIDDEN + previous]).relu());
        }
        Fixed[] logits = new Fixed[VOCAB];
        for (int v = 0; v < VOCAB; v++) {
            RawAccumulator acc = new RawAccumulator();
            for (int j = 0; j < DECODER; j++) {
                acc.addProduct(wo[v][j], step[j]);
            }
            logits[v] = activation(acc.addBias(bo[v]).finish());
        }
        return logits;
    }

    private static Fixed[] layer(Fixed[][] weights, Fixed[] bias, Fixed[] input) {
        Fixed[] out = new Fixed[weights.length];
        for (int j = 0; j < weights.length; j++) {
            RawAccumulator acc = new RawAccumulator();
            Fixed[] row = weights[j];
            for (int i = 0; i < input.length; i++) {
                if (!input[i].isZero()) {
                    acc.addProduct(row[i], input[i]);
                }
            }
            out[j] = activation(acc.addBias(bias[j]).finish().relu());
        }
        return out;
    }

    private static Fixed activation(Fixed value) {
        return value.clamp(Fixed.ACTIVATION_BOUND).quantize();
    }

    /**
     * Distinct constants of the block in node order, as assembly literals.
     */
    static List<String> constants(FeatureTensor tensor) {
        List<String> constants = new ArrayList<>();
        for (int node = 0; node < tensor.nodeCount(); node++) {
            if (tensor.hasOp(node, IrOp.CONST)) {
                String literal = Goldilocks.toString(tensor.immediate(node));
                if (!constants.contains(literal)) {
                    constants.add(literal);
                }
            }
        }
        return constants;
    }

    /**
     * Sequential view over the flat weight vector.
     */
    private static final class Reader {
        private final GeneratorParameters parameters;
        private int next;

        Reader(GeneratorParameters parameters) {
            this.parameters = parameters;
        }

        Fixed[][] matrix(int rows, int cols) {
            Fixed[][] m = new Fixed[rows][];
            for (int r = 0; r < rows; r++) {
                m[r] = vector(cols);
            }
            return m;
        }

        Fixed[] vector(int n) {
            Fixed[] v = new Fixed[n];
            for (int i = 0; i < n; i++) {
                v[i] = parameters.weight(next++).quantize().clamp(Fixed.WEIGHT_BOUND);
            }
            return v;
        }
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
            return new NeuralGenerator(parameters);
        }
    }
}
