package io.github.manjago.talos.generator;

import io.github.manjago.talos.core.Assembler;
import io.github.manjago.talos.core.SeededRng;
import io.github.manjago.talos.encode.BlockEncoder;
import io.github.manjago.talos.encode.FeatureTensor;
import io.github.manjago.talos.field.Fixed;
import io.github.manjago.talos.field.Goldilocks;
import io.github.manjago.talos.ir.BlockReader;
import io.github.manjago.talos.ir.TestBlocks;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NeuralGeneratorTest {

    private final NeuralGenerator.Factory factory = new NeuralGenerator.Factory();
    private FeatureTensor tensor;

    @BeforeEach
    void setUp() throws Exception {
        BlockReader.ParsedBlock parsed = TestBlocks.parse("""
                %0 = input 0
                %1 = const 3
                %2 = mul %0 %1
                %3 = const 7
                %4 = add %2 %3
                %5 = output %4
                """);
        tensor = new BlockEncoder().encode(parsed.block(), parsed.entry());
    }

    /**
     * Small random weights on the product grid.
     */
    private static GeneratorParameters randomParameters(long seed) {
        SeededRng rng = new SeededRng(seed);
        long[] raw = new long[NeuralGenerator.PARAMETER_COUNT];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = Goldilocks.fromSigned(rng.nextSymmetric(64) << (Fixed.SCALE_BITS - Fixed.GRID_BITS));
        }
        return new GeneratorParameters(NeuralGenerator.KIND, raw);
    }

    @Test
    @DisplayName("Parameter count covers encoder, latent, decoder and output layers")
    void parameterCount() {
        assertEquals(86, NeuralGenerator.VOCAB);
        assertEquals(17198, NeuralGenerator.PARAMETER_COUNT);
        assertEquals(NeuralGenerator.PARAMETER_COUNT, factory.parameterCount());
    }

    @Test
    @DisplayName("Untrained parameters decline")
    void zerosDecline() {
        assertTrue(factory.create(factory.defaults()).propose(tensor, 8).isEmpty());
    }

    @Test
    @DisplayName("Trained parameters propose at most k tagged candidates")
    void proposes() {
        List<Candidate> candidates = factory.create(randomParameters(7)).propose(tensor, 4);

        assertFalse(candidates.isEmpty());
        assertTrue(candidates.size() <= 4);
        for (Candidate candidate : candidates) {
            assertEquals(tensor.blockId(), candidate.blockId());
            assertFalse(candidate.source().isEmpty());
            assertTrue(candidate.source().size() <= NeuralGenerator.MAX_OUTPUT);
        }
    }

    @Test
    @DisplayName("Same parameters, same candidates")
    void deterministic() {
        GeneratorParameters parameters = randomParameters(11);
        assertEquals(factory.create(parameters).propose(tensor, 8),
                factory.create(parameters).propose(tensor, 8));
    }

    @Test
    @DisplayName("Resolved candidates assemble")
    void candidatesAssemble() {
        Assembler assembler = new Assembler();
        for (Candidate candidate : factory.create(randomParameters(3)).propose(tensor, 8)) {
            boolean unresolved = candidate.source().stream().anyMatch(line -> line.contains("$"));
            if (!unresolved) {
                assertDoesNotThrow(() -> assembler.assembleLines(candidate.source()), candidate.source().toString());
            }
        }
    }

    @Test
    @DisplayName("Constant slots resolve against the block constants")
    void constantSlots() {
        List<String> constants = NeuralGenerator.constants(tensor);

        assertEquals(List.of("3", "7"), constants);
        assertEquals("<end>", InstructionVocabulary.token(InstructionVocabulary.END));
        assertEquals("push 3", InstructionVocabulary.render(1, constants));
        assertEquals("push 7", InstructionVocabulary.render(2, constants));
        assertEquals("push $3", InstructionVocabulary.render(4, constants));
        assertEquals("push -1", InstructionVocabulary.render(7, constants));
    }

    @Test
    @DisplayName("Vocabulary lines are valid assembly")
    void vocabularyAssembles() {
        Assembler assembler = new Assembler();
        for (int id = 1 + InstructionVocabulary.CONSTANT_SLOTS; id < InstructionVocabulary.size(); id++) {
            String line = InstructionVocabulary.token(id);
            assertDoesNotThrow(() -> assembler.assemble(line), line);
        }
    }
}
