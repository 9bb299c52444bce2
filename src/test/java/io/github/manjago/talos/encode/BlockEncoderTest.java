package io.github.manjago.talos.encode;

import io.github.manjago.talos.field.Fixed;
import io.github.manjago.talos.field.Goldilocks;
import io.github.manjago.talos.ir.BasicBlock;
import io.github.manjago.talos.ir.BlockReader;
import io.github.manjago.talos.ir.IrNode;
import io.github.manjago.talos.ir.IrOp;
import io.github.manjago.talos.ir.MachineState;
import io.github.manjago.talos.ir.TestBlocks;
import io.github.manjago.talos.ir.ValueType;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockEncoderTest {

    private BlockEncoder encoder;

    @BeforeEach
    void setUp() {
        encoder = new BlockEncoder();
    }

    @Test
    @DisplayName("Tensor has the fixed length and carries the block id")
    void layout() throws Exception {
        BlockReader.ParsedBlock parsed = TestBlocks.sumMul();
        FeatureTensor tensor = encoder.encode(parsed.block(), parsed.entry());

        assertEquals(768, FeatureTensor.LENGTH);
        assertEquals(FeatureTensor.LENGTH, tensor.toRawArray().length);
        assertEquals(parsed.block().fingerprint(), tensor.blockId());
        assertEquals(6, tensor.nodeCount());
        assertTrue(tensor.hasOp(3, IrOp.ADD));
        assertFalse(tensor.hasOp(3, IrOp.MUL));
    }

    @Test
    @DisplayName("Node records hold references, live ranges and limbs")
    void nodeRecord() throws Exception {
        BlockReader.ParsedBlock parsed = TestBlocks.parse("""
                %0 = input 0
                %1 = const -1
                %2 = add %0 %1
                %3 = output %2
                """);
        FeatureTensor tensor = encoder.encode(parsed.block(), parsed.entry());

        assertEquals(Fixed.ofInt(1), tensor.field(2, FeatureTensor.LHS_OFFSET));
        assertEquals(Fixed.ofInt(2), tensor.field(2, FeatureTensor.RHS_OFFSET));
        assertEquals(Fixed.ZERO, tensor.field(0, FeatureTensor.LHS_OFFSET));
        assertEquals(Fixed.ofInt(2), tensor.field(0, FeatureTensor.LIVE_END_OFFSET));
        assertEquals(Fixed.ofInt(3), tensor.field(2, FeatureTensor.LIVE_END_OFFSET));
        assertEquals(Goldilocks.P - 1, tensor.immediate(1));
    }

    @Test
    @DisplayName("Entry context marks occupied and live slots")
    void entryContext() throws Exception {
        BasicBlock block = TestBlocks.sumMul().block();
        FeatureTensor tensor = encoder.encode(block, new MachineState(4, 0b0101));

        for (int slot = 0; slot < 16; slot++) {
            Fixed occupied = tensor.get(FeatureTensor.CONTEXT_OFFSET + slot);
            Fixed live = tensor.get(FeatureTensor.CONTEXT_OFFSET + 16 + slot);
            assertEquals(slot < 4 ? Fixed.ONE : Fixed.ZERO, occupied, "occupied " + slot);
            assertEquals(slot == 0 || slot == 2 ? Fixed.ONE : Fixed.ZERO, live, "live " + slot);
        }
    }

    @Test
    @DisplayName("Decode recovers block and entry state")
    void decodeIsLossless() throws Exception {
        for (BlockReader.ParsedBlock parsed : TestBlocks.sample()) {
            FeatureTensor tensor = encoder.encode(parsed.block(), parsed.entry());
            BlockEncoder.Decoded decoded = encoder.decode(tensor);
            assertEquals(parsed.block(), decoded.block(), parsed.block().name());
            assertEquals(parsed.entry(), decoded.entry(), parsed.block().name());
        }
    }

    @Test
    @DisplayName("Decoding a tensor under a foreign block id fails")
    void decodeMismatch() throws Exception {
        BlockReader.ParsedBlock parsed = TestBlocks.sumMul();
        FeatureTensor tensor = encoder.encode(parsed.block(), parsed.entry());
        FeatureTensor forged = FeatureTensor.fromRaw("0".repeat(32), tensor.nodeCount(), tensor.toRawArray());

        assertThrows(EncodingException.class, () -> encoder.decode(forged));
    }

    @Test
    @DisplayName("Blocks above 32 nodes are too large")
    void tooLarge() {
        List<IrNode> nodes = new ArrayList<>();
        for (int i = 0; i < BasicBlock.MAX_NODES + 1; i++) {
            nodes.add(IrNode.constant(i, ValueType.FIELD));
        }
        BasicBlock block = new BasicBlock(nodes);

        BlockTooLargeException e = assertThrows(BlockTooLargeException.class,
                () -> encoder.encode(block, MachineState.allLive(0)));
        assertEquals(33, e.getNodeCount());
    }

    @Test
    @DisplayName("Exactly 32 nodes still encode")
    void maxSize() {
        List<IrNode> nodes = new ArrayList<>();
        for (int i = 0; i < BasicBlock.MAX_NODES; i++) {
            nodes.add(IrNode.constant(i, ValueType.FIELD));
        }
        assertDoesNotThrow(() -> encoder.encode(new BasicBlock(nodes), MachineState.allLive(0)));
    }

    @Nested
    @DisplayName("Invalid references")
    class InvalidReferences {

        @Test
        @DisplayName("Forward reference")
        void forward() {
            BasicBlock block = new BasicBlock(List.of(
                    IrNode.input(0, ValueType.FIELD),
                    IrNode.binary(IrOp.ADD, 0, 2, ValueType.FIELD),
                    IrNode.input(1, ValueType.FIELD)));

            InvalidReferenceException e = assertThrows(InvalidReferenceException.class,
                    () -> encoder.encode(block, MachineState.allLive(2)));
            assertEquals(1, e.getNodeIndex());
        }

        @Test
        @DisplayName("Reference to an output node")
        void referenceToOutput() {
            BasicBlock block = new BasicBlock(List.of(
                    IrNode.input(0, ValueType.FIELD),
                    IrNode.output(0),
                    IrNode.unary(IrOp.NEG, 1, ValueType.FIELD)));

            assertThrows(InvalidReferenceException.class, () -> encoder.encode(block, MachineState.allLive(1)));
        }

        @Test
        @DisplayName("Input deeper than the entry stack")
        void inputBeyondEntry() {
            BasicBlock block = TestBlocks.sumMul().block();
            assertThrows(InvalidReferenceException.class, () -> encoder.encode(block, MachineState.allLive(2)));
        }

        @Test
        @DisplayName("Input outside the window")
        void inputOutsideWindow() {
            BasicBlock block = new BasicBlock(List.of(IrNode.input(16, ValueType.FIELD)));
            assertThrows(InvalidReferenceException.class, () -> encoder.encode(block, MachineState.allLive(20)));
        }
    }
}
