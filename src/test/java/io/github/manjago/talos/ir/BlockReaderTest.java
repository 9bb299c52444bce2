package io.github.manjago.talos.ir;

import io.github.manjago.talos.field.Goldilocks;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockReaderTest {

    private BlockReader reader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        reader = new BlockReader();
    }

    @Test
    @DisplayName("Nodes, name and default entry state")
    void readSingleBlock() throws Exception {
        List<BlockReader.ParsedBlock> blocks = reader.read(TestBlocks.SUM_MUL);

        assertEquals(1, blocks.size());
        BasicBlock block = blocks.get(0).block();
        assertEquals("sum_mul", block.name());
        assertEquals(6, block.size());
        assertEquals(IrNode.binary(IrOp.ADD, 0, 1, ValueType.FIELD), block.node(3));
        assertArrayEquals(new int[]{4}, block.outputs());
        assertEquals(MachineState.allLive(3), blocks.get(0).entry());
    }

    @Test
    @DisplayName("Explicit entry line, types, constants and separators")
    void readSeveralBlocks() throws Exception {
        List<BlockReader.ParsedBlock> blocks = reader.read("""
                entry depth=20 live=0x5
                %0 = input 1 : u32
                %1 = const -1
                %2 = lt %0 %1 : bool   # comment
                %3 = output %2
                ---
                ---
                %0 = const 18446744069414584320
                %1 = output %0
                """);

        assertEquals(2, blocks.size());
        BlockReader.ParsedBlock first = blocks.get(0);
        assertEquals(new MachineState(20, 0x5), first.entry());
        assertEquals(ValueType.U32, first.block().node(0).type());
        assertEquals(Goldilocks.P - 1, first.block().node(1).immediate());
        assertEquals(ValueType.BOOL, first.block().node(2).type());

        BlockReader.ParsedBlock second = blocks.get(1);
        assertEquals("block1", second.block().name());
        assertEquals(MachineState.allLive(0), second.entry());
        assertEquals(Goldilocks.P - 1, second.block().node(0).immediate());
    }

    @Test
    @DisplayName("Out-of-order node numbers are rejected with the line")
    void nodeNumbering() {
        BlockReader.BlockFormatException e = assertThrows(BlockReader.BlockFormatException.class,
                () -> reader.read("%0 = input 0\n%2 = output %0"));
        assertEquals(2, e.getLineNum());
    }

    @Test
    @DisplayName("Malformed lines are rejected")
    void malformed() {
        assertThrows(BlockReader.BlockFormatException.class, () -> reader.read("%0 = frob %1"));
        assertThrows(BlockReader.BlockFormatException.class, () -> reader.read("%0 = add %1"));
        assertThrows(BlockReader.BlockFormatException.class, () -> reader.read("%0 = input 0 : f64"));
        assertThrows(BlockReader.BlockFormatException.class, () -> reader.read("%0 = const 18446744069414584321"));
        assertThrows(BlockReader.BlockFormatException.class, () -> reader.read("entry depth=2 live=0x10000"));
        assertThrows(BlockReader.BlockFormatException.class, () -> reader.read("what is this"));
    }

    @Test
    @DisplayName("Reads files and reports missing ones")
    void readFile() throws Exception {
        Path file = tempDir.resolve("one.ir");
        Files.writeString(file, TestBlocks.SUM_MUL);

        assertEquals(1, reader.readFile(file).size());
        assertThrows(BlockReader.BlockFormatException.class, () -> reader.readFile(tempDir.resolve("missing.ir")));
    }

    @Test
    @DisplayName("Sample corpus parses")
    void sampleCorpus() {
        List<BlockReader.ParsedBlock> blocks = TestBlocks.sample();
        assertEquals(7, blocks.size());
        assertEquals(new MachineState(6, 0x3f), blocks.get(2).entry());
    }

    @Nested
    @DisplayName("Fingerprint")
    class Fingerprint {

        @Test
        @DisplayName("Depends on the nodes, not the name")
        void ignoresName() {
            BasicBlock a = TestBlocks.sumMul().block();
            BasicBlock b = new BasicBlock("other", a.nodes());
            assertEquals(a.fingerprint(), b.fingerprint());
            assertEquals(a, b);
        }

        @Test
        @DisplayName("Changes when an operand changes")
        void sensitiveToOperands() {
            BasicBlock a = TestBlocks.sumMul().block();
            BasicBlock b = TestBlocks.parse(TestBlocks.SUM_MUL.replace("add %0 %1", "add %1 %0")).block();
            assertNotEquals(a.fingerprint(), b.fingerprint());
        }
    }
}
