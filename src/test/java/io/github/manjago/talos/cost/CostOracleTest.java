package io.github.manjago.talos.cost;

import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.core.Mnemonic;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CostOracleTest {

    private CostOracle oracle;

    @BeforeEach
    void setUp() {
        oracle = new CostOracle(new TritonCostModel());
    }

    private static List<Instruction> repeat(Instruction instruction, int times) {
        return new ArrayList<>(Collections.nCopies(times, instruction));
    }

    @ParameterizedTest
    @CsvSource({"0, 0", "1, 1", "2, 2", "3, 4", "5, 8", "1024, 1024", "1025, 2048", "4096, 4096"})
    @DisplayName("Cost is the next power of two of the tallest table")
    void powerOfTwoCeiling(long height, long expected) {
        assertEquals(expected, CostOracle.pow2Ceil(height));
    }

    @Test
    @DisplayName("One extra row across a boundary doubles the cost")
    void cliff() {
        Instruction add = Instruction.of(Mnemonic.ADD);
        assertEquals(1024, oracle.cost(repeat(add, 1024)));
        assertEquals(2048, oracle.cost(repeat(add, 1025)));
    }

    @Test
    @DisplayName("Empty sequence costs nothing")
    void empty() {
        assertEquals(0, oracle.cost(List.of()));
        assertEquals(0, oracle.profile(List.of()).max());
    }

    @Test
    @DisplayName("Profiles sum per-instruction deltas")
    void profileSums() {
        CostProfile profile = oracle.profile(List.of(
                Instruction.push(1),
                Instruction.of(Mnemonic.LT),
                Instruction.of(Mnemonic.HASH),
                Instruction.of(Mnemonic.WRITE_MEM, 3),
                Instruction.of(Mnemonic.INVERT)));

        assertEquals(6, profile.tableCount());
        assertEquals(6, profile.height(TritonCostModel.PROCESSOR));
        assertEquals(6, profile.height(TritonCostModel.HASH));
        assertEquals(33, profile.height(TritonCostModel.U32));
        assertEquals(5, profile.height(TritonCostModel.OP_STACK));
        assertEquals(3, profile.height(TritonCostModel.RAM));
        assertEquals(0, profile.height(TritonCostModel.JUMP_STACK));
        assertEquals("u32", profile.dominantTableName());
        assertEquals(64, CostOracle.cost(profile));
    }

    @Test
    @DisplayName("div_mod, log_2_floor and pop_count leave the op stack alone")
    void u32WithoutStackGrowth() {
        TritonCostModel model = new TritonCostModel();
        long[] noStack = {1, 0, 33, 0, 0, 0};

        assertArrayEquals(noStack, model.deltas(Instruction.of(Mnemonic.DIV_MOD)));
        assertArrayEquals(noStack, model.deltas(Instruction.of(Mnemonic.LOG_2_FLOOR)));
        assertArrayEquals(noStack, model.deltas(Instruction.of(Mnemonic.POP_COUNT)));
        assertArrayEquals(new long[]{1, 0, 33, 1, 0, 0}, model.deltas(Instruction.of(Mnemonic.SPLIT)));
        assertEquals(0, oracle.profile(repeat(Instruction.of(Mnemonic.DIV_MOD), 4)).height(TritonCostModel.OP_STACK));
    }

    @Test
    @DisplayName("Every mnemonic has a non-negative entry")
    void everyMnemonicCosted() {
        TritonCostModel model = new TritonCostModel();
        for (Mnemonic m : Mnemonic.values()) {
            long argument = m.arg() == Mnemonic.Arg.COUNT || m.arg() == Mnemonic.Arg.SWAP_DEPTH ? 1 : 0;
            long[] deltas = model.deltas(Instruction.of(m, argument));
            assertEquals(6, deltas.length, m.name());
            for (long d : deltas) {
                assertTrue(d >= 0, m.name());
            }
            assertTrue(deltas[TritonCostModel.PROCESSOR] >= 1, m.name());
        }
    }

    @Test
    @DisplayName("Deltas are owned by the caller")
    void deltasAreCopies() {
        TritonCostModel model = new TritonCostModel();
        model.deltas(Instruction.of(Mnemonic.ADD))[0] = 99;
        assertEquals(1, model.deltas(Instruction.of(Mnemonic.ADD))[0]);
    }

    @Nested
    @DisplayName("Saving classification")
    class Classification {

        private final List<String> tables = List.of("a", "b");

        private CostProfile profile(long a, long b) {
            return new CostProfile(tables, new long[]{a, b});
        }

        @Test
        @DisplayName("Trimmed just below a boundary is a cliff jump")
        void cliffJump() {
            assertTrue(profile(1000, 10).isCliffJump(profile(1030, 10)));
            assertFalse(profile(1000, 10).isTableRebalance(profile(1030, 10)));
        }

        @Test
        @DisplayName("Halving the tallest table is not a cliff jump")
        void halvedIsNotCliff() {
            assertFalse(profile(400, 10).isCliffJump(profile(1030, 10)));
        }

        @Test
        @DisplayName("Same cost is not a cliff jump")
        void sameCost() {
            assertFalse(profile(1025, 10).isCliffJump(profile(1030, 10)));
        }

        @Test
        @DisplayName("Another dominant table is a rebalance")
        void rebalance() {
            assertTrue(profile(300, 900).isTableRebalance(profile(1030, 10)));
            assertFalse(profile(300, 900).isCliffJump(profile(1030, 10)));
        }

        @Test
        @DisplayName("Empty profiles never rebalance")
        void emptyNeverRebalances() {
            assertFalse(profile(0, 0).isTableRebalance(profile(5, 1)));
        }

        @Test
        @DisplayName("Negative heights and size mismatches are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> new CostProfile(tables, new long[]{1}));
            assertThrows(IllegalArgumentException.class, () -> new CostProfile(tables, new long[]{1, -1}));
        }
    }
}
