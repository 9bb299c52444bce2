package io.github.manjago.talos.cost;

import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.core.Mnemonic;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static six-table cost model of a Triton-style VM.
 * <p>
 * Tables: processor, hash, u32, op_stack, ram, jump_stack. Memory instructions
 * add one ram row per word moved; every other delta depends on the mnemonic only.
 */
public final class TritonCostModel implements CostModel {

    public static final int PROCESSOR = 0;
    public static final int HASH = 1;
    public static final int U32 = 2;
    public static final int OP_STACK = 3;
    public static final int RAM = 4;
    public static final int JUMP_STACK = 5;

    private static final List<String> TABLES =
            List.of("processor", "hash", "u32", "op_stack", "ram", "jump_stack");

    private static final long[] SIMPLE_OP = {1, 0, 0, 1, 0, 0};
    private static final long[] PURE_PROC = {1, 0, 0, 0, 0, 0};
    private static final long[] U32_OP = {1, 0, 33, 1, 0, 0};
    private static final long[] U32_NOSTACK = {1, 0, 33, 0, 0, 0};
    private static final long[] HASH_OP = {1, 6, 0, 1, 0, 0};
    private static final long[] SPONGE_INIT = {1, 6, 0, 0, 0, 0};
    private static final long[] ASSERT_PAIR = {2, 0, 0, 2, 0, 0};
    private static final long[] RAM_BASE = {2, 0, 0, 2, 0, 0};
    private static final long[] JUMP = {1, 0, 0, 0, 0, 1};

    private static final Map<Mnemonic, long[]> TABLE = new EnumMap<>(Mnemonic.class);

    static {
        for (Mnemonic m : List.of(Mnemonic.PUSH, Mnemonic.POP, Mnemonic.DUP, Mnemonic.SWAP,
                Mnemonic.PICK, Mnemonic.PLACE, Mnemonic.ADD, Mnemonic.MUL, Mnemonic.EQ,
                Mnemonic.ASSERT, Mnemonic.READ_IO, Mnemonic.WRITE_IO, Mnemonic.DIVINE, Mnemonic.SKIZ)) {
            TABLE.put(m, SIMPLE_OP);
        }
        for (Mnemonic m : List.of(Mnemonic.NOP, Mnemonic.INVERT, Mnemonic.HALT)) {
            TABLE.put(m, PURE_PROC);
        }
        for (Mnemonic m : List.of(Mnemonic.LT, Mnemonic.AND, Mnemonic.XOR, Mnemonic.SPLIT, Mnemonic.POW)) {
            TABLE.put(m, U32_OP);
        }
        TABLE.put(Mnemonic.DIV_MOD, U32_NOSTACK);
        TABLE.put(Mnemonic.LOG_2_FLOOR, U32_NOSTACK);
        TABLE.put(Mnemonic.POP_COUNT, U32_NOSTACK);
        TABLE.put(Mnemonic.HASH, HASH_OP);
        TABLE.put(Mnemonic.SPONGE_ABSORB, HASH_OP);
        TABLE.put(Mnemonic.SPONGE_SQUEEZE, HASH_OP);
        TABLE.put(Mnemonic.SPONGE_INIT, SPONGE_INIT);
        TABLE.put(Mnemonic.ASSERT_VECTOR, ASSERT_PAIR);
        TABLE.put(Mnemonic.READ_MEM, RAM_BASE);
        TABLE.put(Mnemonic.WRITE_MEM, RAM_BASE);
        TABLE.put(Mnemonic.RETURN, JUMP);
        TABLE.put(Mnemonic.RECURSE, JUMP);

        for (Mnemonic m : Mnemonic.values()) {
            if (!TABLE.containsKey(m)) {
                throw new ExceptionInInitializerError("No cost entry for " + m);
            }
        }
    }

    @Override
    public List<String> tableNames() {
        return TABLES;
    }

    @Override
    public long[] deltas(Instruction instruction) {
        long[] deltas = TABLE.get(instruction.mnemonic()).clone();
        if (instruction.mnemonic() == Mnemonic.READ_MEM || instruction.mnemonic() == Mnemonic.WRITE_MEM) {
            deltas[RAM] = instruction.argument();
        }
        return deltas;
    }
}
