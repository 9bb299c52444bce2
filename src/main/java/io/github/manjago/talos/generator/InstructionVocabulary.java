package io.github.manjago.talos.generator;

import io.github.manjago.talos.core.Mnemonic;

import java.util.ArrayList;
import java.util.List;

/**
 * Output tokens of the neural generator.
 * <p>
 * Token 0 ends a sequence. {@code push $i} pushes the i-th distinct constant of the
 * block; it is left unresolved when the block has fewer constants, which makes the
 * candidate ill-formed.
 */
public final class InstructionVocabulary {

    public static final int END = 0;

    /** Constant slots addressable by {@code push $i}. */
    public static final int CONSTANT_SLOTS = 4;

    private static final String CONSTANT_PREFIX = "$";

    private static final List<String> TOKENS = build();

    private InstructionVocabulary() {
        // Utility class
    }

    private static List<String> build() {
        List<String> tokens = new ArrayList<>();
        tokens.add("<end>");
        for (int i = 0; i < CONSTANT_SLOTS; i++) {
            tokens.add("push " + CONSTANT_PREFIX + i);
        }
        tokens.add("push 0");
        tokens.add("push 1");
        tokens.add("push -1");
        for (int n = 1; n <= Mnemonic.MAX_COUNT; n++) {
            tokens.add("pop " + n);
        }
        for (int d = 0; d < Mnemonic.WINDOW; d++) {
            tokens.add("dup " + d);
        }
        for (Mnemonic m : List.of(Mnemonic.SWAP, Mnemonic.PICK, Mnemonic.PLACE)) {
            for (int d = 1; d < Mnemonic.WINDOW; d++) {
                tokens.add(m.text() + " " + d);
            }
        }
        for (Mnemonic m : List.of(Mnemonic.ADD, Mnemonic.MUL, Mnemonic.INVERT, Mnemonic.EQ, Mnemonic.LT,
                Mnemonic.AND, Mnemonic.XOR, Mnemonic.POW, Mnemonic.SPLIT, Mnemonic.DIV_MOD,
                Mnemonic.LOG_2_FLOOR, Mnemonic.POP_COUNT)) {
            tokens.add(m.text());
        }
        return List.copyOf(tokens);
    }

    public static int size() {
        return TOKENS.size();
    }

    public static String token(int id) {
        return TOKENS.get(id);
    }

    /**
     * Assembly line for {@code id}, with constant slots resolved against {@code constants}.
     */
    public static String render(int id, List<String> constants) {
        String token = TOKENS.get(id);
        int dollar = token.indexOf(CONSTANT_PREFIX);
        if (dollar < 0) {
            return token;
        }
        int slot = Integer.parseInt(token.substring(dollar + 1));
        return slot < constants.size() ? "push " + constants.get(slot) : token;
    }
}
