package io.github.manjago.talos.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Renders instructions back to assembly text.
 * <p>
 * {@link #toSource} output assembles to the same instructions.
 */
public final class Disassembler {

    private Disassembler() {
        // Utility class
    }

    /**
     * One assembly line per instruction.
     */
    public static @NotNull List<String> toLines(@NotNull List<Instruction> code) {
        return code.stream().map(Instruction::toString).toList();
    }

    public static @NotNull String toSource(@NotNull List<Instruction> code) {
        return String.join("\n", toLines(code));
    }

    /**
     * Listing with instruction offsets.
     *
     * @return multi-line listing, empty for no code
     */
    public static @NotNull String listing(@NotNull List<Instruction> code) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < code.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(String.format("%04d: %s", i, code.get(i)));
        }
        return sb.toString();
    }
}
