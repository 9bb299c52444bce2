package io.github.manjago.talos.core;

import io.github.manjago.talos.field.Goldilocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Assembler for straight-line stack-machine code.
 *
 * <h2>Syntax:</h2>
 * <pre>
 * // comment (also ';')
 * push -1
 * dup 3
 * add
 * pop 2
 * </pre>
 * One instruction per line, mnemonics are case-insensitive, blank lines are ignored.
 * Immediates are decimal (signed or unsigned) or {@code 0x} hexadecimal and must be
 * below the field modulus.
 */
public class Assembler {

    private static final Logger log = LoggerFactory.getLogger(Assembler.class);

    private static final Pattern COMMENT_PATTERN = Pattern.compile("(//|;).*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HEX_PATTERN = Pattern.compile("0[xX][0-9A-Fa-f]{1,16}");

    /**
     * Assemble source text.
     *
     * @throws AssemblerException on the first malformed line
     */
    public List<Instruction> assemble(String source) throws AssemblerException {
        return assembleLines(source.lines().toList());
    }

    /**
     * Assemble a file.
     */
    public List<Instruction> assembleFile(Path path) throws AssemblerException {
        try {
            return assembleLines(Files.readAllLines(path));
        } catch (IOException e) {
            throw new AssemblerException("Failed to read file: " + path, e);
        }
    }

    /**
     * Assemble source lines, one instruction per non-blank line.
     */
    public List<Instruction> assembleLines(List<String> lines) throws AssemblerException {
        List<Instruction> code = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String stripped = COMMENT_PATTERN.matcher(lines.get(i)).replaceAll("").trim();
            if (stripped.isEmpty()) {
                continue;
            }
            code.add(assembleLine(stripped, i + 1));
        }
        log.debug("Assembled {} instructions from {} lines", code.size(), lines.size());
        return code;
    }

    private Instruction assembleLine(String content, int lineNum) throws AssemblerException {
        String[] tokens = WHITESPACE.split(content);
        Mnemonic mnemonic = Mnemonic.fromText(tokens[0]);
        if (mnemonic == null) {
            throw new AssemblerException("Unknown instruction: " + tokens[0], lineNum);
        }

        if (!mnemonic.hasArgument()) {
            if (tokens.length != 1) {
                throw new AssemblerException(mnemonic.text() + " takes no argument", lineNum);
            }
            return Instruction.of(mnemonic);
        }

        if (tokens.length != 2) {
            throw new AssemblerException(
                    "Usage: " + mnemonic.text() + " <" + mnemonic.arg().range() + ">", lineNum);
        }
        if (mnemonic == Mnemonic.PUSH) {
            return Instruction.pushElement(parseImmediate(tokens[1], lineNum));
        }

        long argument = parseSmall(tokens[1], lineNum);
        if (!mnemonic.arg().accepts(argument)) {
            throw new AssemblerException(mnemonic.text() + " argument out of range: " + argument
                    + " (expected " + mnemonic.arg().range() + ")", lineNum);
        }
        return Instruction.of(mnemonic, argument);
    }

    /**
     * Parse a push immediate into a canonical field element.
     */
    private long parseImmediate(String token, int lineNum) throws AssemblerException {
        try {
            long value;
            if (HEX_PATTERN.matcher(token).matches()) {
                value = Long.parseUnsignedLong(token.substring(2), 16);
            } else if (token.startsWith("-")) {
                return Goldilocks.fromSigned(Long.parseLong(token));
            } else {
                value = Long.parseUnsignedLong(token);
            }
            if (Long.compareUnsigned(value, Goldilocks.P) >= 0) {
                throw new AssemblerException("Immediate outside the field: " + token, lineNum);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new AssemblerException("Invalid immediate: " + token, lineNum, e);
        }
    }

    private long parseSmall(String token, int lineNum) throws AssemblerException {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new AssemblerException("Invalid argument: " + token, lineNum, e);
        }
    }

    /**
     * Exception during assembly.
     */
    public static class AssemblerException extends Exception {
        private final int lineNum;

        public AssemblerException(String message, int lineNum) {
            super("Line " + lineNum + ": " + message);
            this.lineNum = lineNum;
        }

        public AssemblerException(String message, Throwable cause) {
            super(message, cause);
            this.lineNum = -1;
        }

        public AssemblerException(String message, int lineNum, Throwable cause) {
            super("Line " + lineNum + ": " + message, cause);
            this.lineNum = lineNum;
        }

        public int getLineNum() {
            return lineNum;
        }
    }
}
