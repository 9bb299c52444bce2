package io.github.manjago.talos.ir;

import io.github.manjago.talos.field.Goldilocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads IR blocks from text.
 *
 * <h2>Syntax:</h2>
 * <pre>
 * # comment
 * block sum3                 # optional name
 * entry depth=3 live=0x7     # optional, defaults to the inputs read, all live
 * %0 = input 0 : field
 * %1 = const -1
 * %2 = add %0 %1 : u32
 * %3 = output %2
 * ---                        # ends a block
 * </pre>
 * Node numbers must be consecutive from zero. The type suffix defaults to {@code field}.
 */
public class BlockReader {

    private static final Logger log = LoggerFactory.getLogger(BlockReader.class);

    private static final Pattern NODE_PATTERN =
            Pattern.compile("^%(\\d+)\\s*=\\s*(\\w+)((?:\\s+[^\\s:]+)*)\\s*(?::\\s*(\\w+))?$");
    private static final Pattern ENTRY_PATTERN =
            Pattern.compile("^entry\\s+depth=(\\d+)(?:\\s+live=0[xX]([0-9A-Fa-f]+))?$");
    private static final Pattern BLOCK_PATTERN = Pattern.compile("^block\\s+(\\S+)$");
    private static final Pattern REF_PATTERN = Pattern.compile("^%(\\d+)$");

    /**
     * A block together with the entry state it was written for.
     */
    public record ParsedBlock(BasicBlock block, MachineState entry) {}

    public List<ParsedBlock> read(String source) throws BlockFormatException {
        return readLines(source.lines().toList());
    }

    public List<ParsedBlock> readFile(Path path) throws BlockFormatException {
        try {
            return readLines(Files.readAllLines(path));
        } catch (IOException e) {
            throw new BlockFormatException("Failed to read file: " + path, e);
        }
    }

    public List<ParsedBlock> readLines(List<String> lines) throws BlockFormatException {
        List<ParsedBlock> blocks = new ArrayList<>();
        Builder current = new Builder(blocks.size());

        for (int i = 0; i < lines.size(); i++) {
            int lineNum = i + 1;
            String line = stripComment(lines.get(i)).trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.equals("---")) {
                if (!current.isEmpty()) {
                    blocks.add(current.build());
                }
                current = new Builder(blocks.size());
                continue;
            }

            Matcher blockMatcher = BLOCK_PATTERN.matcher(line);
            if (blockMatcher.matches()) {
                current.name = blockMatcher.group(1);
                continue;
            }
            Matcher entryMatcher = ENTRY_PATTERN.matcher(line);
            if (entryMatcher.matches()) {
                current.entry = parseEntry(entryMatcher, lineNum);
                continue;
            }
            Matcher nodeMatcher = NODE_PATTERN.matcher(line);
            if (!nodeMatcher.matches()) {
                throw new BlockFormatException("Unrecognized line: " + line, lineNum);
            }
            current.nodes.add(parseNode(nodeMatcher, current.nodes.size(), lineNum));
        }
        if (!current.isEmpty()) {
            blocks.add(current.build());
        }
        log.debug("Read {} blocks from {} lines", blocks.size(), lines.size());
        return blocks;
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }

    private MachineState parseEntry(Matcher m, int lineNum) throws BlockFormatException {
        int depth = Integer.parseInt(m.group(1));
        try {
            if (m.group(2) == null) {
                return MachineState.allLive(depth);
            }
            return new MachineState(depth, Integer.parseInt(m.group(2), 16));
        } catch (IllegalArgumentException e) {
            throw new BlockFormatException(e.getMessage(), lineNum, e);
        }
    }

    private IrNode parseNode(Matcher m, int expectedIndex, int lineNum) throws BlockFormatException {
        int index = Integer.parseInt(m.group(1));
        if (index != expectedIndex) {
            throw new BlockFormatException("Expected node %" + expectedIndex + " but found %" + index, lineNum);
        }

        IrOp op;
        try {
            op = IrOp.valueOf(m.group(2).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BlockFormatException("Unknown operation: " + m.group(2), lineNum, e);
        }

        ValueType type = ValueType.FIELD;
        if (m.group(4) != null) {
            try {
                type = ValueType.valueOf(m.group(4).toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new BlockFormatException("Unknown type: " + m.group(4), lineNum, e);
            }
        }

        String args = m.group(3).trim();
        String[] tokens = args.isEmpty() ? new String[0] : args.split("\\s+");
        int expected = (op == IrOp.INPUT || op == IrOp.CONST) ? 1 : op.arity();
        if (tokens.length != expected) {
            throw new BlockFormatException(op.text() + " expects " + expected + " argument(s)", lineNum);
        }

        return switch (op) {
            case INPUT -> IrNode.input(parseInt(tokens[0], lineNum), type);
            case CONST -> IrNode.constant(parseLiteral(tokens[0], lineNum), type);
            case OUTPUT -> IrNode.output(parseRef(tokens[0], lineNum));
            default -> op.arity() == 1
                    ? IrNode.unary(op, parseRef(tokens[0], lineNum), type)
                    : IrNode.binary(op, parseRef(tokens[0], lineNum), parseRef(tokens[1], lineNum), type);
        };
    }

    private int parseRef(String token, int lineNum) throws BlockFormatException {
        Matcher m = REF_PATTERN.matcher(token);
        if (!m.matches()) {
            throw new BlockFormatException("Expected a node reference like %3: " + token, lineNum);
        }
        return Integer.parseInt(m.group(1));
    }

    private int parseInt(String token, int lineNum) throws BlockFormatException {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new BlockFormatException("Invalid integer: " + token, lineNum, e);
        }
    }

    private long parseLiteral(String token, int lineNum) throws BlockFormatException {
        try {
            if (token.startsWith("-")) {
                return Goldilocks.fromSigned(Long.parseLong(token));
            }
            long value = Long.parseUnsignedLong(token);
            if (Long.compareUnsigned(value, Goldilocks.P) >= 0) {
                throw new BlockFormatException("Constant outside the field: " + token, lineNum);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new BlockFormatException("Invalid constant: " + token, lineNum, e);
        }
    }

    /**
     * Accumulates one block while reading.
     */
    private static final class Builder {
        private String name;
        private MachineState entry;
        private final List<IrNode> nodes = new ArrayList<>();

        Builder(int ordinal) {
            this.name = "block" + ordinal;
        }

        boolean isEmpty() {
            return nodes.isEmpty() && entry == null;
        }

        ParsedBlock build() {
            MachineState state = entry;
            if (state == null) {
                int depth = nodes.stream()
                        .filter(n -> n.op() == IrOp.INPUT)
                        .mapToInt(n -> (int) n.immediate() + 1)
                        .max()
                        .orElse(0);
                state = MachineState.allLive(depth);
            }
            return new ParsedBlock(new BasicBlock(name, nodes), state);
        }
    }

    /**
     * Malformed block text.
     */
    public static class BlockFormatException extends Exception {
        private final int lineNum;

        public BlockFormatException(String message, int lineNum) {
            super("Line " + lineNum + ": " + message);
            this.lineNum = lineNum;
        }

        public BlockFormatException(String message, Throwable cause) {
            super(message, cause);
            this.lineNum = -1;
        }

        public BlockFormatException(String message, int lineNum, Throwable cause) {
            super("Line " + lineNum + ": " + message, cause);
            this.lineNum = lineNum;
        }

        public int getLineNum() {
            return lineNum;
        }
    }
}
