package io.github.manjago.talos.ir;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Immutable straight-line block of IR nodes.
 * <p>
 * Blocks are identified by a content fingerprint so that candidates produced for one
 * block can never be applied to another.
 */
public final class BasicBlock {

    /** Maximum nodes per block. Larger blocks must be split by the caller. */
    public static final int MAX_NODES = 32;

    private final String name;
    private final List<IrNode> nodes;
    private final String fingerprint;

    public BasicBlock(@NotNull List<IrNode> nodes) {
        this("block", nodes);
    }

    /**
     * @param name label for logs, not part of the fingerprint
     */
    public BasicBlock(@NotNull String name, @NotNull List<IrNode> nodes) {
        this.name = name;
        this.nodes = List.copyOf(nodes);
        this.fingerprint = fingerprintOf(this.nodes);
    }

    public String name() {
        return name;
    }

    public List<IrNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public IrNode node(int index) {
        return nodes.get(index);
    }

    /**
     * Indices of the values produced as block results, in output order.
     */
    public int[] outputs() {
        return nodes.stream()
                .filter(n -> n.op() == IrOp.OUTPUT)
                .mapToInt(IrNode::lhs)
                .toArray();
    }

    /**
     * Hex digest of the node list.
     */
    public String fingerprint() {
        return fingerprint;
    }

    private static String fingerprintOf(List<IrNode> nodes) {
        ByteBuffer buf = ByteBuffer.allocate(4 + nodes.size() * 20);
        buf.putInt(nodes.size());
        for (IrNode node : nodes) {
            buf.put((byte) node.op().ordinal());
            buf.put((byte) node.type().ordinal());
            buf.putShort((short) node.lhs());
            buf.putShort((short) node.rhs());
            buf.putLong(node.immediate());
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update("talos-block-v1".getBytes(StandardCharsets.US_ASCII));
            digest.update(buf.array(), 0, buf.position());
            return HexFormat.of().formatHex(digest.digest(), 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BasicBlock other && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return name + "[" + nodes.size() + " nodes, " + fingerprint.substring(0, 8) + "]";
    }
}
