package io.github.manjago.talos.encode;

/**
 * Node referring to a missing, later or non-value node, or to an entry slot that does not exist.
 */
public class InvalidReferenceException extends EncodingException {

    private final int nodeIndex;

    public InvalidReferenceException(int nodeIndex, String message) {
        super("Node %" + nodeIndex + ": " + message);
        this.nodeIndex = nodeIndex;
    }

    public int getNodeIndex() {
        return nodeIndex;
    }
}
