package io.github.manjago.talos.encode;

import io.github.manjago.talos.ir.BasicBlock;

/**
 * Block with more nodes than the encoding holds. The caller must split it first.
 */
public class BlockTooLargeException extends EncodingException {

    private final int nodeCount;

    public BlockTooLargeException(int nodeCount) {
        super("Block has " + nodeCount + " nodes, maximum is " + BasicBlock.MAX_NODES);
        this.nodeCount = nodeCount;
    }

    public int getNodeCount() {
        return nodeCount;
    }
}
