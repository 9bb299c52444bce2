package io.github.manjago.talos.persistence;

/**
 * No parameters stored under the requested content hash.
 */
public class CheckpointNotFoundException extends Exception {

    private final String hash;

    public CheckpointNotFoundException(String hash) {
        super("No checkpoint with hash " + hash);
        this.hash = hash;
    }

    public String getHash() {
        return hash;
    }
}
