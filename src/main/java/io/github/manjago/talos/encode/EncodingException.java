package io.github.manjago.talos.encode;

/**
 * A block that cannot be encoded. Compilation of that block aborts; other blocks are unaffected.
 */
public class EncodingException extends Exception {

    public EncodingException(String message) {
        super(message);
    }
}
