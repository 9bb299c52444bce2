package io.github.manjago.talos.lowering;

/**
 * Block that cannot be scheduled inside the near-register window.
 */
public class LoweringException extends RuntimeException {

    public LoweringException(String message) {
        super(message);
    }
}
