package io.github.manjago.talos.generator;

/**
 * Generator could not process its input. The selector treats it as zero candidates.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
