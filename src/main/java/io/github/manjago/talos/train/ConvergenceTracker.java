package io.github.manjago.talos.train;

/**
 * Watches the best fitness per generation and tells when a session stopped improving.
 */
public final class ConvergenceTracker {

    public enum Status {
        IMPROVING,
        PLATEAUED,
        CONVERGED
    }

    private final int window;
    private long best = Individual.UNEVALUATED;
    private int stale;

    /**
     * @param window generations without improvement that count as converged, 0 to never converge
     */
    public ConvergenceTracker(int window) {
        if (window < 0) {
            throw new IllegalArgumentException("window must be >= 0: " + window);
        }
        this.window = window;
    }

    public Status record(long bestFitness) {
        if (bestFitness > best) {
            best = bestFitness;
            stale = 0;
            return Status.IMPROVING;
        }
        stale++;
        return window > 0 && stale >= window ? Status.CONVERGED : Status.PLATEAUED;
    }

    public long getBest() {
        return best;
    }

    public int getStaleGenerations() {
        return stale;
    }
}
