package io.github.manjago.talos.core;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Explicitly seeded random source for everything stochastic in training.
 * <p>
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP. The same seed always yields the same
 * stream, so a training session is reproducible end to end.
 * <p>
 * IMPORTANT: Do not change the algorithm between versions, recorded seeds would
 * stop reproducing earlier sessions.
 */
public final class SeededRng {

    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    private final long seed;
    private final UniformRandomProvider rng;

    public SeededRng(long seed) {
        this.seed = seed;
        this.rng = ALGORITHM.create(seed);
    }

    /**
     * Returns uniformly distributed int in [0, bound).
     */
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    /**
     * Returns uniformly distributed long in [-magnitude, magnitude].
     */
    public long nextSymmetric(long magnitude) {
        return rng.nextLong(-magnitude, magnitude + 1);
    }

    public long nextLong() {
        return rng.nextLong();
    }

    /**
     * Returns uniformly distributed double in [0, 1).
     */
    public double nextDouble() {
        return rng.nextDouble();
    }

    /**
     * Returns true with probability p.
     */
    public boolean nextBoolean(double probability) {
        return rng.nextDouble() < probability;
    }

    public boolean nextBoolean() {
        return rng.nextBoolean();
    }

    /**
     * Independent stream derived from this one, for work that may run on another thread.
     */
    public SeededRng fork() {
        return new SeededRng(rng.nextLong());
    }

    public long getSeed() {
        return seed;
    }
}
