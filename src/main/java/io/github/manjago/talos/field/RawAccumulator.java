package io.github.manjago.talos.field;

/**
 * Fused dot-product accumulator: sums raw products and rescales once in {@link #finish()}.
 * <p>
 * Each product of a weight bounded by {@link Fixed#WEIGHT_BOUND} and a quantized
 * activation bounded by {@link Fixed#ACTIVATION_BOUND} stays below {@code 2^49} raw,
 * so at most {@link #MAX_TERMS} of them fit under the field half-point. Layers check
 * their fan-in against this limit when they are built.
 */
public final class RawAccumulator {

    public static final int MAX_TERMS = 8192;

    private static final long INV_SCALE = Goldilocks.inv(Fixed.SCALE);

    private long acc;

    public RawAccumulator addProduct(Fixed weight, Fixed activation) {
        acc = Goldilocks.add(acc, Goldilocks.mul(weight.raw(), activation.raw()));
        return this;
    }

    /**
     * Add a value at the product scale.
     */
    public RawAccumulator addBias(Fixed bias) {
        acc = Goldilocks.add(acc, Goldilocks.mul(bias.raw(), Fixed.SCALE));
        return this;
    }

    public Fixed finish() {
        return Fixed.ofRaw(Goldilocks.mul(acc, INV_SCALE));
    }

    /**
     * Fail fast when a layer would accumulate more products than the headroom allows.
     */
    public static void checkFanIn(int fanIn) {
        if (fanIn > MAX_TERMS) {
            throw new IllegalArgumentException(
                    "Fan-in " + fanIn + " exceeds accumulation bound " + MAX_TERMS);
        }
    }
}
