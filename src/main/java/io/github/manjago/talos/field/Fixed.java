package io.github.manjago.talos.field;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Fixed-point number stored as a Goldilocks field element equal to {@code value * SCALE}.
 * <p>
 * Addition and subtraction are plain field operations. Multiplication rescales once
 * through the field inverse of {@link #SCALE}, so it is exact whenever the scaled
 * product is divisible by {@code SCALE}; values kept on the {@link #GRID_BITS} grid
 * always multiply exactly. Negative numbers live above the field half-point.
 *
 * @param raw canonical field element
 */
public record Fixed(long raw) implements Comparable<Fixed> {

    public static final int SCALE_BITS = 16;
    public static final long SCALE = 1L << SCALE_BITS;

    /** Activations and weights that feed products are truncated to multiples of {@code 2^-GRID_BITS}. */
    public static final int GRID_BITS = 8;

    /** Largest magnitude an activation may carry into a product. */
    public static final long ACTIVATION_BOUND = 1L << 15;

    /** Largest magnitude of a trainable weight. */
    public static final long WEIGHT_BOUND = 4;

    private static final long INV_SCALE = Goldilocks.inv(SCALE);
    private static final long SCALE_SQUARED = Goldilocks.mul(SCALE, SCALE);
    private static final long GRID_MASK = ~((1L << (SCALE_BITS - GRID_BITS)) - 1);

    public static final Fixed ZERO = new Fixed(0);
    public static final Fixed ONE = new Fixed(SCALE);

    public Fixed {
        if (Long.compareUnsigned(raw, Goldilocks.P) >= 0) {
            throw new IllegalArgumentException("Not a canonical field element: " + Long.toUnsignedString(raw));
        }
    }

    // ========== Construction ==========

    @Contract(pure = true)
    public static @NotNull Fixed ofRaw(long raw) {
        return new Fixed(raw);
    }

    /**
     * Integer value {@code n}.
     */
    @Contract(pure = true)
    public static @NotNull Fixed ofInt(long n) {
        return new Fixed(Goldilocks.mul(Goldilocks.fromSigned(n), SCALE));
    }

    /**
     * Nearest representable value to {@code value}.
     */
    @Contract(pure = true)
    public static @NotNull Fixed fromDouble(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a finite value: " + value);
        }
        return new Fixed(Goldilocks.fromSigned(Math.round(value * SCALE)));
    }

    public double toDouble() {
        return (double) signedRaw() / SCALE;
    }

    /**
     * The scaled value as a signed integer.
     */
    public long signedRaw() {
        return Goldilocks.isNegative(raw) ? -(Goldilocks.P - raw) : raw;
    }

    public boolean isNegative() {
        return Goldilocks.isNegative(raw);
    }

    public boolean isZero() {
        return raw == 0;
    }

    // ========== Arithmetic ==========

    public @NotNull Fixed add(@NotNull Fixed other) {
        return new Fixed(Goldilocks.add(raw, other.raw));
    }

    public @NotNull Fixed sub(@NotNull Fixed other) {
        return new Fixed(Goldilocks.sub(raw, other.raw));
    }

    public @NotNull Fixed neg() {
        return new Fixed(Goldilocks.neg(raw));
    }

    public @NotNull Fixed mul(@NotNull Fixed other) {
        return new Fixed(Goldilocks.mul(Goldilocks.mul(raw, other.raw), INV_SCALE));
    }

    /**
     * {@code this * a + b}.
     */
    public @NotNull Fixed madd(@NotNull Fixed a, @NotNull Fixed b) {
        return mul(a).add(b);
    }

    /**
     * Reciprocal: field inverse of the raw value, rescaled by {@code SCALE^2}.
     *
     * @throws ArithmeticException for zero
     */
    public @NotNull Fixed inv() {
        return new Fixed(Goldilocks.mul(Goldilocks.inv(raw), SCALE_SQUARED));
    }

    // ========== Thresholds ==========

    /**
     * Zero for values above the field half-point, identity otherwise.
     */
    public @NotNull Fixed relu() {
        return isNegative() ? ZERO : this;
    }

    /**
     * Saturate to {@code [-bound, bound]}.
     */
    public @NotNull Fixed clamp(long bound) {
        long limit = bound << SCALE_BITS;
        long signed = signedRaw();
        if (signed > limit) {
            return new Fixed(limit);
        }
        if (signed < -limit) {
            return new Fixed(Goldilocks.P - limit);
        }
        return this;
    }

    /**
     * Truncate toward zero onto the product grid.
     */
    public @NotNull Fixed quantize() {
        long signed = signedRaw();
        long magnitude = Math.abs(signed) & GRID_MASK;
        return new Fixed(signed < 0 ? Goldilocks.neg(magnitude) : magnitude);
    }

    @Override
    public int compareTo(@NotNull Fixed other) {
        return Long.compare(signedRaw(), other.signedRaw());
    }

    @Override
    public String toString() {
        return String.format("%.5f", toDouble());
    }
}
