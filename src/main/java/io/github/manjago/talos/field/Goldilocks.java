package io.github.manjago.talos.field;

import org.jetbrains.annotations.Contract;

/**
 * Arithmetic in the Goldilocks prime field, {@code p = 2^64 - 2^32 + 1}.
 * <p>
 * Elements are carried in a {@code long} and read as unsigned. Every method
 * returns a canonical element in {@code [0, p)} when its inputs are canonical.
 */
public final class Goldilocks {

    /** The field modulus. */
    public static final long P = 0xFFFF_FFFF_0000_0001L;

    /** {@code 2^64 mod p}. */
    private static final long EPSILON = 0xFFFF_FFFFL;

    /** Largest element that reads as non-negative: {@code (p - 1) / 2}. */
    public static final long HALF_P = (P - 1) >>> 1;

    private Goldilocks() {
    }

    /**
     * Reduce an arbitrary unsigned 64-bit value into the field.
     */
    @Contract(pure = true)
    public static long reduce(long value) {
        return Long.compareUnsigned(value, P) >= 0 ? value - P : value;
    }

    /**
     * Map a signed integer into the field: negative values become {@code p - |v|}.
     */
    @Contract(pure = true)
    public static long fromSigned(long value) {
        if (value >= 0) {
            return reduce(value);
        }
        if (value == Long.MIN_VALUE) {
            return sub(0, reduce(Long.MIN_VALUE));
        }
        return neg(reduce(-value));
    }

    @Contract(pure = true)
    public static long add(long a, long b) {
        long sum = a + b;
        if (Long.compareUnsigned(sum, a) < 0) {
            sum += EPSILON;
        }
        return reduce(sum);
    }

    @Contract(pure = true)
    public static long sub(long a, long b) {
        long diff = a - b;
        if (Long.compareUnsigned(a, b) < 0) {
            diff -= EPSILON;
        }
        return diff;
    }

    @Contract(pure = true)
    public static long neg(long a) {
        return a == 0 ? 0 : P - a;
    }

    @Contract(pure = true)
    public static long mul(long a, long b) {
        long lo = a * b;
        long hi = Math.multiplyHigh(a, b) + ((a >> 63) & b) + ((b >> 63) & a);
        return reduce128(hi, lo);
    }

    /**
     * Reduce {@code hi * 2^64 + lo} using {@code 2^64 = 2^32 - 1} and {@code 2^96 = -1}.
     */
    private static long reduce128(long hi, long lo) {
        long hiHi = hi >>> 32;
        long hiLo = hi & EPSILON;

        long t0 = lo - hiHi;
        if (Long.compareUnsigned(lo, hiHi) < 0) {
            t0 -= EPSILON;
        }
        long t1 = hiLo * EPSILON;

        long sum = t0 + t1;
        if (Long.compareUnsigned(sum, t0) < 0) {
            sum += EPSILON;
        }
        return reduce(sum);
    }

    /**
     * Raise {@code base} to an exponent read as unsigned.
     */
    @Contract(pure = true)
    public static long pow(long base, long exponent) {
        long result = 1;
        long b = base;
        long e = exponent;
        while (e != 0) {
            if ((e & 1) == 1) {
                result = mul(result, b);
            }
            b = mul(b, b);
            e >>>= 1;
        }
        return result;
    }

    /**
     * Multiplicative inverse by Fermat's little theorem.
     *
     * @throws ArithmeticException if {@code a} is zero
     */
    @Contract(pure = true)
    public static long inv(long a) {
        if (a == 0) {
            throw new ArithmeticException("zero has no inverse in the Goldilocks field");
        }
        return pow(a, P - 2);
    }

    /**
     * True if the element reads as a negative number (above the half-point).
     */
    @Contract(pure = true)
    public static boolean isNegative(long a) {
        return Long.compareUnsigned(a, HALF_P) > 0;
    }

    @Contract(pure = true)
    public static String toString(long a) {
        return Long.toUnsignedString(a);
    }
}
