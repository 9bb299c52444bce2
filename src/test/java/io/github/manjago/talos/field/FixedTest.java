package io.github.manjago.talos.field;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class FixedTest {

    @ParameterizedTest
    @CsvSource({"0.0", "1.0", "-1.0", "0.5", "-3.25", "1234.0625", "-0.00390625"})
    @DisplayName("Values on the 2^-16 grid survive a round trip")
    void roundTrip(double value) {
        assertEquals(value, Fixed.fromDouble(value).toDouble());
    }

    @Test
    @DisplayName("Negative values sit above the half-point")
    void negativeRepresentation() {
        Fixed minusOne = Fixed.ofInt(-1);
        assertTrue(minusOne.isNegative());
        assertEquals(Goldilocks.P - Fixed.SCALE, minusOne.raw());
        assertEquals(-Fixed.SCALE, minusOne.signedRaw());
    }

    @Test
    @DisplayName("Products of grid values are exact")
    void exactProduct() {
        Fixed a = Fixed.fromDouble(1.5);
        Fixed b = Fixed.fromDouble(-2.25);
        assertEquals(-3.375, a.mul(b).toDouble());
        assertEquals(Fixed.ofInt(6), Fixed.ofInt(2).mul(Fixed.ofInt(3)));
    }

    @Test
    @DisplayName("madd computes this * a + b")
    void madd() {
        assertEquals(Fixed.ofInt(7), Fixed.ofInt(2).madd(Fixed.ofInt(3), Fixed.ONE));
    }

    @Test
    @DisplayName("inv of a power of two")
    void inverse() {
        assertEquals(0.25, Fixed.ofInt(4).inv().toDouble());
        assertThrows(ArithmeticException.class, () -> Fixed.ZERO.inv());
    }

    @Test
    @DisplayName("relu zeroes negative values only")
    void relu() {
        assertEquals(Fixed.ZERO, Fixed.ofInt(-3).relu());
        assertEquals(Fixed.ofInt(3), Fixed.ofInt(3).relu());
    }

    @Test
    @DisplayName("clamp saturates in both directions")
    void clamp() {
        assertEquals(Fixed.ofInt(4), Fixed.ofInt(10).clamp(4));
        assertEquals(Fixed.ofInt(-4), Fixed.ofInt(-10).clamp(4));
        assertEquals(Fixed.fromDouble(2.5), Fixed.fromDouble(2.5).clamp(4));
    }

    @Test
    @DisplayName("quantize truncates toward zero onto the 2^-8 grid")
    void quantize() {
        Fixed fine = Fixed.ofRaw(Fixed.SCALE + 255);
        assertEquals(Fixed.ONE, fine.quantize());

        Fixed negative = Fixed.ofRaw(Goldilocks.fromSigned(-(Fixed.SCALE + 255)));
        assertEquals(Fixed.ofInt(-1), negative.quantize());

        Fixed onGrid = Fixed.fromDouble(0.00390625);
        assertEquals(onGrid, onGrid.quantize());
    }

    @Test
    @DisplayName("Ordering follows the signed value")
    void ordering() {
        assertTrue(Fixed.ofInt(-1).compareTo(Fixed.ZERO) < 0);
        assertTrue(Fixed.ofInt(2).compareTo(Fixed.ONE) > 0);
    }

    @Test
    @DisplayName("Non-canonical raw values are rejected")
    void rejectsNonCanonical() {
        assertThrows(IllegalArgumentException.class, () -> Fixed.ofRaw(Goldilocks.P));
    }

    @Nested
    @DisplayName("RawAccumulator")
    class Accumulator {

        @Test
        @DisplayName("Dot product with bias matches separate multiplication")
        void dotProduct() {
            Fixed result = new RawAccumulator()
                    .addProduct(Fixed.fromDouble(0.5), Fixed.ofInt(6))
                    .addProduct(Fixed.fromDouble(-1.25), Fixed.ofInt(4))
                    .addBias(Fixed.fromDouble(0.75))
                    .finish();
            assertEquals(-1.25, result.toDouble());
        }

        @Test
        @DisplayName("Largest bounded products do not wrap across MAX_TERMS terms")
        void headroom() {
            Fixed weight = Fixed.ofInt(-Fixed.WEIGHT_BOUND);
            Fixed activation = Fixed.ofInt(Fixed.ACTIVATION_BOUND).sub(Fixed.fromDouble(0.00390625));
            RawAccumulator acc = new RawAccumulator();
            for (int i = 0; i < RawAccumulator.MAX_TERMS; i++) {
                acc.addProduct(weight, activation);
            }
            Fixed sum = acc.finish();
            assertTrue(sum.isNegative());
            assertEquals(weight.mul(activation).toDouble() * RawAccumulator.MAX_TERMS, sum.toDouble());
        }

        @Test
        @DisplayName("Fan-in beyond the bound is refused")
        void fanIn() {
            assertDoesNotThrow(() -> RawAccumulator.checkFanIn(RawAccumulator.MAX_TERMS));
            assertThrows(IllegalArgumentException.class,
                    () -> RawAccumulator.checkFanIn(RawAccumulator.MAX_TERMS + 1));
        }
    }
}
