package io.github.manjago.talos.field;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class GoldilocksTest {

    private static final long P = Goldilocks.P;

    @Test
    @DisplayName("Modulus is 2^64 - 2^32 + 1")
    void modulus() {
        assertEquals("18446744069414584321", Long.toUnsignedString(P));
    }

    @Test
    @DisplayName("Addition wraps at the modulus")
    void addWraps() {
        assertEquals(0, Goldilocks.add(P - 1, 1));
        assertEquals(5, Goldilocks.add(P - 1, 6));
        assertEquals(P - 2, Goldilocks.add(P - 1, P - 1));
    }

    @Test
    @DisplayName("Subtraction below zero wraps")
    void subWraps() {
        assertEquals(P - 1, Goldilocks.sub(0, 1));
        assertEquals(3, Goldilocks.sub(10, 7));
    }

    @Test
    @DisplayName("Signed literals map to p - |v|")
    void fromSigned() {
        assertEquals(P - 1, Goldilocks.fromSigned(-1));
        assertEquals(42, Goldilocks.fromSigned(42));
        assertTrue(Goldilocks.isNegative(Goldilocks.fromSigned(-5)));
        assertFalse(Goldilocks.isNegative(5));
    }

    @Test
    @DisplayName("(-1) * (-1) = 1")
    void minusOneSquared() {
        assertEquals(1, Goldilocks.mul(P - 1, P - 1));
    }

    @Test
    @DisplayName("2^64 reduces to 2^32 - 1")
    void highProductReduces() {
        long twoTo32 = 1L << 32;
        assertEquals(twoTo32 - 1, Goldilocks.mul(twoTo32, twoTo32));
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 65536, 0x7FFF_FFFFL, 0xFFFF_FFFF_0000_0000L, 123456789012345L})
    @DisplayName("a * inv(a) = 1")
    void inverse(long a) {
        assertEquals(1, Goldilocks.mul(a, Goldilocks.inv(a)));
    }

    @Test
    @DisplayName("Inverse of zero fails")
    void inverseOfZero() {
        assertThrows(ArithmeticException.class, () -> Goldilocks.inv(0));
    }

    @Test
    @DisplayName("Multiplication distributes over addition")
    void distributive() {
        long a = 0x1234_5678_9ABC_DEFL;
        long b = P - 17;
        long c = 0xFFFF_FFFFL;
        assertEquals(Goldilocks.add(Goldilocks.mul(a, b), Goldilocks.mul(a, c)),
                Goldilocks.mul(a, Goldilocks.add(b, c)));
    }

    @Test
    @DisplayName("Fermat: a^(p-1) = 1")
    void fermat() {
        assertEquals(1, Goldilocks.pow(7, P - 1));
        assertEquals(1024, Goldilocks.pow(2, 10));
    }
}
