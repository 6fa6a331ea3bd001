package com.pdp.crypto;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ModularArithmeticTest {

    private static BigInteger big(long v) {
        return BigInteger.valueOf(v);
    }

    @Test
    void gcdAndLcm() {
        assertEquals(big(6), ModularArithmetic.gcd(big(54), big(24)));
        assertEquals(big(216), ModularArithmetic.lcm(big(54), big(24)));
        assertEquals(BigInteger.ZERO, ModularArithmetic.lcm(BigInteger.ZERO, BigInteger.ZERO));
    }

    @Test
    void extendedGcdSatisfiesBezoutIdentity() {
        BigInteger a = new BigInteger("123456789012345678901234567890");
        BigInteger b = new BigInteger("987654321098765432109876543210");
        ModularArithmetic.ExtendedGcd eg = ModularArithmetic.extendedGcd(a, b);

        assertEquals(a.gcd(b), eg.gcd());
        assertEquals(eg.gcd(), a.multiply(eg.x()).add(b.multiply(eg.y())));
    }

    @Test
    void extendedGcdWithZero() {
        ModularArithmetic.ExtendedGcd eg = ModularArithmetic.extendedGcd(BigInteger.ZERO, big(7));
        assertEquals(big(7), eg.gcd());
        assertEquals(big(7), big(7).multiply(eg.y()));
    }

    @Test
    void modInverseMatchesJdk() {
        BigInteger m = new BigInteger("340282366920938463463374607431768211507"); // prime
        BigInteger a = new BigInteger("98765432123456789");
        BigInteger inv = ModularArithmetic.modInverse(a, m);

        assertEquals(a.modInverse(m), inv);
        assertEquals(BigInteger.ONE, a.multiply(inv).mod(m));
        assertTrue(inv.signum() >= 0 && inv.compareTo(m) < 0);
    }

    @Test
    void modInverseOfLargerThanModulusIsReduced() {
        assertEquals(big(4), ModularArithmetic.modInverse(big(3 + 11), big(11)));
    }

    @Test
    void modInverseFailsWhenNotCoprime() {
        NoInverseException ex = assertThrows(NoInverseException.class,
                () -> ModularArithmetic.modInverse(big(6), big(9)));
        assertEquals(big(3), ex.getGcd());
    }

    @Test
    void modInverseRejectsNonPositiveModulus() {
        assertThrows(IllegalArgumentException.class, () -> ModularArithmetic.modInverse(big(3), BigInteger.ZERO));
    }

    @Test
    void lFunctionIsExactDivision() {
        BigInteger n = big(35);
        assertEquals(big(4), ModularArithmetic.lFunction(big(4 * 35 + 1), n));
        assertEquals(BigInteger.ZERO, ModularArithmetic.lFunction(BigInteger.ONE, n));
        assertThrows(IllegalArgumentException.class, () -> ModularArithmetic.lFunction(big(37), n));
    }
}
