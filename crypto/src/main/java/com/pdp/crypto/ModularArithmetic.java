package com.pdp.crypto;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Arbitrary-precision number theory used by key generation and the Paillier engine.
 */
public final class ModularArithmetic {

    private ModularArithmetic() {}

    /** Result of the extended Euclidean algorithm: a·x + b·y = gcd. */
    public record ExtendedGcd(BigInteger gcd, BigInteger x, BigInteger y) {}

    public static BigInteger gcd(BigInteger a, BigInteger b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        return a.gcd(b);
    }

    /** lcm(a, b) = |a·b| / gcd(a, b); lcm(0, 0) = 0. */
    public static BigInteger lcm(BigInteger a, BigInteger b) {
        BigInteger g = gcd(a, b);
        if (g.signum() == 0) return BigInteger.ZERO;
        return a.multiply(b).abs().divide(g);
    }

    /**
     * Iterative extended Euclid for non-negative inputs.
     *
     * @return (g, x, y) with a·x + b·y = g = gcd(a, b)
     */
    public static ExtendedGcd extendedGcd(BigInteger a, BigInteger b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.signum() < 0 || b.signum() < 0) {
            throw new IllegalArgumentException("extendedGcd expects non-negative inputs");
        }
        BigInteger oldR = a, r = b;
        BigInteger oldS = BigInteger.ONE, s = BigInteger.ZERO;
        BigInteger oldT = BigInteger.ZERO, t = BigInteger.ONE;
        while (r.signum() != 0) {
            BigInteger q = oldR.divide(r);

            BigInteger tmp = r;
            r = oldR.subtract(q.multiply(r));
            oldR = tmp;

            tmp = s;
            s = oldS.subtract(q.multiply(s));
            oldS = tmp;

            tmp = t;
            t = oldT.subtract(q.multiply(t));
            oldT = tmp;
        }
        return new ExtendedGcd(oldR, oldS, oldT);
    }

    /**
     * x with a·x ≡ 1 (mod m), normalized into [0, m).
     *
     * @throws NoInverseException when gcd(a, m) != 1
     */
    public static BigInteger modInverse(BigInteger a, BigInteger m) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(m, "m");
        if (m.signum() <= 0) {
            throw new IllegalArgumentException("Modulus must be positive: " + m);
        }
        ExtendedGcd eg = extendedGcd(a.mod(m), m);
        if (!eg.gcd().equals(BigInteger.ONE)) {
            throw new NoInverseException(a, m, eg.gcd());
        }
        return eg.x().mod(m);
    }

    /**
     * Paillier linearization L(x) = (x - 1) / n.
     * Callers only pass x ≡ 1 (mod n); anything else is not a valid input.
     */
    public static BigInteger lFunction(BigInteger x, BigInteger n) {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(n, "n");
        BigInteger[] qr = x.subtract(BigInteger.ONE).divideAndRemainder(n);
        if (qr[1].signum() != 0) {
            throw new IllegalArgumentException("L(x) undefined: x is not congruent to 1 mod n");
        }
        return qr[0];
    }
}
