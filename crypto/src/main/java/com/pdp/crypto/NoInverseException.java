package com.pdp.crypto;

import java.math.BigInteger;

/**
 * gcd(a, m) != 1, so a has no inverse modulo m.
 * With correctly generated keys this cannot happen; seeing it means
 * the key material is corrupted or mismatched.
 */
public class NoInverseException extends CryptoException {
    private final BigInteger gcd;

    public NoInverseException(BigInteger a, BigInteger m, BigInteger gcd) {
        super("No inverse of " + a + " modulo " + m + " (gcd=" + gcd + ")");
        this.gcd = gcd;
    }

    public BigInteger getGcd() {
        return gcd;
    }
}
