package com.pdp.crypto;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * PaillierPublicKey: modulus n and generator g = n + 1.
 *
 * keyId = first 8 bytes of SHA-256(n), hex. Ciphertexts carry it so that
 * values produced under different key pairs are never combined.
 */
public final class PaillierPublicKey {
    private final BigInteger n;
    private final BigInteger g;
    private final BigInteger nSquared;
    private final String keyId;

    public PaillierPublicKey(BigInteger n) {
        Objects.requireNonNull(n, "n cannot be null");
        if (n.compareTo(BigInteger.valueOf(3)) < 0) {
            throw new IllegalArgumentException("Modulus too small: " + n);
        }
        this.n = n;
        this.g = n.add(BigInteger.ONE);
        this.nSquared = n.multiply(n);
        this.keyId = fingerprint(n);
    }

    public BigInteger getN() {
        return n;
    }

    public BigInteger getG() {
        return g;
    }

    public BigInteger getNSquared() {
        return nSquared;
    }

    public String getKeyId() {
        return keyId;
    }

    public int getBitLength() {
        return n.bitLength();
    }

    private static String fingerprint(BigInteger n) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] d = md.digest(n.toByteArray());
            return HexFormat.of().formatHex(d, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PaillierPublicKey that)) return false;
        return n.equals(that.n);
    }

    @Override
    public int hashCode() {
        return n.hashCode();
    }

    @Override
    public String toString() {
        return String.format("PaillierPublicKey{id=%s, bits=%d}", keyId, n.bitLength());
    }
}
