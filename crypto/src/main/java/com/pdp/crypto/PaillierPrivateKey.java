package com.pdp.crypto;

import java.math.BigInteger;
import java.util.Objects;

/**
 * PaillierPrivateKey: λ = lcm(p-1, q-1) and μ = L(g^λ mod n²)^-1 mod n.
 * Decryption is defined over the pair, so the public key travels with it.
 */
public final class PaillierPrivateKey {
    private final BigInteger lambda;
    private final BigInteger mu;
    private final PaillierPublicKey publicKey;

    public PaillierPrivateKey(BigInteger lambda, BigInteger mu, PaillierPublicKey publicKey) {
        this.lambda = Objects.requireNonNull(lambda, "lambda cannot be null");
        this.mu = Objects.requireNonNull(mu, "mu cannot be null");
        this.publicKey = Objects.requireNonNull(publicKey, "publicKey cannot be null");
        if (lambda.signum() <= 0 || mu.signum() <= 0) {
            throw new IllegalArgumentException("lambda and mu must be positive");
        }
    }

    public BigInteger getLambda() {
        return lambda;
    }

    public BigInteger getMu() {
        return mu;
    }

    public PaillierPublicKey getPublicKey() {
        return publicKey;
    }

    public String getKeyId() {
        return publicKey.getKeyId();
    }

    /** Never prints λ or μ. */
    @Override
    public String toString() {
        return "PaillierPrivateKey{id=" + publicKey.getKeyId() + "}";
    }
}
