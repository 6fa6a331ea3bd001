package com.pdp.crypto;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Ciphertext: an element of [0, n²) tagged with the id of the key it lives under.
 * Opaque to everyone but the private-key holder.
 */
public final class Ciphertext {
    private final BigInteger value;
    private final String keyId;

    public Ciphertext(BigInteger value, PaillierPublicKey key) {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        if (value.signum() < 0 || value.compareTo(key.getNSquared()) >= 0) {
            throw new IllegalArgumentException("Ciphertext outside [0, n^2)");
        }
        this.value = value;
        this.keyId = key.getKeyId();
    }

    public BigInteger getValue() {
        return value;
    }

    public String getKeyId() {
        return keyId;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Ciphertext that)) return false;
        return value.equals(that.value) && keyId.equals(that.keyId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, keyId);
    }

    @Override
    public String toString() {
        return "Ciphertext{key=" + keyId + ", bits=" + value.bitLength() + "}";
    }
}
