package com.pdp.crypto;

import java.util.Objects;

/** Public/private halves produced by one {@link PaillierKeyGenerator#generate(int)} call. */
public record PaillierKeyPair(PaillierPublicKey publicKey, PaillierPrivateKey privateKey) {
    public PaillierKeyPair {
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(privateKey, "privateKey");
        if (!privateKey.getPublicKey().equals(publicKey)) {
            throw new KeyMismatchException(publicKey.getKeyId(), privateKey.getKeyId());
        }
    }
}
