package com.pdp.crypto;

/** Ciphertexts or keys from different key pairs were combined. */
public class KeyMismatchException extends CryptoException {
    public KeyMismatchException(String expectedKeyId, String actualKeyId) {
        super("Key mismatch: expected key " + expectedKeyId + " but got " + actualKeyId);
    }
}
