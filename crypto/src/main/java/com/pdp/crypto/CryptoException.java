package com.pdp.crypto;

/**
 * Base type of all failures raised by the Paillier core.
 * Unchecked: every subtype signals a caller bug or corrupted key material,
 * none of them is worth retrying.
 */
public class CryptoException extends RuntimeException {
    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
