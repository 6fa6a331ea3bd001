package com.pdp.crypto;

/** Prime search exhausted its attempt budget. */
public class KeyGenerationException extends CryptoException {
    public KeyGenerationException(String message) {
        super(message);
    }

    public KeyGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
