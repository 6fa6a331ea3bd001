package com.pdp.crypto;

import java.math.BigInteger;

/** Plaintext outside [0, n). */
public class InvalidPlaintextException extends CryptoException {
    public InvalidPlaintextException(BigInteger plaintext, BigInteger n) {
        super("Plaintext " + plaintext + " is outside [0, n) for a " + n.bitLength() + "-bit modulus");
    }
}
