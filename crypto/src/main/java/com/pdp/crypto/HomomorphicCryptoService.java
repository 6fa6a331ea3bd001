package com.pdp.crypto;

import java.math.BigInteger;

/**
 * HomomorphicCryptoService: additively homomorphic public-key encryption.
 * All combining operations require operands produced under the same key and
 * raise {@link KeyMismatchException} otherwise.
 */
public interface HomomorphicCryptoService {

    /**
     * Encrypt a plaintext in [0, n).
     *
     * @throws InvalidPlaintextException if the plaintext is negative or not below n
     */
    Ciphertext encrypt(BigInteger plaintext, PaillierPublicKey publicKey);

    /**
     * Convenience: encrypt a non-negative count.
     */
    default Ciphertext encrypt(long plaintext, PaillierPublicKey publicKey) {
        return encrypt(BigInteger.valueOf(plaintext), publicKey);
    }

    /**
     * Decrypt a ciphertext produced under the private key's public half.
     */
    BigInteger decrypt(Ciphertext ciphertext, PaillierPrivateKey privateKey);

    /**
     * Homomorphic addition: decrypts to (m1 + m2) mod n.
     */
    Ciphertext addEncrypted(Ciphertext c1, Ciphertext c2, PaillierPublicKey publicKey);

    /**
     * Plaintext constant addition: decrypts to (m + k) mod n.
     *
     * @throws IllegalArgumentException if the constant is negative
     */
    Ciphertext addConstant(Ciphertext ciphertext, BigInteger constant, PaillierPublicKey publicKey);

    /**
     * Plaintext constant multiplication: decrypts to (m · k) mod n.
     *
     * @throws IllegalArgumentException if the constant is negative
     */
    Ciphertext multiplyConstant(Ciphertext ciphertext, BigInteger constant, PaillierPublicKey publicKey);
}
