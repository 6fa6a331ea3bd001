package com.pdp.crypto;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * Paillier engine.
 *
 * encrypt:  c = g^m · r^n mod n², r uniform in [1, n) with gcd(r, n) = 1
 * decrypt:  m = L(c^λ mod n²) · μ mod n
 *
 * Holds no key state; thread-safe.
 */
public class PaillierCryptoService implements HomomorphicCryptoService {

    private static final Logger log = LoggerFactory.getLogger(PaillierCryptoService.class);

    private final SecureRandom random;
    private final Counter encryptions;
    private final Counter decryptions;

    public PaillierCryptoService() {
        this(new SecureRandom(), new SimpleMeterRegistry());
    }

    public PaillierCryptoService(SecureRandom random, MeterRegistry metrics) {
        this.random = Objects.requireNonNull(random, "random cannot be null");
        Objects.requireNonNull(metrics, "metrics cannot be null");
        this.encryptions = Counter.builder("pdp.crypto.encryptions").register(metrics);
        this.decryptions = Counter.builder("pdp.crypto.decryptions").register(metrics);
        log.debug("PaillierCryptoService initialized");
    }

    @Override
    public Ciphertext encrypt(BigInteger plaintext, PaillierPublicKey publicKey) {
        Objects.requireNonNull(plaintext, "plaintext cannot be null");
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        BigInteger n = publicKey.getN();
        if (plaintext.signum() < 0 || plaintext.compareTo(n) >= 0) {
            throw new InvalidPlaintextException(plaintext, n);
        }
        BigInteger nSquared = publicKey.getNSquared();
        BigInteger r = randomUnit(n);
        BigInteger c = publicKey.getG().modPow(plaintext, nSquared)
                .multiply(r.modPow(n, nSquared))
                .mod(nSquared);
        encryptions.increment();
        return new Ciphertext(c, publicKey);
    }

    @Override
    public BigInteger decrypt(Ciphertext ciphertext, PaillierPrivateKey privateKey) {
        Objects.requireNonNull(ciphertext, "ciphertext cannot be null");
        Objects.requireNonNull(privateKey, "privateKey cannot be null");
        PaillierPublicKey pub = privateKey.getPublicKey();
        requireSameKey(ciphertext, pub);

        BigInteger n = pub.getN();
        BigInteger x = ciphertext.getValue().modPow(privateKey.getLambda(), pub.getNSquared());
        BigInteger m = ModularArithmetic.lFunction(x, n).multiply(privateKey.getMu()).mod(n);
        decryptions.increment();
        return m;
    }

    @Override
    public Ciphertext addEncrypted(Ciphertext c1, Ciphertext c2, PaillierPublicKey publicKey) {
        Objects.requireNonNull(c1, "c1 cannot be null");
        Objects.requireNonNull(c2, "c2 cannot be null");
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        requireSameKey(c1, publicKey);
        requireSameKey(c2, publicKey);
        BigInteger nSquared = publicKey.getNSquared();
        return new Ciphertext(c1.getValue().multiply(c2.getValue()).mod(nSquared), publicKey);
    }

    @Override
    public Ciphertext addConstant(Ciphertext ciphertext, BigInteger constant, PaillierPublicKey publicKey) {
        Objects.requireNonNull(ciphertext, "ciphertext cannot be null");
        Objects.requireNonNull(constant, "constant cannot be null");
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        requireNonNegative(constant);
        requireSameKey(ciphertext, publicKey);
        BigInteger nSquared = publicKey.getNSquared();
        BigInteger shifted = ciphertext.getValue()
                .multiply(publicKey.getG().modPow(constant, nSquared))
                .mod(nSquared);
        return new Ciphertext(shifted, publicKey);
    }

    @Override
    public Ciphertext multiplyConstant(Ciphertext ciphertext, BigInteger constant, PaillierPublicKey publicKey) {
        Objects.requireNonNull(ciphertext, "ciphertext cannot be null");
        Objects.requireNonNull(constant, "constant cannot be null");
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        requireNonNegative(constant);
        requireSameKey(ciphertext, publicKey);
        BigInteger scaled = ciphertext.getValue().modPow(constant, publicKey.getNSquared());
        return new Ciphertext(scaled, publicKey);
    }

    // ========== HELPERS ==========

    /** Rejection-samples r in [1, n) with gcd(r, n) = 1. */
    private BigInteger randomUnit(BigInteger n) {
        BigInteger r;
        do {
            r = new BigInteger(n.bitLength(), random);
        } while (r.signum() == 0
                || r.compareTo(n) >= 0
                || !r.gcd(n).equals(BigInteger.ONE));
        return r;
    }

    private static void requireNonNegative(BigInteger constant) {
        if (constant.signum() < 0) {
            throw new IllegalArgumentException("Scalar must be non-negative: " + constant);
        }
    }

    private static void requireSameKey(Ciphertext c, PaillierPublicKey key) {
        if (!c.getKeyId().equals(key.getKeyId())) {
            throw new KeyMismatchException(key.getKeyId(), c.getKeyId());
        }
    }
}
