package com.pdp.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * Generates Paillier key pairs from two random primes of bits/2 each.
 * Deterministic for a deterministic random source; every call draws fresh primes.
 */
public class PaillierKeyGenerator {
    private static final Logger logger = LoggerFactory.getLogger(PaillierKeyGenerator.class);

    public static final int MIN_KEY_BITS = 16;
    public static final int DEFAULT_MAX_ATTEMPTS = 16;

    private final SecureRandom random;
    private final int maxAttempts;

    public PaillierKeyGenerator() {
        this(new SecureRandom(), DEFAULT_MAX_ATTEMPTS);
    }

    public PaillierKeyGenerator(SecureRandom random, int maxAttempts) {
        this.random = Objects.requireNonNull(random, "random cannot be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param bits modulus size; even and at least {@value #MIN_KEY_BITS}
     * @throws KeyGenerationException if no usable prime pair was found within the attempt budget
     */
    public PaillierKeyPair generate(int bits) {
        if (bits < MIN_KEY_BITS || bits % 2 != 0) {
            throw new IllegalArgumentException("Key size must be even and >= " + MIN_KEY_BITS + ": " + bits);
        }
        long t0 = System.nanoTime();
        int half = bits / 2;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            BigInteger p = nextPrime(half);
            BigInteger q = nextPrime(half);
            if (p.equals(q)) {
                logger.debug("Prime collision on attempt {}", attempt);
                continue;
            }
            BigInteger n = p.multiply(q);
            BigInteger pm1 = p.subtract(BigInteger.ONE);
            BigInteger qm1 = q.subtract(BigInteger.ONE);
            // needed for g = n + 1 to be a valid generator
            if (!ModularArithmetic.gcd(n, pm1.multiply(qm1)).equals(BigInteger.ONE)) {
                logger.debug("gcd(n, phi) != 1 on attempt {}", attempt);
                continue;
            }

            PaillierPublicKey pub = new PaillierPublicKey(n);
            BigInteger nSquared = pub.getNSquared();
            BigInteger lambda = ModularArithmetic.lcm(pm1, qm1);
            BigInteger x = pub.getG().modPow(lambda, nSquared);
            BigInteger mu = ModularArithmetic.modInverse(ModularArithmetic.lFunction(x, n), n);

            logger.info("Generated {}-bit Paillier key {} in {} ms (attempts={})",
                    n.bitLength(), pub.getKeyId(), (System.nanoTime() - t0) / 1_000_000, attempt);
            return new PaillierKeyPair(pub, new PaillierPrivateKey(lambda, mu, pub));
        }
        throw new KeyGenerationException(
                "Could not find two distinct usable " + half + "-bit primes in " + maxAttempts + " attempts");
    }

    /** Probable prime of exactly {@code bits} bits from the configured random source. */
    protected BigInteger nextPrime(int bits) {
        return BigInteger.probablePrime(bits, random);
    }
}
