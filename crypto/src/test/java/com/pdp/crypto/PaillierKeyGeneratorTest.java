package com.pdp.crypto;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.*;

class PaillierKeyGeneratorTest {

    @Test
    void generatedKeySatisfiesSchemeInvariants() {
        PaillierKeyPair kp = new PaillierKeyGenerator().generate(128);
        PaillierPublicKey pub = kp.publicKey();
        PaillierPrivateKey priv = kp.privateKey();
        BigInteger n = pub.getN();

        assertEquals(n.add(BigInteger.ONE), pub.getG());
        assertEquals(n.multiply(n), pub.getNSquared());
        assertTrue(n.bitLength() >= 127 && n.bitLength() <= 128, "bits=" + n.bitLength());

        // g^λ mod n² must linearize to μ^-1
        BigInteger x = pub.getG().modPow(priv.getLambda(), pub.getNSquared());
        BigInteger l = ModularArithmetic.lFunction(x, n);
        assertEquals(BigInteger.ONE, l.multiply(priv.getMu()).mod(n));
        assertSame(pub, priv.getPublicKey());
    }

    @Test
    void independentCallsProduceDifferentKeys() {
        PaillierKeyGenerator gen = new PaillierKeyGenerator();
        PaillierKeyPair a = gen.generate(64);
        PaillierKeyPair b = gen.generate(64);
        assertNotEquals(a.publicKey(), b.publicKey());
        assertNotEquals(a.publicKey().getKeyId(), b.publicKey().getKeyId());
    }

    @Test
    void deterministicForSameSeededSource() throws Exception {
        PaillierKeyPair a = new PaillierKeyGenerator(seeded(1234L), 8).generate(64);
        PaillierKeyPair b = new PaillierKeyGenerator(seeded(1234L), 8).generate(64);
        assertEquals(a.publicKey(), b.publicKey());
        assertEquals(a.privateKey().getLambda(), b.privateKey().getLambda());
    }

    @Test
    void rejectsOddOrTinyKeySizes() {
        PaillierKeyGenerator gen = new PaillierKeyGenerator();
        assertThrows(IllegalArgumentException.class, () -> gen.generate(8));
        assertThrows(IllegalArgumentException.class, () -> gen.generate(65));
        assertThrows(IllegalArgumentException.class, () -> new PaillierKeyGenerator(new SecureRandom(), 0));
    }

    @Test
    void exhaustedPrimeSearchFails() {
        PaillierKeyGenerator alwaysSame = new PaillierKeyGenerator(new SecureRandom(), 3) {
            @Override
            protected BigInteger nextPrime(int bits) {
                return BigInteger.valueOf(251);
            }
        };
        assertThrows(KeyGenerationException.class, () -> alwaysSame.generate(16));
    }

    @Test
    void privateKeyToStringHidesMaterial() {
        PaillierKeyPair kp = new PaillierKeyGenerator().generate(64);
        String s = kp.privateKey().toString();
        assertFalse(s.contains(kp.privateKey().getLambda().toString()));
        assertTrue(s.contains(kp.publicKey().getKeyId()));
    }

    private static SecureRandom seeded(long seed) throws Exception {
        SecureRandom r = SecureRandom.getInstance("SHA1PRNG");
        r.setSeed(seed);
        return r;
    }
}
