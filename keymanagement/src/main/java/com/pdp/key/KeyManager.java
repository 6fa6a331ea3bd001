package com.pdp.key;

import com.pdp.crypto.Ciphertext;
import com.pdp.crypto.KeyMismatchException;
import com.pdp.crypto.PaillierKeyGenerator;
import com.pdp.crypto.PaillierKeyPair;
import com.pdp.crypto.PaillierPrivateKey;
import com.pdp.crypto.PaillierPublicKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;

/**
 * KeyManager owns the Paillier key pair of exactly one analytics session.
 * Keys live in process memory only and are dropped on {@link #close()};
 * nothing is persisted and nothing is shared between sessions.
 */
public class KeyManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(KeyManager.class);

    private final String sessionId;
    private final PaillierPublicKey publicKey;
    private final KeyUsageTracker usageTracker = new KeyUsageTracker();
    private volatile PaillierPrivateKey privateKey;

    public KeyManager(PaillierKeyGenerator generator, int keyBits) {
        Objects.requireNonNull(generator, "generator");
        PaillierKeyPair pair = generator.generate(keyBits);
        this.sessionId = UUID.randomUUID().toString();
        this.publicKey = pair.publicKey();
        this.privateKey = pair.privateKey();
        logger.info("Session {} opened with key {} ({} bits)",
                sessionId, publicKey.getKeyId(), publicKey.getBitLength());
    }

    public String getSessionId() {
        return sessionId;
    }

    public PaillierPublicKey getPublicKey() {
        return publicKey;
    }

    /**
     * @throws IllegalStateException once the session is closed
     */
    public PaillierPrivateKey getPrivateKey() {
        PaillierPrivateKey k = privateKey;
        if (k == null) {
            throw new IllegalStateException("Session " + sessionId + " is closed");
        }
        return k;
    }

    /**
     * Checks that a ciphertext was produced under this session's key.
     *
     * @throws KeyMismatchException otherwise
     */
    public void requireOwned(Ciphertext ciphertext) {
        Objects.requireNonNull(ciphertext, "ciphertext");
        if (!publicKey.getKeyId().equals(ciphertext.getKeyId())) {
            throw new KeyMismatchException(publicKey.getKeyId(), ciphertext.getKeyId());
        }
    }

    /**
     * Registers one subject's contribution under this session's key.
     *
     * @throws IllegalStateException if the subject already contributed
     */
    public void registerContribution(String subjectId) {
        if (!usageTracker.trackEncryption(subjectId, publicKey.getKeyId())) {
            throw new IllegalStateException("Subject contributed twice in session " + sessionId);
        }
    }

    public int getContributionCount() {
        return usageTracker.getSubjectCount(publicKey.getKeyId());
    }

    public boolean isClosed() {
        return privateKey == null;
    }

    @Override
    public void close() {
        if (privateKey != null) {
            privateKey = null;
            usageTracker.release(publicKey.getKeyId());
            logger.info("Session {} closed, private key released", sessionId);
        }
    }
}
