package com.pdp.analytics;

import com.pdp.common.Feature;
import com.pdp.crypto.Ciphertext;
import com.pdp.crypto.HomomorphicCryptoService;
import com.pdp.crypto.KeyMismatchException;
import com.pdp.crypto.PaillierPublicKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable running homomorphic sum of encrypted feature vectors.
 *
 * The empty accumulator holds no ciphertexts; the first vector added becomes
 * the sum as-is. Adding and merging return new instances, so worker-local
 * partials can be combined at a join point without shared mutation.
 */
public final class AggregateAccumulator {
    private final PaillierPublicKey publicKey;
    private final List<Ciphertext> lanes;   // null when empty
    private final int contributors;

    private AggregateAccumulator(PaillierPublicKey publicKey, List<Ciphertext> lanes, int contributors) {
        this.publicKey = publicKey;
        this.lanes = lanes;
        this.contributors = contributors;
    }

    public static AggregateAccumulator empty(PaillierPublicKey publicKey) {
        return new AggregateAccumulator(Objects.requireNonNull(publicKey, "publicKey cannot be null"), null, 0);
    }

    public AggregateAccumulator add(EncryptedFeatureVector vector, HomomorphicCryptoService crypto) {
        Objects.requireNonNull(vector, "vector cannot be null");
        requireKey(vector.getKeyId());
        if (lanes == null) {
            return new AggregateAccumulator(publicKey, vector.getLanes(), 1);
        }
        return new AggregateAccumulator(publicKey, combine(lanes, vector.getLanes(), crypto), contributors + 1);
    }

    public AggregateAccumulator merge(AggregateAccumulator other, HomomorphicCryptoService crypto) {
        Objects.requireNonNull(other, "other cannot be null");
        requireKey(other.publicKey.getKeyId());
        if (other.lanes == null) return this;
        if (lanes == null) return other;
        return new AggregateAccumulator(publicKey, combine(lanes, other.lanes, crypto),
                contributors + other.contributors);
    }

    public boolean isEmpty() {
        return lanes == null;
    }

    /** Number of user vectors folded in. */
    public int getContributors() {
        return contributors;
    }

    public PaillierPublicKey getPublicKey() {
        return publicKey;
    }

    /**
     * @throws EmptyAggregateException if nothing was accumulated
     */
    public Ciphertext get(Feature feature) {
        if (lanes == null) {
            throw new EmptyAggregateException("Aggregate has no contributions");
        }
        return lanes.get(feature.ordinal());
    }

    private List<Ciphertext> combine(List<Ciphertext> x, List<Ciphertext> y, HomomorphicCryptoService crypto) {
        Objects.requireNonNull(crypto, "crypto cannot be null");
        List<Ciphertext> out = new ArrayList<>(x.size());
        for (int i = 0; i < x.size(); i++) {
            out.add(crypto.addEncrypted(x.get(i), y.get(i), publicKey));
        }
        return List.copyOf(out);
    }

    private void requireKey(String keyId) {
        if (!publicKey.getKeyId().equals(keyId)) {
            throw new KeyMismatchException(publicKey.getKeyId(), keyId);
        }
    }

    @Override
    public String toString() {
        return "AggregateAccumulator{key=" + publicKey.getKeyId() + ", contributors=" + contributors + "}";
    }
}
