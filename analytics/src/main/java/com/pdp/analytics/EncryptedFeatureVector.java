package com.pdp.analytics;

import com.pdp.common.Feature;
import com.pdp.crypto.Ciphertext;
import com.pdp.crypto.KeyMismatchException;

import java.util.List;
import java.util.Objects;

/**
 * One ciphertext per {@link Feature} lane, all under the same key.
 */
public final class EncryptedFeatureVector {
    private final List<Ciphertext> lanes;
    private final String keyId;

    public EncryptedFeatureVector(List<Ciphertext> lanes) {
        Objects.requireNonNull(lanes, "lanes cannot be null");
        if (lanes.size() != Feature.count()) {
            throw new IllegalArgumentException("Expected " + Feature.count() + " lanes, got " + lanes.size());
        }
        String id = lanes.get(0).getKeyId();
        for (Ciphertext c : lanes) {
            if (!id.equals(c.getKeyId())) {
                throw new KeyMismatchException(id, c.getKeyId());
            }
        }
        this.lanes = List.copyOf(lanes);
        this.keyId = id;
    }

    public Ciphertext get(Feature feature) {
        return lanes.get(feature.ordinal());
    }

    public List<Ciphertext> getLanes() {
        return lanes;
    }

    public String getKeyId() {
        return keyId;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EncryptedFeatureVector that)) return false;
        return lanes.equals(that.lanes);
    }

    @Override
    public int hashCode() {
        return lanes.hashCode();
    }

    @Override
    public String toString() {
        return "EncryptedFeatureVector{key=" + keyId + "}";
    }
}
