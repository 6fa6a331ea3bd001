package com.pdp.analytics;

import com.pdp.common.Feature;
import com.pdp.common.FeatureVector;
import com.pdp.crypto.Ciphertext;
import com.pdp.crypto.HomomorphicCryptoService;
import com.pdp.crypto.PaillierPrivateKey;
import com.pdp.crypto.PaillierPublicKey;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Encrypts per-user feature vectors, folds them homomorphically and decrypts
 * only the aggregate. Individual ciphertexts are never decrypted here.
 */
public class PrivacyPreservingAnalytics {
    private static final Logger logger = LoggerFactory.getLogger(PrivacyPreservingAnalytics.class);

    public static final String TIMER = "pdp.operation.duration";

    private final HomomorphicCryptoService crypto;
    private final Timer encryptTimer;
    private final Timer aggregateTimer;
    private final Timer decryptTimer;

    public PrivacyPreservingAnalytics(HomomorphicCryptoService crypto) {
        this(crypto, new SimpleMeterRegistry());
    }

    public PrivacyPreservingAnalytics(HomomorphicCryptoService crypto, MeterRegistry metrics) {
        this.crypto = Objects.requireNonNull(crypto, "crypto cannot be null");
        Objects.requireNonNull(metrics, "metrics cannot be null");
        this.encryptTimer = Timer.builder(TIMER).tag("op", "encrypt").register(metrics);
        this.aggregateTimer = Timer.builder(TIMER).tag("op", "aggregate").register(metrics);
        this.decryptTimer = Timer.builder(TIMER).tag("op", "decrypt").register(metrics);
    }

    /** Encrypts each lane independently under {@code publicKey}. */
    public EncryptedFeatureVector encryptUser(FeatureVector vector, PaillierPublicKey publicKey) {
        Objects.requireNonNull(vector, "vector cannot be null");
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        return encryptTimer.record(() -> {
            List<Ciphertext> lanes = new ArrayList<>(Feature.count());
            for (Feature f : Feature.values()) {
                lanes.add(crypto.encrypt(vector.get(f), publicKey));
            }
            return new EncryptedFeatureVector(lanes);
        });
    }

    /**
     * Sequential left fold. An empty input gives {@link AggregateAccumulator#empty}.
     */
    public AggregateAccumulator aggregate(Collection<EncryptedFeatureVector> vectors, PaillierPublicKey publicKey) {
        Objects.requireNonNull(vectors, "vectors cannot be null");
        return aggregateTimer.record(() -> {
            AggregateAccumulator acc = AggregateAccumulator.empty(publicKey);
            for (EncryptedFeatureVector v : vectors) {
                acc = acc.add(v, crypto);
            }
            return acc;
        });
    }

    /** Adds one vector to a partial aggregate. */
    public AggregateAccumulator accumulate(AggregateAccumulator acc, EncryptedFeatureVector vector) {
        return aggregateTimer.record(() -> acc.add(vector, crypto));
    }

    /** Combines partial aggregates; each partial must be passed exactly once. */
    public AggregateAccumulator merge(List<AggregateAccumulator> partials, PaillierPublicKey publicKey) {
        Objects.requireNonNull(partials, "partials cannot be null");
        return aggregateTimer.record(() -> {
            AggregateAccumulator acc = AggregateAccumulator.empty(publicKey);
            for (AggregateAccumulator p : partials) {
                acc = acc.merge(p, crypto);
            }
            return acc;
        });
    }

    /**
     * Decrypts the four aggregate lanes and derives percentages.
     *
     * @throws EmptyAggregateException if no user was aggregated
     */
    public AggregateStatistics decryptAndAnalyze(AggregateAccumulator aggregate, PaillierPrivateKey privateKey) {
        Objects.requireNonNull(aggregate, "aggregate cannot be null");
        Objects.requireNonNull(privateKey, "privateKey cannot be null");
        if (aggregate.isEmpty()) {
            throw new EmptyAggregateException("Cannot decrypt an aggregate over zero users");
        }
        long[] totals = decryptTimer.record(() -> {
            long[] out = new long[Feature.count()];
            for (Feature f : Feature.values()) {
                BigInteger m = crypto.decrypt(aggregate.get(f), privateKey);
                out[f.ordinal()] = m.longValueExact();
            }
            return out;
        });
        logger.info("Decrypted aggregate over {} users", aggregate.getContributors());
        return AggregateStatistics.of(totals[0], totals[1], totals[2], totals[3]);
    }
}
