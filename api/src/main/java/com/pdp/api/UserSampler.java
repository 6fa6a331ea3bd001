package com.pdp.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Uniform sampling without replacement (partial Fisher–Yates).
 * A request larger than the population is clamped to the population size.
 */
public class UserSampler {
    private static final Logger logger = LoggerFactory.getLogger(UserSampler.class);

    private final Random random;

    public UserSampler() {
        this(new SecureRandom());
    }

    public UserSampler(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /** Seeded sampler when {@code seed} is given, otherwise backed by {@link SecureRandom}. */
    public static UserSampler forSeed(Long seed) {
        return seed == null ? new UserSampler() : new UserSampler(new Random(seed));
    }

    public synchronized List<String> sample(List<String> population, int requested) {
        Objects.requireNonNull(population, "population");
        if (requested < 0) {
            throw new IllegalArgumentException("Sample size must be non-negative: " + requested);
        }
        int k = Math.min(requested, population.size());
        if (k < requested) {
            logger.warn("Requested sample of {} exceeds population of {}; clamping", requested, population.size());
        }
        List<String> pool = new ArrayList<>(population);
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(pool.size() - i);
            Collections.swap(pool, i, j);
        }
        return List.copyOf(pool.subList(0, k));
    }
}
