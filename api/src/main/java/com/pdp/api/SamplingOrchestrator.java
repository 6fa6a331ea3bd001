package com.pdp.api;

import com.pdp.analytics.AggregateAccumulator;
import com.pdp.analytics.AggregateStatistics;
import com.pdp.analytics.CohortClassifier;
import com.pdp.analytics.CohortTally;
import com.pdp.analytics.EncryptedFeatureVector;
import com.pdp.analytics.FeatureExtractor;
import com.pdp.analytics.PrivacyPreservingAnalytics;
import com.pdp.common.BrowsingEvent;
import com.pdp.common.FeatureVector;
import com.pdp.common.PopulationIndex;
import com.pdp.crypto.PaillierKeyGenerator;
import com.pdp.crypto.PaillierPublicKey;
import com.pdp.key.KeyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Drives one sampled analysis end to end:
 * sample → extract → encrypt → fold → decrypt aggregate → report.
 *
 * Every {@link #run} opens its own key session and closes it when done.
 * With parallelism > 1 the sample is cut into contiguous chunks; each worker
 * folds its chunk into a local accumulator and cohort tally, and the partials
 * are merged on the calling thread in chunk order.
 */
public class SamplingOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(SamplingOrchestrator.class);

    private final PaillierKeyGenerator keyGenerator;
    private final int keyBits;
    private final FeatureExtractor extractor;
    private final PrivacyPreservingAnalytics analytics;
    private final CohortClassifier cohortClassifier;
    private final UserSampler sampler;
    private final MicrometerProfiler profiler;
    private final int parallelism;

    public SamplingOrchestrator(PaillierKeyGenerator keyGenerator,
                                int keyBits,
                                FeatureExtractor extractor,
                                PrivacyPreservingAnalytics analytics,
                                CohortClassifier cohortClassifier,
                                UserSampler sampler,
                                MicrometerProfiler profiler,
                                int parallelism) {
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator");
        this.keyBits = keyBits;
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.analytics = Objects.requireNonNull(analytics, "analytics");
        this.cohortClassifier = Objects.requireNonNull(cohortClassifier, "cohortClassifier");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.profiler = Objects.requireNonNull(profiler, "profiler");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * @throws IOException if the population index cannot supply a sampled user's history
     * @throws com.pdp.analytics.EmptyAggregateException if the sample is empty
     * @throws IllegalStateException if a worker fails
     */
    public AnalyticsReport run(PopulationIndex population, int sampleSize) throws IOException {
        Objects.requireNonNull(population, "population");
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be >= 1: " + sampleSize);
        }

        profiler.start("sample");
        List<String> populationIds = population.getUserIds();
        List<String> sample = sampler.sample(populationIds, sampleSize);
        profiler.stop("sample");
        logger.info("Sampled {} of {} users (requested {})", sample.size(), populationIds.size(), sampleSize);

        profiler.start("keygen");
        KeyManager session = new KeyManager(keyGenerator, keyBits);
        profiler.stop("keygen");

        try (session) {
            PaillierPublicKey pub = session.getPublicKey();
            List<ChunkResult> partials = processAll(population, sample, session);

            List<AggregateAccumulator> aggregates = new ArrayList<>(partials.size());
            CohortTally cohort = CohortTally.EMPTY;
            for (ChunkResult r : partials) {
                aggregates.add(r.aggregate());
                cohort = cohort.merge(r.cohort());
            }
            AggregateAccumulator total = analytics.merge(aggregates, pub);
            if (total.getContributors() != session.getContributionCount()) {
                throw new IllegalStateException("Aggregate covers " + total.getContributors()
                        + " users but " + session.getContributionCount() + " contributed");
            }

            AggregateStatistics stats = analytics.decryptAndAnalyze(total, session.getPrivateKey());

            AnalyticsReport report = new AnalyticsReport(
                    stats,
                    AnalyticsReport.CohortStatistics.from(cohort),
                    new AnalyticsReport.Metadata(
                            sample.size(),
                            sampleSize,
                            populationIds.size(),
                            population.getDateRange(),
                            pub.getBitLength(),
                            session.getSessionId(),
                            Instant.now().toString()));
            logger.info("Report ready: {} users, {} visits, session {}",
                    sample.size(), stats.totalVisits(), session.getSessionId());
            return report;
        }
    }

    private List<ChunkResult> processAll(PopulationIndex population, List<String> sample, KeyManager session)
            throws IOException {
        int chunks = Math.max(1, Math.min(parallelism, sample.size()));
        if (chunks == 1) {
            try {
                return List.of(processChunk(population, sample, 0, session));
            } catch (UncheckedIOException e) {
                throw e.getCause();
            } catch (RuntimeException e) {
                throw new IllegalStateException("Aggregation worker failed", e);
            }
        }

        int chunkSize = (sample.size() + chunks - 1) / chunks;
        ExecutorService pool = Executors.newFixedThreadPool(chunks);
        try {
            List<Future<ChunkResult>> futures = new ArrayList<>(chunks);
            for (int from = 0; from < sample.size(); from += chunkSize) {
                List<String> slice = sample.subList(from, Math.min(sample.size(), from + chunkSize));
                int offset = from;
                futures.add(pool.submit(() -> processChunk(population, slice, offset, session)));
            }
            List<ChunkResult> out = new ArrayList<>(futures.size());
            for (Future<ChunkResult> f : futures) {
                out.add(f.get());
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while aggregating", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException u) {
                throw u.getCause();
            }
            throw new IllegalStateException("Aggregation worker failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    /** Folds one contiguous slice of the sample into a worker-local partial. */
    private ChunkResult processChunk(PopulationIndex population, List<String> userIds, int offset,
                                     KeyManager session) {
        PaillierPublicKey pub = session.getPublicKey();
        AggregateAccumulator acc = AggregateAccumulator.empty(pub);
        CohortTally cohort = CohortTally.EMPTY;

        for (int i = 0; i < userIds.size(); i++) {
            String userId = userIds.get(i);
            List<BrowsingEvent> events;
            try {
                events = population.getEvents(userId);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load history of a sampled user", e);
            }

            long t0 = System.nanoTime();
            FeatureVector features = extractor.extract(events);
            long extractNs = System.nanoTime() - t0;
            profiler.record("extract", extractNs);

            cohort = cohortClassifier.tally(cohort, features);

            long t1 = System.nanoTime();
            EncryptedFeatureVector encrypted = analytics.encryptUser(features, pub);
            long encryptNs = System.nanoTime() - t1;

            session.registerContribution(userId);
            acc = analytics.accumulate(acc, encrypted);

            profiler.recordUser("u" + (offset + i), events.size(), extractNs / 1e6, encryptNs / 1e6);
            if (logger.isDebugEnabled()) {
                logger.debug("Processed user #{}: {} events, {}", offset + i, events.size(), features);
            }
        }
        return new ChunkResult(acc, cohort);
    }

    private record ChunkResult(AggregateAccumulator aggregate, CohortTally cohort) {
    }
}
