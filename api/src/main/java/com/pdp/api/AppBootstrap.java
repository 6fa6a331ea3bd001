package com.pdp.api;

import com.pdp.analytics.CategoryMarkers;
import com.pdp.analytics.CohortClassifier;
import com.pdp.analytics.FeatureExtractor;
import com.pdp.analytics.PrivacyPreservingAnalytics;
import com.pdp.common.Profiler;
import com.pdp.config.AnalyticsConfig;
import com.pdp.crypto.HomomorphicCryptoService;
import com.pdp.crypto.PaillierCryptoService;
import com.pdp.crypto.PaillierKeyGenerator;
import io.micrometer.core.instrument.MeterRegistry;

import java.security.SecureRandom;
import java.util.Objects;

public final class AppBootstrap {

    public static final class Components {
        public final AnalyticsConfig config;
        public final HomomorphicCryptoService crypto;
        public final FeatureExtractor extractor;
        public final PrivacyPreservingAnalytics analytics;
        public final MicrometerProfiler profiler;
        public final SamplingOrchestrator orchestrator;

        Components(AnalyticsConfig cfg,
                   HomomorphicCryptoService crypto,
                   FeatureExtractor extractor,
                   PrivacyPreservingAnalytics analytics,
                   MicrometerProfiler profiler,
                   SamplingOrchestrator orchestrator) {
            this.config = cfg;
            this.crypto = crypto;
            this.extractor = extractor;
            this.analytics = analytics;
            this.profiler = profiler;
            this.orchestrator = orchestrator;
        }
    }

    public static Components init(AnalyticsConfig cfg, MeterRegistry registry) {
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(registry, "registry");

        SecureRandom random = new SecureRandom();

        // Crypto
        PaillierKeyGenerator keyGenerator =
                new PaillierKeyGenerator(random, cfg.getKeygen().getMaxPrimeAttempts());
        HomomorphicCryptoService crypto = new PaillierCryptoService(random, registry);

        // Features (category lists are configuration, not code)
        AnalyticsConfig.CategoryConfig a = cfg.getCategories().getCategoryA();
        AnalyticsConfig.CategoryConfig b = cfg.getCategories().getCategoryB();
        FeatureExtractor extractor = new FeatureExtractor(
                new CategoryMarkers(a.getName(), a.getMarkers()),
                new CategoryMarkers(b.getName(), b.getMarkers()));

        PrivacyPreservingAnalytics analytics = new PrivacyPreservingAnalytics(crypto, registry);
        CohortClassifier cohort = new CohortClassifier(cfg.getCohort().getPrimaryShareThreshold());
        UserSampler sampler = UserSampler.forSeed(cfg.getSampling().getSeed());
        MicrometerProfiler profiler = new MicrometerProfiler(registry, new Profiler());

        SamplingOrchestrator orchestrator = new SamplingOrchestrator(
                keyGenerator, cfg.getKeyBits(), extractor, analytics, cohort, sampler, profiler,
                cfg.getParallelism());

        return new Components(cfg, crypto, extractor, analytics, profiler, orchestrator);
    }

    private AppBootstrap() {}
}
