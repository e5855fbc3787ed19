package com.whereq.governor.config;

import com.whereq.governor.cache.UnloadFailurePolicy;
import com.whereq.governor.model.BudgetLimits;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Governor.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "governor")
@Data
public class GovernorProperties {

    private LimitsConfig limits = new LimitsConfig();

    private MetricsConfig metrics = new MetricsConfig();

    private CacheConfig cache = new CacheConfig();

    private ProfilerConfig profiler = new ProfilerConfig();

    private RefreshConfig refresh = new RefreshConfig();

    /**
     * Initial budget limits; replaced at runtime through {@code BudgetManager.applyLimits}.
     */
    @Data
    public static class LimitsConfig {
        private double maxCpuPercent = 85.0;

        private double maxMemMb = 16384.0;

        private double maxAccelMemMb = 8192.0;

        /**
         * Maximum number of queued plus running jobs.
         */
        private int maxRunningJobs = 3;

        /**
         * Maximum number of delayed jobs before registrations are rejected.
         */
        private int maxQueueDepth = 128;

        /**
         * Cache footprint to trim down to under memory pressure.
         */
        private double lazyAssetTargetMb = 512.0;

        /**
         * How long a metrics snapshot is reused, in milliseconds.
         */
        private long evaluationIntervalMs = 2000;

        public BudgetLimits toBudgetLimits() {
            return BudgetLimits.builder()
                .maxCpuPercent(maxCpuPercent)
                .maxMemMb(maxMemMb)
                .maxAccelMemMb(maxAccelMemMb)
                .maxRunningJobs(maxRunningJobs)
                .maxQueueDepth(maxQueueDepth)
                .lazyAssetTargetMb(lazyAssetTargetMb)
                .evaluationIntervalMs(evaluationIntervalMs)
                .build();
        }
    }

    @Data
    public static class MetricsConfig {
        /**
         * Upper bound for a single metrics poll. Zero polls inline without a bound.
         */
        private Duration pollTimeout = Duration.ofMillis(500);
    }

    @Data
    public static class CacheConfig {
        /**
         * What to do with an asset whose unload callback fails.
         * REMOVE: drop it from accounting anyway (default)
         * RETAIN_STALE: keep it, marked stale, and skip it for the rest of the pass
         */
        private UnloadFailurePolicy unloadFailurePolicy = UnloadFailurePolicy.REMOVE;
    }

    @Data
    public static class ProfilerConfig {
        private boolean enabled = true;

        /**
         * Number of recent spans and marks kept.
         */
        private int historySize = 256;
    }

    @Data
    public static class RefreshConfig {
        /**
         * Enable the periodic delayed-queue refresh.
         */
        private boolean enabled = true;

        /**
         * Delay between two refresh runs, in milliseconds.
         */
        private long intervalMs = 2000;
    }
}
