package com.whereq.governor.model;

import com.whereq.governor.exception.InvalidLimitsException;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.ArrayList;
import java.util.List;

/**
 * Upper bounds for runtime resource usage.
 * Replaced wholesale by {@code BudgetManager.applyLimits}.
 */
@Value
@With
@Builder(toBuilder = true)
public class BudgetLimits {

    /**
     * Maximum projected CPU usage in percent
     */
    @Builder.Default
    double maxCpuPercent = 85.0;

    /**
     * Maximum projected host memory in MB
     */
    @Builder.Default
    double maxMemMb = 16384.0;

    /**
     * Maximum projected accelerator memory in MB
     */
    @Builder.Default
    double maxAccelMemMb = 8192.0;

    /**
     * Maximum number of jobs holding capacity (queued + running). 0 admits nothing.
     */
    @Builder.Default
    int maxRunningJobs = 3;

    /**
     * Maximum number of delayed jobs. 0 means nothing may wait.
     */
    @Builder.Default
    int maxQueueDepth = 128;

    /**
     * Cache footprint to trim down to when memory pressure is detected
     */
    @Builder.Default
    double lazyAssetTargetMb = 512.0;

    /**
     * How long a metrics snapshot stays fresh
     */
    @Builder.Default
    long evaluationIntervalMs = 2000;

    public static BudgetLimits defaults() {
        return BudgetLimits.builder().build();
    }

    /**
     * Check every field against its invariant
     *
     * @return this, for chaining
     * @throws InvalidLimitsException listing every violated field
     */
    public BudgetLimits validate() {
        List<String> violations = new ArrayList<>();
        checkNonNegative(violations, "maxCpuPercent", maxCpuPercent);
        checkNonNegative(violations, "maxMemMb", maxMemMb);
        checkNonNegative(violations, "maxAccelMemMb", maxAccelMemMb);
        checkNonNegative(violations, "lazyAssetTargetMb", lazyAssetTargetMb);
        if (maxRunningJobs < 0) {
            violations.add("maxRunningJobs must be >= 0, got " + maxRunningJobs);
        }
        if (maxQueueDepth < 0) {
            violations.add("maxQueueDepth must be >= 0, got " + maxQueueDepth);
        }
        if (evaluationIntervalMs < 0) {
            violations.add("evaluationIntervalMs must be >= 0, got " + evaluationIntervalMs);
        }
        if (!violations.isEmpty()) {
            throw new InvalidLimitsException(violations);
        }
        return this;
    }

    private static void checkNonNegative(List<String> violations, String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            violations.add(field + " must be a finite value >= 0, got " + value);
        }
    }
}
