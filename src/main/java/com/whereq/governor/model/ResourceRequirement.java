package com.whereq.governor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Declared resource cost of a job, supplied by the caller at registration time
 */
@Value
public class ResourceRequirement {
    public static final ResourceRequirement NONE = new ResourceRequirement(0.0, 0.0, 0.0);

    /**
     * CPU share in percent of the whole machine
     */
    double cpuPercent;

    /**
     * Host memory in MB
     */
    double memMb;

    /**
     * Accelerator (GPU) memory in MB, zero when omitted
     */
    double accelMemMb;

    @Builder
    public ResourceRequirement(double cpuPercent, double memMb, double accelMemMb) {
        this.cpuPercent = requireCost("cpuPercent", cpuPercent);
        this.memMb = requireCost("memMb", memMb);
        this.accelMemMb = requireCost("accelMemMb", accelMemMb);
    }

    /**
     * Cost without accelerator memory
     */
    public static ResourceRequirement of(double cpuPercent, double memMb) {
        return new ResourceRequirement(cpuPercent, memMb, 0.0);
    }

    public static ResourceRequirement of(double cpuPercent, double memMb, double accelMemMb) {
        return new ResourceRequirement(cpuPercent, memMb, accelMemMb);
    }

    /**
     * Convert to an additive load vector
     */
    public ResourceUsage toUsage() {
        return new ResourceUsage(cpuPercent, memMb, accelMemMb);
    }

    private static double requireCost(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new IllegalArgumentException("Declared cost " + field + " must be a finite value >= 0, got " + value);
        }
        return value;
    }
}
